/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.nstate.cluster.registry;

import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

final class SourceEndpoint {
    private final NodeInfo info;
    private final AtomicLong lastSeen = new AtomicLong();
    private volatile boolean reachable;

    SourceEndpoint(NodeInfo info) {
        this.info = Objects.requireNonNull(info, "info");
        touch();
    }

    NodeId id() {
        return info.nodeId();
    }

    NodeInfo info() {
        return info;
    }

    void touch() {
        lastSeen.set(Instant.now().toEpochMilli());
        reachable = true;
    }

    long lastSeen() {
        return lastSeen.get();
    }

    void markUnreachable() {
        reachable = false;
    }

    boolean isReachable() {
        return reachable;
    }
}
