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

package dev.nishisan.nstate.source;

import dev.nishisan.nstate.cluster.transport.Transport;
import dev.nishisan.nstate.common.NodeInfo;

import java.time.Duration;
import java.util.Objects;

/**
 * Connects to sources through the transport, except for the local node whose own sources
 * are called directly when it has any.
 */
public final class TransportSourceConnector implements SourceConnector {
    private final Transport transport;
    private final Duration requestTimeout;
    private final StateSource localState;
    private final LogSource localLogs;

    public TransportSourceConnector(Transport transport, Duration requestTimeout) {
        this(transport, requestTimeout, null, null);
    }

    public TransportSourceConnector(Transport transport,
                                    Duration requestTimeout,
                                    StateSource localState,
                                    LogSource localLogs) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.localState = localState;
        this.localLogs = localLogs;
    }

    @Override
    public StateSource stateSource(NodeInfo node) {
        if (localState != null && isLocal(node)) {
            return localState;
        }
        return new RemoteSource(transport, node, requestTimeout);
    }

    @Override
    public LogSource logSource(NodeInfo node) {
        if (localLogs != null && isLocal(node)) {
            return localLogs;
        }
        return new RemoteSource(transport, node, requestTimeout);
    }

    private boolean isLocal(NodeInfo node) {
        return node.nodeId().equals(transport.local().nodeId());
    }
}
