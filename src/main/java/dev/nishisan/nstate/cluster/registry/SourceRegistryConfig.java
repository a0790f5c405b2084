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

import java.time.Duration;
import java.util.Objects;

/**
 * Liveness settings of the {@link SourceRegistry}.
 */
public final class SourceRegistryConfig {
    private final Duration heartbeatTimeout;
    private final Duration evictionInterval;

    private SourceRegistryConfig(Duration heartbeatTimeout, Duration evictionInterval) {
        this.heartbeatTimeout = heartbeatTimeout;
        this.evictionInterval = evictionInterval;
    }

    public static SourceRegistryConfig defaults() {
        return new SourceRegistryConfig(Duration.ofSeconds(5), Duration.ofSeconds(1));
    }

    public static SourceRegistryConfig of(Duration heartbeatTimeout, Duration evictionInterval) {
        Objects.requireNonNull(heartbeatTimeout, "heartbeatTimeout");
        Objects.requireNonNull(evictionInterval, "evictionInterval");
        if (heartbeatTimeout.isNegative() || heartbeatTimeout.isZero()) {
            throw new IllegalArgumentException("heartbeatTimeout must be positive");
        }
        if (evictionInterval.isNegative() || evictionInterval.isZero()) {
            throw new IllegalArgumentException("evictionInterval must be positive");
        }
        return new SourceRegistryConfig(heartbeatTimeout, evictionInterval);
    }

    public Duration heartbeatTimeout() {
        return heartbeatTimeout;
    }

    public Duration evictionInterval() {
        return evictionInterval;
    }
}
