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

package dev.nishisan.nstate.cluster.transport;

import dev.nishisan.nstate.common.NodeInfo;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Settings of a {@link TcpTransport}: the local node, the seed addresses dialled at start and
 * after every lost connection, and the socket timings.
 * <p>
 * Seeds are plain addresses. The node behind a seed is only known once its handshake arrives,
 * so a seed pointing at the local listener is dropped when added.
 */
public final class TcpTransportConfig {
    private final NodeInfo local;
    private final Set<InetSocketAddress> seeds;
    private final Duration connectTimeout;
    private final Duration reconnectInterval;

    private TcpTransportConfig(Builder builder) {
        this.local = builder.local;
        this.seeds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.seeds));
        this.connectTimeout = builder.connectTimeout;
        this.reconnectInterval = builder.reconnectInterval;
    }

    public NodeInfo local() {
        return local;
    }

    /**
     * Unresolved seed addresses in the order they were added.
     */
    public Set<InetSocketAddress> seeds() {
        return seeds;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration reconnectInterval() {
        return reconnectInterval;
    }

    public static Builder builder(NodeInfo local) {
        return new Builder(local);
    }

    public static final class Builder {
        private final NodeInfo local;
        private final Set<InetSocketAddress> seeds = new LinkedHashSet<>();
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration reconnectInterval = Duration.ofSeconds(3);

        private Builder(NodeInfo local) {
            this.local = Objects.requireNonNull(local, "local");
        }

        /**
         * Adds a seed address. The local listen address is skipped; duplicates collapse.
         *
         * @throws IllegalArgumentException when the host is blank or the port is out of range
         */
        public Builder addSeed(String host, int port) {
            Objects.requireNonNull(host, "host");
            if (host.isBlank()) {
                throw new IllegalArgumentException("Seed host must not be blank");
            }
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("Seed port out of range: " + port);
            }
            String trimmed = host.trim();
            if (trimmed.equalsIgnoreCase(local.host()) && port == local.port()) {
                return this;
            }
            seeds.add(InetSocketAddress.createUnresolved(trimmed, port));
            return this;
        }

        /**
         * Adds the address of a known node. The local node itself is skipped.
         */
        public Builder addSeed(NodeInfo seed) {
            if (seed.nodeId().equals(local.nodeId())) {
                return this;
            }
            return addSeed(seed.host(), seed.port());
        }

        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = requirePositive(timeout, "connectTimeout");
            return this;
        }

        public Builder reconnectInterval(Duration interval) {
            this.reconnectInterval = requirePositive(interval, "reconnectInterval");
            return this;
        }

        public TcpTransportConfig build() {
            if (connectTimeout.toMillis() > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("connectTimeout too large: " + connectTimeout);
            }
            return new TcpTransportConfig(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
