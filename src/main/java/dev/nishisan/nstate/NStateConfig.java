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

package dev.nishisan.nstate;

import dev.nishisan.nstate.common.NodeInfo;
import dev.nishisan.nstate.logs.LogStreamOptions;
import dev.nishisan.nstate.query.StateQuery;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration container used to bootstrap an {@link NStateNode} instance.
 */
public final class NStateConfig {
    private final NodeInfo local;
    private final Set<NodeInfo> seeds;
    private final Path logDirectory;
    private final Duration heartbeatInterval;
    private final Duration heartbeatTimeout;
    private final Duration connectTimeout;
    private final int maxRecords;
    private final Duration queryTimeout;
    private final boolean recordCallsite;
    private final int queryWorkers;
    private final LogStreamOptions logOptions;

    private NStateConfig(Builder builder) {
        this.local = builder.local;
        this.seeds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.seeds));
        this.logDirectory = builder.logDirectory;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.heartbeatTimeout = builder.heartbeatTimeout;
        this.connectTimeout = builder.connectTimeout;
        this.maxRecords = builder.maxRecords;
        this.queryTimeout = builder.queryTimeout;
        this.recordCallsite = builder.recordCallsite;
        this.queryWorkers = builder.queryWorkers;
        this.logOptions = builder.logOptions;
    }

    public NodeInfo local() {
        return local;
    }

    public Set<NodeInfo> seeds() {
        return seeds;
    }

    /**
     * Directory served to observers when this node is a source.
     */
    public Optional<Path> logDirectory() {
        return Optional.ofNullable(logDirectory);
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration heartbeatTimeout() {
        return heartbeatTimeout;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public int maxRecords() {
        return maxRecords;
    }

    public Duration queryTimeout() {
        return queryTimeout;
    }

    public boolean recordCallsite() {
        return recordCallsite;
    }

    public int queryWorkers() {
        return queryWorkers;
    }

    public LogStreamOptions logOptions() {
        return logOptions;
    }

    public static Builder builder(NodeInfo local) {
        return new Builder(local);
    }

    public static final class Builder {
        private final NodeInfo local;
        private final Set<NodeInfo> seeds = new LinkedHashSet<>();
        private Path logDirectory;
        private Duration heartbeatInterval = Duration.ofSeconds(1);
        private Duration heartbeatTimeout = Duration.ofSeconds(5);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private int maxRecords = StateQuery.DEFAULT_LIMIT;
        private Duration queryTimeout = StateQuery.DEFAULT_TIMEOUT;
        private boolean recordCallsite;
        private int queryWorkers = 16;
        private LogStreamOptions logOptions = LogStreamOptions.defaults();

        private Builder(NodeInfo local) {
            this.local = Objects.requireNonNull(local, "local");
        }

        public Builder addSeed(NodeInfo seed) {
            if (!seed.nodeId().equals(local.nodeId())) {
                seeds.add(seed);
            }
            return this;
        }

        public Builder logDirectory(Path logDirectory) {
            this.logDirectory = logDirectory;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
            return this;
        }

        public Builder heartbeatTimeout(Duration heartbeatTimeout) {
            this.heartbeatTimeout = Objects.requireNonNull(heartbeatTimeout, "heartbeatTimeout");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder maxRecords(int maxRecords) {
            if (maxRecords <= 0) {
                throw new IllegalArgumentException("maxRecords must be > 0");
            }
            this.maxRecords = maxRecords;
            return this;
        }

        public Builder queryTimeout(Duration queryTimeout) {
            this.queryTimeout = Objects.requireNonNull(queryTimeout, "queryTimeout");
            return this;
        }

        public Builder recordCallsite(boolean recordCallsite) {
            this.recordCallsite = recordCallsite;
            return this;
        }

        public Builder queryWorkers(int queryWorkers) {
            if (queryWorkers <= 0) {
                throw new IllegalArgumentException("queryWorkers must be > 0");
            }
            this.queryWorkers = queryWorkers;
            return this;
        }

        public Builder logOptions(LogStreamOptions logOptions) {
            this.logOptions = Objects.requireNonNull(logOptions, "logOptions");
            return this;
        }

        public NStateConfig build() {
            if (heartbeatTimeout.compareTo(heartbeatInterval) <= 0) {
                throw new IllegalArgumentException("heartbeatTimeout must be longer than heartbeatInterval");
            }
            return new NStateConfig(this);
        }
    }
}
