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

package dev.nishisan.nstate.logs;

import java.time.Duration;
import java.util.Objects;

/**
 * How a log is read: once (tail-limited) or followed.
 */
public final class LogStreamOptions {
    public static final int DEFAULT_TAIL_LINES = 1000;
    public static final int WHOLE_FILE = -1;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);
    public static final int DEFAULT_CHUNK_BYTES = 64 * 1024;

    private final boolean follow;
    private final int tailLines;
    private final Duration pollInterval;
    private final int chunkBytes;

    private LogStreamOptions(Builder builder) {
        this.follow = builder.follow;
        this.tailLines = builder.tailLines;
        this.pollInterval = builder.pollInterval;
        this.chunkBytes = builder.chunkBytes;
    }

    public static LogStreamOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean follow() {
        return follow;
    }

    /**
     * Trailing lines emitted first, {@link #WHOLE_FILE} for everything.
     */
    public int tailLines() {
        return tailLines;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public int chunkBytes() {
        return chunkBytes;
    }

    public Builder toBuilder() {
        return builder().follow(follow).tailLines(tailLines).pollInterval(pollInterval).chunkBytes(chunkBytes);
    }

    public static final class Builder {
        private boolean follow;
        private int tailLines = DEFAULT_TAIL_LINES;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private int chunkBytes = DEFAULT_CHUNK_BYTES;

        private Builder() {
        }

        public Builder follow(boolean follow) {
            this.follow = follow;
            return this;
        }

        public Builder tailLines(int tailLines) {
            if (tailLines < WHOLE_FILE) {
                throw new IllegalArgumentException("tailLines must be >= -1");
            }
            this.tailLines = tailLines;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            Objects.requireNonNull(pollInterval, "pollInterval");
            if (pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("pollInterval must be positive");
            }
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder chunkBytes(int chunkBytes) {
            if (chunkBytes <= 0) {
                throw new IllegalArgumentException("chunkBytes must be > 0");
            }
            this.chunkBytes = chunkBytes;
            return this;
        }

        public LogStreamOptions build() {
            return new LogStreamOptions(this);
        }
    }
}
