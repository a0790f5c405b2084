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

package dev.nishisan.nstate.query;

import dev.nishisan.nstate.common.NodeInfo;
import dev.nishisan.nstate.source.RecordBatch;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one data source within a fan-out. Exactly three variants exist.
 */
public interface SourceResponse {

    NodeInfo source();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Human readable line for the snapshot warnings; empty for successes.
     */
    String describeFailure();

    record Success(NodeInfo source, RecordBatch batch) implements SourceResponse {
        public Success {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(batch, "batch");
        }

        @Override
        public String describeFailure() {
            return "";
        }
    }

    record PartialFailure(NodeInfo source, String reason) implements SourceResponse {
        public PartialFailure {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public String describeFailure() {
            return "Data source " + source.nodeId() + " (" + source.address() + ") failed: " + reason;
        }
    }

    record Timeout(NodeInfo source, Duration timeout) implements SourceResponse {
        public Timeout {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(timeout, "timeout");
        }

        @Override
        public String describeFailure() {
            return "Data source " + source.nodeId() + " (" + source.address() + ") did not answer within " + timeout;
        }
    }
}
