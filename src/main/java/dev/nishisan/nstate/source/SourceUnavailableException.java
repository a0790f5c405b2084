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

import dev.nishisan.nstate.common.NodeId;

import java.io.IOException;
import java.util.Objects;

/**
 * A data source could not be reached or did not answer in time. Within a fan-out query this
 * turns into a warning; for log streams it moves the stream to ERROR.
 */
public class SourceUnavailableException extends IOException {
    private final NodeId sourceId;

    public SourceUnavailableException(NodeId sourceId, String message) {
        super("Source " + sourceId + " unavailable: " + message);
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
    }

    public SourceUnavailableException(NodeId sourceId, String message, Throwable cause) {
        super("Source " + sourceId + " unavailable: " + message, cause);
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
    }

    public NodeId sourceId() {
        return sourceId;
    }
}
