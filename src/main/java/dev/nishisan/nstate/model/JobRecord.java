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

package dev.nishisan.nstate.model;

import java.io.Serial;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class JobRecord extends StateRecord {
    @Serial
    private static final long serialVersionUID = 1L;

    public static final String ENTRYPOINT = "entrypoint";
    public static final String TYPE = "type";
    public static final String SUBMISSION_ID = "submission_id";
    public static final String DRIVER_NODE_ID = "driver_node_id";
    public static final String START_TIME = "start_time";
    public static final String END_TIME = "end_time";
    public static final String MESSAGE = "message";

    private static final Set<String> SUMMARY_FIELDS =
            Set.of(ENTRYPOINT, TYPE, SUBMISSION_ID, START_TIME, END_TIME, FIELD_STATE);

    public JobRecord(String id, Map<String, ?> immutableMetadata, Map<String, ?> mutableState, DetailLevel detailLevel) {
        super(id, immutableMetadata, mutableState, detailLevel);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.JOB;
    }

    public Optional<String> entrypoint() {
        return field(ENTRYPOINT);
    }

    @Override
    Set<String> summaryFields() {
        return SUMMARY_FIELDS;
    }

    @Override
    StateRecord rebuild(Map<String, Object> immutableMetadata, Map<String, Object> mutableState, DetailLevel detailLevel) {
        return new JobRecord(id(), immutableMetadata, mutableState, detailLevel);
    }
}
