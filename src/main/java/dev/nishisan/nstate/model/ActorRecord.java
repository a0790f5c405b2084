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
import java.util.OptionalLong;
import java.util.Set;

/**
 * A long-lived worker handle. The hosting node and process id live in the mutable state since
 * an actor can be restarted elsewhere.
 */
public final class ActorRecord extends StateRecord {
    @Serial
    private static final long serialVersionUID = 1L;

    public static final String CLASS_NAME = "class_name";
    public static final String NAME = "name";
    public static final String JOB_ID = "job_id";
    public static final String NODE_ID = "node_id";
    public static final String PID = "pid";
    public static final String WORKER_ID = "worker_id";
    public static final String DEATH_CAUSE = "death_cause";

    private static final Set<String> SUMMARY_FIELDS = Set.of(CLASS_NAME, NAME, JOB_ID, NODE_ID, PID, FIELD_STATE);

    public ActorRecord(String id, Map<String, ?> immutableMetadata, Map<String, ?> mutableState, DetailLevel detailLevel) {
        super(id, immutableMetadata, mutableState, detailLevel);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.ACTOR;
    }

    public Optional<String> className() {
        return field(CLASS_NAME);
    }

    public Optional<String> nodeId() {
        return field(NODE_ID);
    }

    public OptionalLong pid() {
        return StateRecords.longField(this, PID);
    }

    public Optional<String> workerId() {
        return field(WORKER_ID);
    }

    @Override
    Set<String> summaryFields() {
        return SUMMARY_FIELDS;
    }

    @Override
    StateRecord rebuild(Map<String, Object> immutableMetadata, Map<String, Object> mutableState, DetailLevel detailLevel) {
        return new ActorRecord(id(), immutableMetadata, mutableState, detailLevel);
    }
}
