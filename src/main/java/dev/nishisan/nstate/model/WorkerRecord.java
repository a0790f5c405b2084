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
 * A worker process on one machine.
 */
public final class WorkerRecord extends StateRecord {
    @Serial
    private static final long serialVersionUID = 1L;

    public static final String WORKER_TYPE = "worker_type";
    public static final String NODE_ID = "node_id";
    public static final String IP = "ip";
    public static final String PID = "pid";
    public static final String EXIT_TYPE = "exit_type";
    public static final String EXIT_DETAIL = "exit_detail";

    private static final Set<String> SUMMARY_FIELDS = Set.of(WORKER_TYPE, NODE_ID, IP, PID, EXIT_TYPE, FIELD_STATE);

    public WorkerRecord(String id, Map<String, ?> immutableMetadata, Map<String, ?> mutableState, DetailLevel detailLevel) {
        super(id, immutableMetadata, mutableState, detailLevel);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.WORKER;
    }

    public Optional<String> workerType() {
        return field(WORKER_TYPE);
    }

    public OptionalLong pid() {
        return StateRecords.longField(this, PID);
    }

    @Override
    Set<String> summaryFields() {
        return SUMMARY_FIELDS;
    }

    @Override
    StateRecord rebuild(Map<String, Object> immutableMetadata, Map<String, Object> mutableState, DetailLevel detailLevel) {
        return new WorkerRecord(id(), immutableMetadata, mutableState, detailLevel);
    }
}
