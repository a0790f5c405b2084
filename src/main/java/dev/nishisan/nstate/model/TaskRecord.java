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

/**
 * A scheduling unit. Summaries group tasks by {@link #FUNC_OR_CLASS_NAME}.
 */
public final class TaskRecord extends StateRecord {
    @Serial
    private static final long serialVersionUID = 1L;

    public static final String FUNC_OR_CLASS_NAME = "func_or_class_name";
    public static final String TYPE = "type";
    public static final String JOB_ID = "job_id";
    public static final String PARENT_TASK_ID = "parent_task_id";
    public static final String NODE_ID = "node_id";
    public static final String WORKER_ID = "worker_id";
    public static final String ATTEMPT_NUMBER = "attempt_number";
    public static final String ERROR_TYPE = "error_type";
    public static final String REQUIRED_RESOURCES = "required_resources";

    private static final Set<String> SUMMARY_FIELDS =
            Set.of(FUNC_OR_CLASS_NAME, TYPE, JOB_ID, NODE_ID, ATTEMPT_NUMBER, FIELD_STATE);

    public TaskRecord(String id, Map<String, ?> immutableMetadata, Map<String, ?> mutableState, DetailLevel detailLevel) {
        super(id, immutableMetadata, mutableState, detailLevel);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.TASK;
    }

    public Optional<String> funcOrClassName() {
        return field(FUNC_OR_CLASS_NAME);
    }

    public Optional<String> nodeId() {
        return field(NODE_ID);
    }

    @Override
    Set<String> summaryFields() {
        return SUMMARY_FIELDS;
    }

    @Override
    StateRecord rebuild(Map<String, Object> immutableMetadata, Map<String, Object> mutableState, DetailLevel detailLevel) {
        return new TaskRecord(id(), immutableMetadata, mutableState, detailLevel);
    }
}
