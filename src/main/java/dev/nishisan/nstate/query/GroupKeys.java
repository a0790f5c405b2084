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

import dev.nishisan.nstate.model.ActorRecord;
import dev.nishisan.nstate.model.JobRecord;
import dev.nishisan.nstate.model.NodeRecord;
import dev.nishisan.nstate.model.ObjectRecord;
import dev.nishisan.nstate.model.PlacementGroupRecord;
import dev.nishisan.nstate.model.ResourceKind;
import dev.nishisan.nstate.model.RuntimeEnvRecord;
import dev.nishisan.nstate.model.TaskRecord;
import dev.nishisan.nstate.model.WorkerRecord;

import java.util.Optional;

/**
 * Default grouping dimension of each resource kind.
 */
public final class GroupKeys {
    public static final String RECORD_CALLSITE_SWITCH = "query.record-callsite";

    private static final GroupKey OBJECT_CALLSITE = new GroupKey(ObjectRecord.CALL_SITE,
            record -> ((ObjectRecord) record).callSite().map(GroupKeys::firstSegment),
            Optional.of(RECORD_CALLSITE_SWITCH));

    private GroupKeys() {
    }

    public static GroupKey forKind(ResourceKind kind) {
        return switch (kind) {
            case TASK -> GroupKey.byField(TaskRecord.FUNC_OR_CLASS_NAME);
            case ACTOR -> GroupKey.byField(ActorRecord.CLASS_NAME);
            case OBJECT -> OBJECT_CALLSITE;
            case WORKER -> GroupKey.byField(WorkerRecord.WORKER_TYPE);
            case JOB -> GroupKey.byField(JobRecord.ENTRYPOINT);
            case PLACEMENT_GROUP -> GroupKey.byField(PlacementGroupRecord.STRATEGY);
            case NODE -> GroupKey.byField(NodeRecord.NODE_NAME);
            case RUNTIME_ENV -> GroupKey.byField(RuntimeEnvRecord.RUNTIME_ENV);
        };
    }

    /**
     * Innermost frame of a callsite; frames are separated by {@code |}.
     */
    static String firstSegment(String callSite) {
        int separator = callSite.indexOf('|');
        String segment = separator < 0 ? callSite : callSite.substring(0, separator);
        return segment.trim();
    }
}
