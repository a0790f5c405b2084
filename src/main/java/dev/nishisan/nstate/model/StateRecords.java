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

import java.util.Map;
import java.util.OptionalLong;

/**
 * Factory methods for records when the kind is only known at runtime.
 */
public final class StateRecords {

    private StateRecords() {
    }

    public static StateRecord create(ResourceKind kind,
                                     String id,
                                     Map<String, ?> immutableMetadata,
                                     Map<String, ?> mutableState,
                                     DetailLevel detailLevel) {
        return switch (kind) {
            case ACTOR -> new ActorRecord(id, immutableMetadata, mutableState, detailLevel);
            case TASK -> new TaskRecord(id, immutableMetadata, mutableState, detailLevel);
            case OBJECT -> new ObjectRecord(id, immutableMetadata, mutableState, detailLevel);
            case NODE -> new NodeRecord(id, immutableMetadata, mutableState, detailLevel);
            case WORKER -> new WorkerRecord(id, immutableMetadata, mutableState, detailLevel);
            case JOB -> new JobRecord(id, immutableMetadata, mutableState, detailLevel);
            case PLACEMENT_GROUP -> new PlacementGroupRecord(id, immutableMetadata, mutableState, detailLevel);
            case RUNTIME_ENV -> new RuntimeEnvRecord(id, immutableMetadata, mutableState, detailLevel);
        };
    }

    /**
     * Detail level record, as held by an owning source.
     */
    public static StateRecord create(ResourceKind kind,
                                     String id,
                                     Map<String, ?> immutableMetadata,
                                     Map<String, ?> mutableState) {
        return create(kind, id, immutableMetadata, mutableState, DetailLevel.DETAIL);
    }

    static OptionalLong longField(StateRecord record, String name) {
        Object value = record.value(name).orElse(null);
        if (value instanceof Number number) {
            return OptionalLong.of(number.longValue());
        }
        if (value != null) {
            try {
                return OptionalLong.of(Long.parseLong(value.toString().trim()));
            } catch (NumberFormatException ignored) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }
}
