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
 * A resource-allocation group. {@link #BUNDLES} holds the bundle layout fixed at creation.
 */
public final class PlacementGroupRecord extends StateRecord {
    @Serial
    private static final long serialVersionUID = 1L;

    public static final String NAME = "name";
    public static final String STRATEGY = "strategy";
    public static final String BUNDLES = "bundles";
    public static final String CREATOR_JOB_ID = "creator_job_id";

    private static final Set<String> SUMMARY_FIELDS = Set.of(NAME, STRATEGY, CREATOR_JOB_ID, FIELD_STATE);

    public PlacementGroupRecord(String id, Map<String, ?> immutableMetadata, Map<String, ?> mutableState,
                                DetailLevel detailLevel) {
        super(id, immutableMetadata, mutableState, detailLevel);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.PLACEMENT_GROUP;
    }

    public Optional<String> strategy() {
        return field(STRATEGY);
    }

    @Override
    Set<String> summaryFields() {
        return SUMMARY_FIELDS;
    }

    @Override
    StateRecord rebuild(Map<String, Object> immutableMetadata, Map<String, Object> mutableState, DetailLevel detailLevel) {
        return new PlacementGroupRecord(id(), immutableMetadata, mutableState, detailLevel);
    }
}
