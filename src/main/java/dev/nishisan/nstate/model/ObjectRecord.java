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
 * A data object held in a machine's object store. The creation {@link #CALL_SITE} is only
 * present when the owning source records callsites.
 */
public final class ObjectRecord extends StateRecord {
    @Serial
    private static final long serialVersionUID = 1L;

    public static final String CALL_SITE = "call_site";
    public static final String OBJECT_SIZE = "object_size";
    public static final String REFERENCE_TYPE = "reference_type";
    public static final String IP = "ip";
    public static final String PID = "pid";
    public static final String TASK_STATUS = "task_status";

    /**
     * Placeholder value sources store when callsite recording is turned off.
     */
    public static final String CALL_SITE_DISABLED = "disabled";

    private static final Set<String> SUMMARY_FIELDS =
            Set.of(CALL_SITE, OBJECT_SIZE, REFERENCE_TYPE, IP, PID, FIELD_STATE);

    public ObjectRecord(String id, Map<String, ?> immutableMetadata, Map<String, ?> mutableState, DetailLevel detailLevel) {
        super(id, immutableMetadata, mutableState, detailLevel);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.OBJECT;
    }

    public Optional<String> callSite() {
        return field(CALL_SITE).filter(site -> !site.isBlank() && !CALL_SITE_DISABLED.equals(site));
    }

    public OptionalLong objectSize() {
        return StateRecords.longField(this, OBJECT_SIZE);
    }

    /**
     * Copy without the creation callsite, as served by a source that does not record them.
     */
    public ObjectRecord withoutCallSite() {
        return (ObjectRecord) withoutField(CALL_SITE);
    }

    @Override
    Set<String> summaryFields() {
        return SUMMARY_FIELDS;
    }

    @Override
    StateRecord rebuild(Map<String, Object> immutableMetadata, Map<String, Object> mutableState, DetailLevel detailLevel) {
        return new ObjectRecord(id(), immutableMetadata, mutableState, detailLevel);
    }
}
