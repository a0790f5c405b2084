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
import dev.nishisan.nstate.model.ResourceKind;
import dev.nishisan.nstate.query.FilterPredicate;

import java.io.IOException;
import java.util.List;

/**
 * A data source holding authoritative state for some subset of the cluster's resources.
 * Calls may block; the fan-out coordinator runs them on its own pool and interrupts
 * them once the query deadline passes.
 */
public interface StateSource {

    NodeId sourceId();

    /**
     * Lists SUMMARY views of the records of a kind that match all filters, ordered by id and
     * capped at {@code limit}.
     */
    RecordBatch list(ResourceKind kind, List<FilterPredicate> filters, int limit) throws IOException;

    /**
     * Looks up one record; {@code detail} asks for all fields instead of the summary view.
     */
    RecordLookup lookup(ResourceKind kind, String id, boolean detail) throws IOException;
}
