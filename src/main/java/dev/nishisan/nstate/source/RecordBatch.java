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

import dev.nishisan.nstate.model.StateRecord;

import java.io.Serial;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Records returned by one source for a listing.
 *
 * @param records  matching records, at most the requested limit
 * @param total    number of records that matched on the source before it applied the limit
 * @param filtered whether the source already evaluated the filters against the full records;
 *                 unfiltered batches are filtered by the coordinator
 */
public record RecordBatch(List<StateRecord> records, long total, boolean filtered) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public RecordBatch {
        records = List.copyOf(records);
        if (total < records.size()) {
            throw new IllegalArgumentException("total " + total + " < returned " + records.size());
        }
    }

    /**
     * Unfiltered batch holding everything the source has.
     */
    public static RecordBatch of(List<StateRecord> records) {
        return new RecordBatch(records, records.size(), false);
    }

    public static RecordBatch filtered(List<StateRecord> records, long total) {
        return new RecordBatch(records, total, true);
    }

    /**
     * Batch restricted to the given subset, with the total reduced by the number of
     * records that were removed.
     */
    public RecordBatch retain(List<StateRecord> kept) {
        if (kept.size() == records.size()) {
            return new RecordBatch(records, total, true);
        }
        return new RecordBatch(new ArrayList<>(kept), total - (records.size() - kept.size()), true);
    }
}
