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

import dev.nishisan.nstate.model.StateRecord;

import java.util.List;
import java.util.Objects;

/**
 * Best-effort union of independently stale views returned by the data sources for one
 * query. Nothing here is linearized: two records may reflect different moments in time.
 *
 * <p>When {@code truncated} is set the snapshot holds the first {@code limit} records by
 * id; which records were dropped depends on the cluster state at query time.
 *
 * @param records      matching records, ordered by id
 * @param truncated    whether matching records were dropped to honour the limit
 * @param warnings     one line per failed or late source, plus one when truncated
 * @param totalMatched number of matching records before truncation
 * @param partial      whether at least one targeted source failed
 */
public record Snapshot(List<StateRecord> records,
                       boolean truncated,
                       List<String> warnings,
                       long totalMatched,
                       boolean partial) {

    public Snapshot {
        records = List.copyOf(Objects.requireNonNull(records, "records"));
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
