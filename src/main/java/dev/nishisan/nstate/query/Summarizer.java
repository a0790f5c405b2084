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

import dev.nishisan.nstate.model.ResourceKind;
import dev.nishisan.nstate.model.StateRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reduces record lists to per-group state counts.
 */
public final class Summarizer {
    public static final String DISABLED_GROUP = "disabled";
    public static final String UNKNOWN_STATE = "UNKNOWN";

    private Summarizer() {
    }

    public static StateSummary summarize(ResourceKind kind, Snapshot snapshot) {
        return summarize(kind, snapshot.records(), GroupKeys.forKind(kind), snapshot.truncated(), snapshot.warnings());
    }

    public static StateSummary summarize(ResourceKind kind, List<StateRecord> records, GroupKey groupKey) {
        return summarize(kind, records, groupKey, false, List.of());
    }

    static StateSummary summarize(ResourceKind kind,
                                  List<StateRecord> records,
                                  GroupKey groupKey,
                                  boolean truncated,
                                  List<String> warnings) {
        Objects.requireNonNull(groupKey, "groupKey");
        Map<String, Map<String, Long>> counts = new HashMap<>();
        Map<String, Long> totals = new HashMap<>();
        long ungrouped = 0;
        for (StateRecord record : records) {
            String group = groupKey.groupOf(record).orElse(null);
            if (group == null) {
                group = DISABLED_GROUP;
                ungrouped++;
            }
            String state = record.state().orElse(UNKNOWN_STATE);
            counts.computeIfAbsent(group, g -> new HashMap<>()).merge(state, 1L, Long::sum);
            totals.merge(state, 1L, Long::sum);
        }

        Map<String, GroupSummary> groups = new HashMap<>();
        counts.forEach((group, byState) -> groups.put(group, new GroupSummary(byState, sum(byState))));

        List<String> notes = new ArrayList<>(warnings);
        if (ungrouped > 0) {
            String note = ungrouped + " " + kind + " record(s) carry no " + groupKey.dimension()
                    + " and were counted under '" + DISABLED_GROUP + "'";
            notes.add(groupKey.enabledBy()
                    .map(flag -> note + "; set " + flag + "=true on the data sources to record it")
                    .orElse(note));
        }
        return new StateSummary(kind, groups, new GroupSummary(totals, records.size()), ungrouped > 0, truncated, notes);
    }

    private static long sum(Map<String, Long> counts) {
        long total = 0;
        for (long count : counts.values()) {
            total += count;
        }
        return total;
    }
}
