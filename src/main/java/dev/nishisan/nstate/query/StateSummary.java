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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Records of one kind grouped by their grouping dimension and reduced to state counts.
 *
 * @param groups           per group counts, ordered by group name
 * @param totals           counts over all groups
 * @param groupingDisabled whether some records lacked the grouping dimension and were put in
 *                         the {@link Summarizer#DISABLED_GROUP} bucket
 * @param truncated        whether the underlying snapshot was truncated
 * @param warnings         snapshot warnings followed by summarizer notes
 */
public record StateSummary(ResourceKind kind,
                           Map<String, GroupSummary> groups,
                           GroupSummary totals,
                           boolean groupingDisabled,
                           boolean truncated,
                           List<String> warnings) {

    public StateSummary {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(totals, "totals");
        groups = Collections.unmodifiableMap(new TreeMap<>(groups));
        warnings = List.copyOf(warnings);
    }

    public Optional<GroupSummary> group(String name) {
        return Optional.ofNullable(groups.get(name));
    }
}
