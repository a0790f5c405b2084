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

import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.model.ResourceKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Raised when no targeted data source answered a query. Carries one reason per source; the
 * map is empty when the registry had no reachable source for the kind at all.
 */
public final class AllSourcesFailedException extends RuntimeException {
    private final ResourceKind kind;
    private final Map<NodeId, String> reasons;

    public AllSourcesFailedException(ResourceKind kind, Map<NodeId, String> reasons) {
        super(buildMessage(kind, reasons));
        this.kind = Objects.requireNonNull(kind, "kind");
        this.reasons = Collections.unmodifiableMap(new LinkedHashMap<>(reasons));
    }

    public ResourceKind kind() {
        return kind;
    }

    public Map<NodeId, String> reasons() {
        return reasons;
    }

    private static String buildMessage(ResourceKind kind, Map<NodeId, String> reasons) {
        if (reasons.isEmpty()) {
            return "No reachable data source for " + kind + " query";
        }
        StringBuilder sb = new StringBuilder("All ")
                .append(reasons.size())
                .append(" data sources failed for ")
                .append(kind)
                .append(" query:");
        reasons.forEach((node, reason) -> sb.append("\n  ").append(node).append(": ").append(reason));
        return sb.toString();
    }
}
