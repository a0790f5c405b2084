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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges the successful batches of a fan-out into one id ordered sequence and caps it.
 *
 * <p>Batches are concatenated in the order the responses arrived and then stably sorted by
 * id, so repeated queries over an unchanged record set return the same prefix. Truncation is
 * a safety valve, not pagination.
 */
public final class Aggregator {

    private Aggregator() {
    }

    public static AggregationResult aggregate(List<? extends SourceResponse> responses, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        List<StateRecord> merged = new ArrayList<>();
        long total = 0;
        for (SourceResponse response : responses) {
            if (response instanceof SourceResponse.Success success) {
                merged.addAll(success.batch().records());
                total += success.batch().total();
            }
        }
        merged.sort(Comparator.comparing(StateRecord::id));
        total = Math.max(total, merged.size());
        if (merged.size() > limit) {
            return new AggregationResult(merged.subList(0, limit), true, total);
        }
        return new AggregationResult(merged, total > merged.size(), total);
    }
}
