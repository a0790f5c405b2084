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
import java.util.List;
import java.util.Optional;

/**
 * Evaluates predicate lists against records. Predicates are ANDed and evaluated in order,
 * stopping at the first one that fails. A field the record does not have fails both
 * {@code =} and {@code !=}, so a filter written for one kind simply selects nothing on
 * another.
 */
public final class FilterEngine {

    private FilterEngine() {
    }

    public static boolean matches(StateRecord record, List<FilterPredicate> filters) {
        for (FilterPredicate predicate : filters) {
            if (!matches(record, predicate)) {
                return false;
            }
        }
        return true;
    }

    public static boolean matches(StateRecord record, FilterPredicate predicate) {
        Optional<String> actual = record.field(predicate.field());
        if (actual.isEmpty()) {
            return false;
        }
        boolean equal = actual.get().equals(predicate.value());
        return switch (predicate.operator()) {
            case EQUALS -> equal;
            case NOT_EQUALS -> !equal;
        };
    }

    public static List<StateRecord> filter(List<StateRecord> records, List<FilterPredicate> filters) {
        if (filters.isEmpty()) {
            return records;
        }
        List<StateRecord> result = new ArrayList<>(records.size());
        for (StateRecord record : records) {
            if (matches(record, filters)) {
                result.add(record);
            }
        }
        return result;
    }
}
