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

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * How the summarizer buckets records of one kind.
 *
 * @param dimension human readable name of the grouping dimension
 * @param extractor group of a record, empty when the record never carried the dimension
 * @param enabledBy configuration switch that makes sources record the dimension, if any
 */
public record GroupKey(String dimension,
                       Function<StateRecord, Optional<String>> extractor,
                       Optional<String> enabledBy) {

    public GroupKey {
        Objects.requireNonNull(dimension, "dimension");
        Objects.requireNonNull(extractor, "extractor");
        Objects.requireNonNull(enabledBy, "enabledBy");
    }

    public static GroupKey byField(String field) {
        return new GroupKey(field, record -> record.field(field).filter(v -> !v.isBlank()), Optional.empty());
    }

    public Optional<String> groupOf(StateRecord record) {
        return extractor.apply(record);
    }
}
