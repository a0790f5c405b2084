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
import java.util.Objects;
import java.util.Optional;

/**
 * Answer of a source to a by-id lookup.
 */
public record RecordLookup(Status status, StateRecord record) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public enum Status {
        FOUND,
        /**
         * The source knew the id but has already garbage collected its data.
         */
        RECLAIMED,
        ABSENT
    }

    public RecordLookup {
        Objects.requireNonNull(status, "status");
        if ((status == Status.FOUND) != (record != null)) {
            throw new IllegalArgumentException("a record must be present exactly when status is FOUND");
        }
    }

    public static RecordLookup found(StateRecord record) {
        return new RecordLookup(Status.FOUND, Objects.requireNonNull(record, "record"));
    }

    public static RecordLookup reclaimed() {
        return new RecordLookup(Status.RECLAIMED, null);
    }

    public static RecordLookup absent() {
        return new RecordLookup(Status.ABSENT, null);
    }

    public Optional<StateRecord> asOptional() {
        return Optional.ofNullable(record);
    }
}
