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

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * Raw bytes read from a log file starting at {@code offset}.
 *
 * @param size file size observed during the read; smaller than {@code offset} means the
 *             file was truncated or rotated
 */
public record LogChunk(byte[] data, long offset, long size) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public LogChunk {
        Objects.requireNonNull(data, "data");
    }

    public long nextOffset() {
        return offset + data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    public boolean fileShrank() {
        return size < offset;
    }
}
