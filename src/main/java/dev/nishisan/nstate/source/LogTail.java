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
import java.util.List;
import java.util.Objects;

/**
 * Trailing part of a log file.
 *
 * @param lines            complete lines, oldest first
 * @param trailingPartial  text after the last newline, empty when the file ends with one
 * @param truncated        whether the file holds lines before {@code lines}
 * @param completeEnd      offset just past the last newline; followers resume reading here
 * @param size             file size when the tail was taken
 */
public record LogTail(List<String> lines,
                      String trailingPartial,
                      boolean truncated,
                      long completeEnd,
                      long size) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public LogTail {
        lines = List.copyOf(lines);
        Objects.requireNonNull(trailingPartial, "trailingPartial");
    }
}
