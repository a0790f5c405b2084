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

import java.io.IOException;
import java.util.List;

/**
 * Read access to the log directory of one machine. Filenames are relative to that
 * directory. Missing files are reported with {@link java.nio.file.NoSuchFileException}.
 */
public interface LogSource {

    List<String> listLogs(String glob) throws IOException;

    /**
     * @param maxLines trailing lines wanted, {@code -1} for the whole file
     */
    LogTail tail(String filename, int maxLines) throws IOException;

    LogChunk read(String filename, long offset, int maxBytes) throws IOException;
}
