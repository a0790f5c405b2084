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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link LogSource} over a directory of the local filesystem. Names may contain
 * sub-directories but never escape the root.
 */
public final class LocalLogDirectory implements LogSource {
    private static final int SCAN_BLOCK = 8192;

    private final Path root;

    public LocalLogDirectory(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public List<String> listLogs(String glob) throws IOException {
        if (!Files.isDirectory(root)) {
            return Collections.emptyList();
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .map(root::relativize)
                    .filter(matcher::matches)
                    .map(LocalLogDirectory::toName)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    @Override
    public LogTail tail(String filename, int maxLines) throws IOException {
        if (maxLines < -1) {
            throw new IllegalArgumentException("maxLines must be >= -1");
        }
        Path file = resolve(filename);
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            long completeEnd = lastNewline(channel, size, 1) + 1;
            boolean hasPartial = completeEnd < size;
            // an unterminated last line counts as one of the maxLines
            boolean keepPartial = hasPartial && maxLines != 0;
            long start;
            if (maxLines < 0) {
                start = 0;
            } else if (maxLines == 0) {
                start = completeEnd;
            } else {
                start = lastNewline(channel, completeEnd, hasPartial ? maxLines : maxLines + 1) + 1;
            }

            String body = new String(readRange(channel, start, completeEnd), StandardCharsets.UTF_8);
            String partial = keepPartial
                    ? new String(readRange(channel, completeEnd, size), StandardCharsets.UTF_8)
                    : "";
            boolean truncated = start > 0 || (hasPartial && !keepPartial);
            return new LogTail(splitLines(body), partial, truncated, completeEnd, size);
        }
    }

    @Override
    public LogChunk read(String filename, long offset, int maxBytes) throws IOException {
        if (offset < 0 || maxBytes <= 0) {
            throw new IllegalArgumentException("offset must be >= 0 and maxBytes > 0");
        }
        Path file = resolve(filename);
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            if (offset >= size) {
                return new LogChunk(new byte[0], offset, size);
            }
            long end = Math.min(size, offset + maxBytes);
            return new LogChunk(readRange(channel, offset, end), offset, size);
        }
    }

    Path resolve(String filename) throws NoSuchFileException {
        Objects.requireNonNull(filename, "filename");
        Path resolved = root.resolve(filename).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("Log file name escapes the log directory: " + filename);
        }
        if (!Files.isRegularFile(resolved)) {
            throw new NoSuchFileException(filename);
        }
        return resolved;
    }

    /**
     * Position of the {@code occurrence}-th newline found scanning backward from
     * {@code end} (exclusive), or -1 when the file start is reached first.
     */
    private static long lastNewline(FileChannel channel, long end, int occurrence) throws IOException {
        int seen = 0;
        long blockEnd = end;
        ByteBuffer buffer = ByteBuffer.allocate(SCAN_BLOCK);
        while (blockEnd > 0) {
            long blockStart = Math.max(0, blockEnd - SCAN_BLOCK);
            int length = (int) (blockEnd - blockStart);
            buffer.clear().limit(length);
            readFully(channel, buffer, blockStart);
            for (int i = length - 1; i >= 0; i--) {
                if (buffer.get(i) == '\n' && ++seen == occurrence) {
                    return blockStart + i;
                }
            }
            blockEnd = blockStart;
        }
        return -1;
    }

    private static byte[] readRange(FileChannel channel, long start, long end) throws IOException {
        long length = end - start;
        if (length <= 0) {
            return new byte[0];
        }
        if (length > Integer.MAX_VALUE - 8) {
            throw new IOException("Log range too large: " + length + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.allocate((int) length);
        readFully(channel, buffer, start);
        return buffer.array();
    }

    private static void readFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
        long pos = position;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, pos);
            if (read < 0) {
                throw new IOException("Log file was truncated while reading");
            }
            pos += read;
        }
    }

    static List<String> splitLines(String text) {
        if (text.isEmpty()) {
            return Collections.emptyList();
        }
        String[] parts = text.split("\n", -1);
        List<String> lines = new ArrayList<>(parts.length);
        // text always ends with a newline, so the last part is empty
        for (int i = 0; i < parts.length - 1; i++) {
            String line = parts[i];
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        return lines;
    }

    private static String toName(Path relative) {
        return relative.toString().replace(relative.getFileSystem().getSeparator(), "/");
    }
}
