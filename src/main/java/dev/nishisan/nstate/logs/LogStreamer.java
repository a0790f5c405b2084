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

package dev.nishisan.nstate.logs;

import dev.nishisan.nstate.source.SourceConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for log access: lists the files a selector matches and opens streams over a
 * single resolved file.
 */
public final class LogStreamer {
    private static final Logger LOGGER = LoggerFactory.getLogger(LogStreamer.class);

    private final LogLocator locator;
    private final SourceConnector connector;
    private final LogStreamOptions defaults;

    public LogStreamer(LogLocator locator, SourceConnector connector, LogStreamOptions defaults) {
        this.locator = Objects.requireNonNull(locator, "locator");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public LogStreamOptions defaults() {
        return defaults;
    }

    public List<LogTarget> list(LogSelector selector) throws IOException {
        return locator.locate(selector);
    }

    public LogStream open(LogSelector selector) throws IOException {
        return open(selector, defaults);
    }

    public LogStream open(LogSelector selector, boolean follow) throws IOException {
        return open(selector, defaults.toBuilder().follow(follow).build());
    }

    /**
     * Resolves the selector to exactly one file and reads its tail.
     *
     * @throws dev.nishisan.nstate.query.ResourceNotFoundException when no file matches
     * @throws AmbiguousLogTargetException                          when several files match
     * @throws IOException                                          when the file's machine cannot be read
     */
    public LogStream open(LogSelector selector, LogStreamOptions options) throws IOException {
        LogTarget target = locator.locateOne(selector);
        LOGGER.debug("Opening {} (follow={})", target, options.follow());
        LogStream stream = new LogStream(target, connector.logSource(target.node()), options);
        stream.open();
        return stream;
    }

    /**
     * One-shot read of the last {@code tailLines} lines ({@code -1} for all).
     */
    public List<String> read(LogSelector selector, int tailLines) throws IOException {
        List<String> lines = new ArrayList<>();
        try (LogStream stream = open(selector, defaults.toBuilder().follow(false).tailLines(tailLines).build())) {
            stream.forEachRemaining(lines::add);
            if (stream.state() == LogStreamState.ERROR) {
                throw stream.failure().orElseGet(() -> new IOException("Log stream for " + stream.target() + " failed"));
            }
        }
        return lines;
    }
}
