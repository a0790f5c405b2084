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

import dev.nishisan.nstate.source.LogChunk;
import dev.nishisan.nstate.source.LogSource;
import dev.nishisan.nstate.source.LogTail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lines of one log file, read once or followed.
 *
 * <p>The stream is pulled by a single consumer thread through {@link #hasNext()} and
 * {@link #next()}. In follow mode {@code hasNext()} blocks until new complete lines were
 * appended, the stream is cancelled or the source fails; it never returns {@code false} on
 * its own. {@link #cancel()} may be called from any thread: it moves the stream to
 * {@link LogStreamState#CANCELLED} and drops the read position right away, and interrupts a
 * consumer blocked in a read of the source.
 *
 * <p>A failure of the source moves the stream to {@link LogStreamState#ERROR};
 * {@link #failure()} then holds the cause.
 */
public final class LogStream implements Iterator<String>, Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(LogStream.class);

    private final LogTarget target;
    private final LogSource source;
    private final LogStreamOptions options;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeup = lock.newCondition();
    private final Deque<String> buffered = new ConcurrentLinkedDeque<>();
    private volatile LogStreamState state = LogStreamState.OPENING;
    private volatile boolean cancelRequested;
    private volatile IOException failure;
    private volatile LogHandle handle;
    // guarded by lock
    private Thread reader;
    private boolean readerInterrupted;

    LogStream(LogTarget target, LogSource source, LogStreamOptions options) {
        this.target = Objects.requireNonNull(target, "target");
        this.source = Objects.requireNonNull(source, "source");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Reads the initial tail. Moves to STREAMING, or to ERROR when the file cannot be read.
     */
    void open() throws IOException {
        if (state != LogStreamState.OPENING) {
            throw new IllegalStateException("Stream already opened: " + state);
        }
        try {
            LogTail tail = source.tail(target.filename(), options.tailLines());
            if (tail.truncated()) {
                int shown = tail.lines().size();
                if (!options.follow() && !tail.trailingPartial().isEmpty()) {
                    shown++;
                }
                buffered.add("[... earlier lines omitted, showing the last " + shown + " lines of " + target + "]");
            }
            buffered.addAll(tail.lines());
            if (options.follow()) {
                handle = new LogHandle(tail.completeEnd());
            } else if (!tail.trailingPartial().isEmpty()) {
                buffered.add(tail.trailingPartial());
            }
            state = LogStreamState.STREAMING;
        } catch (IOException e) {
            fail(e);
            throw e;
        }
    }

    public LogTarget target() {
        return target;
    }

    public LogStreamState state() {
        return state;
    }

    public Optional<IOException> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public boolean hasNext() {
        while (true) {
            if (cancelRequested) {
                release(LogStreamState.CANCELLED);
                return false;
            }
            if (!buffered.isEmpty()) {
                return true;
            }
            LogStreamState current = state;
            if (current.isTerminal()) {
                return false;
            }
            if (current == LogStreamState.OPENING) {
                throw new IllegalStateException("Stream for " + target + " was not opened");
            }
            if (!options.follow()) {
                release(LogStreamState.COMPLETE);
                return false;
            }
            try {
                if (poll()) {
                    continue;
                }
            } catch (IOException e) {
                if (cancelRequested) {
                    LOGGER.debug("Read of {} aborted by cancel: {}", target, e.getMessage());
                    release(LogStreamState.CANCELLED);
                } else {
                    fail(e);
                }
                return false;
            }
            awaitNextPoll();
        }
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Log stream for " + target + " is " + state);
        }
        return buffered.poll();
    }

    /**
     * Stops the stream. Safe to call from any thread and more than once; a stream already
     * COMPLETE or in ERROR keeps its state.
     */
    public void cancel() {
        cancelRequested = true;
        lock.lock();
        try {
            if (!state.isTerminal()) {
                state = LogStreamState.CANCELLED;
            }
            handle = null;
            buffered.clear();
            if (reader != null && !readerInterrupted) {
                readerInterrupted = true;
                reader.interrupt();
            }
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        cancel();
    }

    /**
     * Reads everything appended since the last poll.
     *
     * @return true when new lines were buffered
     */
    private boolean poll() throws IOException {
        boolean added = false;
        while (!cancelRequested) {
            LogHandle current = handle;
            if (current == null) {
                break;
            }
            LogChunk chunk = readChunk(current.offset);
            if (cancelRequested) {
                break;
            }
            if (chunk.fileShrank()) {
                LOGGER.debug("{} shrank from {} to {} bytes, reading again from the start", target, current.offset, chunk.size());
                buffered.add("[" + target + " was truncated, reading from the start]");
                handle = new LogHandle(0);
                added = true;
                continue;
            }
            if (chunk.isEmpty()) {
                break;
            }
            added |= current.append(chunk, buffered);
            if (chunk.data().length < options.chunkBytes()) {
                break;
            }
        }
        return added;
    }

    /**
     * Reads from the source with the calling thread registered, so that {@link #cancel()} can
     * interrupt it. The interrupt is consumed here and never leaks to the caller.
     */
    private LogChunk readChunk(long offset) throws IOException {
        lock.lock();
        try {
            if (cancelRequested) {
                throw new InterruptedIOException("Log stream for " + target + " was cancelled");
            }
            reader = Thread.currentThread();
        } finally {
            lock.unlock();
        }
        try {
            return source.read(target.filename(), offset, options.chunkBytes());
        } finally {
            lock.lock();
            try {
                reader = null;
                if (readerInterrupted) {
                    readerInterrupted = false;
                    Thread.interrupted();
                }
            } finally {
                lock.unlock();
            }
        }
    }

    private void awaitNextPoll() {
        lock.lock();
        try {
            if (!cancelRequested) {
                wakeup.await(options.pollInterval().toNanos(), TimeUnit.NANOSECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelRequested = true;
        } finally {
            lock.unlock();
        }
    }

    private void fail(IOException e) {
        failure = e;
        LOGGER.warn("Log stream for {} failed: {}", target, e.getMessage());
        release(LogStreamState.ERROR);
    }

    private void release(LogStreamState terminal) {
        lock.lock();
        try {
            if (!state.isTerminal()) {
                state = terminal;
            }
            handle = null;
            buffered.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Read position plus the bytes of a line not terminated yet.
     */
    private static final class LogHandle {
        private long offset;
        private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

        private LogHandle(long offset) {
            this.offset = offset;
        }

        boolean append(LogChunk chunk, Deque<String> out) {
            pending.write(chunk.data(), 0, chunk.data().length);
            offset = chunk.nextOffset();
            byte[] bytes = pending.toByteArray();
            int lastNewline = -1;
            for (int i = bytes.length - 1; i >= 0; i--) {
                if (bytes[i] == '\n') {
                    lastNewline = i;
                    break;
                }
            }
            if (lastNewline < 0) {
                return false;
            }
            String text = new String(bytes, 0, lastNewline, StandardCharsets.UTF_8);
            for (String line : text.split("\n", -1)) {
                out.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
            }
            pending.reset();
            pending.write(bytes, lastNewline + 1, bytes.length - lastNewline - 1);
            return true;
        }
    }
}
