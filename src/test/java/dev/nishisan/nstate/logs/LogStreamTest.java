package dev.nishisan.nstate.logs;

import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;
import dev.nishisan.nstate.source.LocalLogDirectory;
import dev.nishisan.nstate.source.LogChunk;
import dev.nishisan.nstate.source.LogSource;
import dev.nishisan.nstate.source.LogTail;
import dev.nishisan.nstate.source.SourceUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class LogStreamTest {

    private static final NodeInfo NODE = new NodeInfo(NodeId.of("node-a"), "10.0.0.1", 7000);

    @TempDir
    Path logDir;

    private LogStreamOptions followOptions() {
        return LogStreamOptions.builder().follow(true).pollInterval(Duration.ofMillis(50)).build();
    }

    private void append(String name, String text) throws IOException {
        Files.writeString(logDir.resolve(name), text, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    private LogStream open(String name, LogSource source, LogStreamOptions options) throws IOException {
        LogStream stream = new LogStream(new LogTarget(NODE, name), source, options);
        stream.open();
        return stream;
    }

    @Test
    void oneShotReadsTailWithTruncationNotice() throws IOException {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i <= 1500; i++) {
            sb.append("line ").append(i).append('\n');
        }
        append("a.out", sb.toString());

        LogStream stream = open("a.out", new LocalLogDirectory(logDir), LogStreamOptions.defaults());
        List<String> lines = new ArrayList<>();
        stream.forEachRemaining(lines::add);

        assertEquals(1001, lines.size());
        assertTrue(lines.get(0).contains("earlier lines omitted"));
        assertEquals("line 501", lines.get(1));
        assertEquals("line 1500", lines.get(1000));
        assertEquals(LogStreamState.COMPLETE, stream.state());
    }

    @Test
    void oneShotIncludesUnterminatedLastLine() throws IOException {
        append("a.out", "one\ntwo");

        LogStream stream = open("a.out", new LocalLogDirectory(logDir),
                LogStreamOptions.builder().tailLines(LogStreamOptions.WHOLE_FILE).build());
        List<String> lines = new ArrayList<>();
        stream.forEachRemaining(lines::add);

        assertEquals(List.of("one", "two"), lines);
    }

    @Test
    void oneShotBoundIncludesUnterminatedLastLine() throws IOException {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i <= 1000; i++) {
            sb.append("line ").append(i).append('\n');
        }
        sb.append("partial");
        append("a.out", sb.toString());

        LogStream stream = open("a.out", new LocalLogDirectory(logDir), LogStreamOptions.defaults());
        List<String> lines = new ArrayList<>();
        stream.forEachRemaining(lines::add);

        assertEquals(1001, lines.size());
        assertTrue(lines.get(0).contains("showing the last 1000 lines"));
        assertEquals("line 2", lines.get(1));
        assertEquals("partial", lines.get(1000));
    }

    @Test
    void cancelWithoutConsumerReleasesRightAway() throws IOException {
        append("a.out", "first\n");
        LogStream stream = open("a.out", new LocalLogDirectory(logDir), followOptions());

        stream.cancel();

        assertEquals(LogStreamState.CANCELLED, stream.state());
        assertFalse(stream.hasNext());
        assertThrows(NoSuchElementException.class, stream::next);
        assertTrue(stream.failure().isEmpty());
    }

    @Test
    void cancelInterruptsBlockedRead() throws Exception {
        append("a.out", "first\n");
        CountDownLatch reading = new CountDownLatch(1);
        LocalLogDirectory local = new LocalLogDirectory(logDir);
        LogSource slow = new LogSource() {
            @Override
            public List<String> listLogs(String glob) throws IOException {
                return local.listLogs(glob);
            }

            @Override
            public LogTail tail(String filename, int maxLines) throws IOException {
                return local.tail(filename, maxLines);
            }

            @Override
            public LogChunk read(String filename, long offset, int maxBytes) throws IOException {
                reading.countDown();
                try {
                    Thread.sleep(30_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("read of " + filename + " interrupted");
                }
                return local.read(filename, offset, maxBytes);
            }
        };
        LogStream stream = open("a.out", slow, followOptions());
        assertEquals("first", stream.next());
        ExecutorService consumer = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> more = consumer.submit(() -> stream.hasNext() || Thread.currentThread().isInterrupted());
            assertTrue(reading.await(5, TimeUnit.SECONDS));

            long cancelledAt = System.nanoTime();
            stream.cancel();

            assertEquals(LogStreamState.CANCELLED, stream.state());
            assertFalse(more.get(2, TimeUnit.SECONDS), "consumer must stop with its interrupt flag cleared");
            assertTrue(Duration.ofNanos(System.nanoTime() - cancelledAt).compareTo(Duration.ofSeconds(1)) < 0);
            assertTrue(stream.failure().isEmpty());
        } finally {
            consumer.shutdownNow();
        }
    }

    @Test
    void followEmitsAppendedCompleteLinesUntilCancelled() throws Exception {
        append("a.out", "first\npart");
        LogStream stream = open("a.out", new LocalLogDirectory(logDir), followOptions());
        List<String> seen = new CopyOnWriteArrayList<>();
        ExecutorService consumer = Executors.newSingleThreadExecutor();
        try {
            Future<?> done = consumer.submit(() -> stream.forEachRemaining(seen::add));

            await().atMost(Duration.ofSeconds(5)).until(() -> seen.contains("first"));
            append("a.out", "ial\nsecond\nthi");
            await().atMost(Duration.ofSeconds(5)).until(() -> seen.contains("second"));
            assertEquals(List.of("first", "partial", "second"), seen);
            assertEquals(LogStreamState.STREAMING, stream.state());

            stream.cancel();
            done.get(5, TimeUnit.SECONDS);
            assertEquals(LogStreamState.CANCELLED, stream.state());
            assertFalse(stream.hasNext());
        } finally {
            consumer.shutdownNow();
        }
    }

    @Test
    void followRestartsWhenFileIsTruncated() throws Exception {
        append("a.out", "old line 1\nold line 2\n");
        LogStream stream = open("a.out", new LocalLogDirectory(logDir), followOptions());
        List<String> seen = new CopyOnWriteArrayList<>();
        ExecutorService consumer = Executors.newSingleThreadExecutor();
        try {
            consumer.submit(() -> stream.forEachRemaining(seen::add));
            await().atMost(Duration.ofSeconds(5)).until(() -> seen.contains("old line 2"));

            Files.writeString(logDir.resolve("a.out"), "new\n", StandardCharsets.UTF_8);

            await().atMost(Duration.ofSeconds(5)).until(() -> seen.contains("new"));
            assertTrue(seen.stream().anyMatch(line -> line.contains("was truncated")));
        } finally {
            stream.cancel();
            consumer.shutdownNow();
        }
    }

    @Test
    void sourceFailureMovesToError() throws Exception {
        append("a.out", "first\n");
        AtomicBoolean down = new AtomicBoolean();
        LocalLogDirectory local = new LocalLogDirectory(logDir);
        LogSource flaky = new LogSource() {
            @Override
            public List<String> listLogs(String glob) throws IOException {
                return local.listLogs(glob);
            }

            @Override
            public LogTail tail(String filename, int maxLines) throws IOException {
                return local.tail(filename, maxLines);
            }

            @Override
            public LogChunk read(String filename, long offset, int maxBytes) throws IOException {
                if (down.get()) {
                    throw new SourceUnavailableException(NODE.nodeId(), "connection reset");
                }
                return local.read(filename, offset, maxBytes);
            }
        };
        LogStream stream = open("a.out", flaky, followOptions());

        assertEquals("first", stream.next());
        down.set(true);

        assertFalse(stream.hasNext());
        assertEquals(LogStreamState.ERROR, stream.state());
        assertInstanceOf(SourceUnavailableException.class, stream.failure().orElseThrow());
    }

    @Test
    void openFailsForMissingFile() {
        LogStream stream = new LogStream(new LogTarget(NODE, "missing.out"), new LocalLogDirectory(logDir),
                LogStreamOptions.defaults());

        assertThrows(IOException.class, stream::open);
        assertEquals(LogStreamState.ERROR, stream.state());
    }
}
