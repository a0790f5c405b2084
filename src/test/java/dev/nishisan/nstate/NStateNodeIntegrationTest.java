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

package dev.nishisan.nstate;

import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;
import dev.nishisan.nstate.logs.AmbiguousLogTargetException;
import dev.nishisan.nstate.logs.LogOutput;
import dev.nishisan.nstate.logs.LogSelector;
import dev.nishisan.nstate.logs.LogStream;
import dev.nishisan.nstate.logs.LogStreamState;
import dev.nishisan.nstate.logs.LogTarget;
import dev.nishisan.nstate.model.ActorRecord;
import dev.nishisan.nstate.model.ResourceKind;
import dev.nishisan.nstate.model.StateRecord;
import dev.nishisan.nstate.model.StateRecords;
import dev.nishisan.nstate.query.FilterPredicate;
import dev.nishisan.nstate.query.Snapshot;
import dev.nishisan.nstate.query.StateSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class NStateNodeIntegrationTest {

    @TempDir
    Path tempDir;

    private final List<NStateNode> nodes = new ArrayList<>();
    private NStateNode head;
    private NStateNode worker;
    private NStateNode observer;
    private Path workerLogs;

    @BeforeEach
    void setUp() throws IOException {
        NodeInfo headInfo = new NodeInfo(NodeId.of("node-head"), "127.0.0.1", freePort(),
                Set.of(NodeInfo.ROLE_HEAD, NodeInfo.ROLE_NODE));
        NodeInfo workerInfo = new NodeInfo(NodeId.of("node-w"), "127.0.0.1", freePort());
        NodeInfo observerInfo = new NodeInfo(NodeId.of("observer"), "127.0.0.1", freePort(),
                Set.of(NodeInfo.ROLE_OBSERVER));
        workerLogs = Files.createDirectories(tempDir.resolve("node-w"));

        head = start(config(headInfo).logDirectory(Files.createDirectories(tempDir.resolve("node-head"))).build());
        worker = start(config(workerInfo).addSeed(headInfo).logDirectory(workerLogs).build());
        observer = start(config(observerInfo).addSeed(headInfo).build());

        await().atMost(10, TimeUnit.SECONDS).until(() ->
                observer.registry().snapshot().machines().size() == 2
                        && observer.registry().snapshot().head().isPresent());
    }

    @AfterEach
    void tearDown() throws IOException {
        for (NStateNode node : nodes) {
            node.close();
        }
    }

    @Test
    void machineKindsAreGatheredFromEveryNode() {
        head.localState().orElseThrow().put(task("t-2", "RUNNING"));
        worker.localState().orElseThrow().put(task("t-1", "FINISHED"));
        worker.localState().orElseThrow().put(task("t-3", "RUNNING"));

        Snapshot all = observer.stateService().list(ResourceKind.TASK, List.of());
        Snapshot running = observer.stateService().list(ResourceKind.TASK,
                List.of(FilterPredicate.eq("state", "RUNNING")));
        StateSummary summary = observer.stateService().summarize(ResourceKind.TASK, List.of());

        assertEquals(List.of("t-1", "t-2", "t-3"), all.records().stream().map(StateRecord::id).toList());
        assertFalse(all.partial());
        assertTrue(all.warnings().isEmpty());
        assertEquals(List.of("t-2", "t-3"), running.records().stream().map(StateRecord::id).toList());
        assertEquals(3, summary.totals().total());
        assertEquals(2, summary.group("train").orElseThrow().count("RUNNING"));
    }

    @Test
    void clusterKindsComeFromTheHeadOnly() {
        head.localState().orElseThrow().put(actor("a-1", "node-w", 4242));
        worker.localState().orElseThrow().put(actor("a-stray", "node-w", 1));

        Snapshot actors = observer.stateService().list(ResourceKind.ACTOR, List.of(), 10, true);
        ActorRecord actor = observer.stateService().get(ResourceKind.ACTOR, "a-1", ActorRecord.class);

        assertEquals(List.of("a-1"), actors.records().stream().map(StateRecord::id).toList());
        assertTrue(actors.records().get(0).isDetailed());
        assertEquals("Trainer", actor.field(ActorRecord.CLASS_NAME).orElseThrow());
        assertEquals(4242L, actor.pid().orElseThrow());
    }

    @Test
    void actorLogsAreReadFromTheHostingNode() throws IOException {
        head.localState().orElseThrow().put(actor("a-1", "node-w", 4242));
        Files.writeString(workerLogs.resolve("worker-abc-4242.out"), "starting\nready\n", StandardCharsets.UTF_8);
        Files.writeString(workerLogs.resolve("worker-abc-4242.err"), "warning\n", StandardCharsets.UTF_8);

        List<LogTarget> outs = observer.listLogs("node-w", "*.out");
        List<String> lines = new ArrayList<>();
        try (LogStream stream = observer.actorLogs("a-1", false)) {
            stream.forEachRemaining(lines::add);
            assertEquals(LogStreamState.COMPLETE, stream.state());
            assertEquals("worker-abc-4242.out", stream.target().filename());
        }

        assertEquals(1, outs.size());
        assertEquals(List.of("starting", "ready"), lines);
    }

    @Test
    void followedLogDeliversAppendedLines() throws IOException {
        Path log = workerLogs.resolve("python-core-worker-7.err");
        Files.writeString(log, "boot\n", StandardCharsets.UTF_8);

        LogStream stream = observer.logStreamer().open(LogSelector.file("node-w", "python-core-worker-7.err"), true);
        try {
            assertEquals("boot", stream.next());
            Files.writeString(log, "late line\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

            String appended = assertTimeoutPreemptively(Duration.ofSeconds(10), stream::next);

            assertEquals("late line", appended);
            assertEquals(LogStreamState.STREAMING, stream.state());
        } finally {
            stream.cancel();
        }
        assertFalse(stream.hasNext());
        assertEquals(LogStreamState.CANCELLED, stream.state());
    }

    @Test
    void workerLogsNeedANodeIpWhenSeveralMachinesMatch() {
        AmbiguousLogTargetException withoutIp = assertThrows(AmbiguousLogTargetException.class,
                () -> observer.workerLogs(7, null, LogOutput.OUT, false));
        // every node of this test shares the loopback address
        assertThrows(AmbiguousLogTargetException.class,
                () -> observer.workerLogs(7, "127.0.0.1", LogOutput.OUT, false));

        assertEquals(2, withoutIp.candidates().size());
    }

    private NStateNode start(NStateConfig config) {
        NStateNode node = new NStateNode(config);
        nodes.add(node);
        node.start();
        return node;
    }

    private static NStateConfig.Builder config(NodeInfo local) {
        return NStateConfig.builder(local)
                .heartbeatInterval(Duration.ofMillis(200))
                .heartbeatTimeout(Duration.ofSeconds(3))
                .connectTimeout(Duration.ofSeconds(2))
                .queryTimeout(Duration.ofSeconds(5))
                .queryWorkers(4);
    }

    private static StateRecord task(String id, String state) {
        return StateRecords.create(ResourceKind.TASK, id,
                Map.of("func_or_class_name", "train", "job_id", "01000000"), Map.of("state", state));
    }

    private static StateRecord actor(String id, String nodeId, long pid) {
        return StateRecords.create(ResourceKind.ACTOR, id,
                Map.of(ActorRecord.CLASS_NAME, "Trainer", ActorRecord.JOB_ID, "01000000"),
                Map.of("state", "ALIVE", ActorRecord.NODE_ID, nodeId, ActorRecord.PID, pid));
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
