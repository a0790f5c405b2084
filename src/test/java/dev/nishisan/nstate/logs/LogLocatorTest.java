package dev.nishisan.nstate.logs;

import dev.nishisan.nstate.cluster.registry.SourceRegistry;
import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;
import dev.nishisan.nstate.model.ActorRecord;
import dev.nishisan.nstate.model.ResourceKind;
import dev.nishisan.nstate.model.StateRecords;
import dev.nishisan.nstate.query.ClusterStateService;
import dev.nishisan.nstate.query.FanOutQueryCoordinator;
import dev.nishisan.nstate.query.ResourceNotFoundException;
import dev.nishisan.nstate.source.InMemoryStateSource;
import dev.nishisan.nstate.source.LocalLogDirectory;
import dev.nishisan.nstate.source.LogSource;
import dev.nishisan.nstate.source.SourceConnector;
import dev.nishisan.nstate.source.StateSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LogLocatorTest {

    private static final NodeInfo HEAD = new NodeInfo(NodeId.of("node-a"), "10.0.0.1", 7000,
            Set.of(NodeInfo.ROLE_HEAD, NodeInfo.ROLE_NODE));
    private static final NodeInfo NODE_B = new NodeInfo(NodeId.of("node-b"), "10.0.0.2", 7000);

    @TempDir
    Path root;

    private final Map<NodeId, InMemoryStateSource> states = new HashMap<>();
    private final Map<NodeId, LocalLogDirectory> logs = new HashMap<>();
    private SourceRegistry registry;
    private FanOutQueryCoordinator coordinator;
    private LogLocator locator;
    private LogStreamer streamer;

    @BeforeEach
    void setUp() throws IOException {
        registry = new SourceRegistry();
        SourceConnector connector = new SourceConnector() {
            @Override
            public StateSource stateSource(NodeInfo node) {
                return states.get(node.nodeId());
            }

            @Override
            public LogSource logSource(NodeInfo node) {
                return logs.get(node.nodeId());
            }
        };
        coordinator = new FanOutQueryCoordinator(registry, connector, 4);
        ClusterStateService service = new ClusterStateService(coordinator, 1000, Duration.ofSeconds(5));
        locator = new LogLocator(registry, connector, service);
        streamer = new LogStreamer(locator, connector, LogStreamOptions.defaults());
        addMachine(HEAD);
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    private Path addMachine(NodeInfo node) throws IOException {
        Path dir = Files.createDirectories(root.resolve(node.nodeId().value()));
        states.put(node.nodeId(), new InMemoryStateSource(node.nodeId()));
        logs.put(node.nodeId(), new LocalLogDirectory(dir));
        registry.register(node);
        return dir;
    }

    private Path dirOf(NodeInfo node) {
        return root.resolve(node.nodeId().value());
    }

    @Test
    void listsFilesByNodeIdOrIp() throws IOException {
        Files.writeString(dirOf(HEAD).resolve("raylet.out"), "x\n");
        Files.writeString(dirOf(HEAD).resolve("gcs_server.out"), "x\n");
        Files.writeString(dirOf(HEAD).resolve("gcs_server.err"), "x\n");

        List<LogTarget> byId = locator.locate(LogSelector.nodeGlob("node-a", "*.out"));
        List<LogTarget> byIp = locator.locate(LogSelector.nodeGlob("10.0.0.1", "*.out"));

        assertEquals(List.of("gcs_server.out", "raylet.out"), byId.stream().map(LogTarget::filename).toList());
        assertEquals(byId, byIp);
    }

    @Test
    void nodeGlobWithoutNodeListsTheHead() throws IOException {
        addMachine(NODE_B);
        Files.writeString(dirOf(HEAD).resolve("gcs_server.out"), "x\n");
        Files.writeString(dirOf(NODE_B).resolve("raylet.out"), "x\n");

        List<LogTarget> targets = locator.locate(LogSelector.headGlob("*.out"));

        assertEquals(List.of(new LogTarget(HEAD, "gcs_server.out")), targets);
        assertEquals(targets, locator.locate(LogSelector.nodeGlob(null, "*.out")));
    }

    @Test
    void nodeGlobWithoutNodeFailsWithoutHead() {
        registry.deregister(HEAD.nodeId());

        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                () -> locator.locate(LogSelector.headGlob("*")));
        assertTrue(e.getMessage().contains("no head node"));
    }

    @Test
    void exactFileNameIsNotAGlob() throws IOException {
        Files.writeString(dirOf(HEAD).resolve("a[1].log"), "x\n");
        Files.writeString(dirOf(HEAD).resolve("a1.log"), "x\n");

        LogTarget target = locator.locateOne(LogSelector.file("node-a", "a[1].log"));

        assertEquals("a[1].log", target.filename());
    }

    @Test
    void unknownNodeIsNotFound() {
        assertThrows(ResourceNotFoundException.class, () -> locator.locate(LogSelector.nodeGlob("node-z", "*")));
    }

    @Test
    void workerPidOnSingleMachine() throws IOException {
        Files.writeString(dirOf(HEAD).resolve("worker-abc-01000000-4242.out"), "hello\n");
        Files.writeString(dirOf(HEAD).resolve("worker-abc-01000000-4242.err"), "oops\n");

        assertEquals(List.of("hello"), streamer.read(LogSelector.worker(4242), 10));
        assertEquals(List.of("oops"), streamer.read(LogSelector.worker(4242, null, LogOutput.ERR), 10));
    }

    @Test
    void workerPidWithoutIpIsAmbiguousOnSeveralMachines() throws IOException {
        addMachine(NODE_B);
        Files.writeString(dirOf(NODE_B).resolve("worker-abc-01000000-4242.out"), "hello\n");

        AmbiguousLogTargetException e = assertThrows(AmbiguousLogTargetException.class,
                () -> locator.locateOne(LogSelector.worker(4242)));
        assertEquals(2, e.candidates().size());

        LogTarget target = locator.locateOne(LogSelector.worker(4242, "10.0.0.2", LogOutput.OUT));
        assertEquals(NODE_B, target.node());
    }

    @Test
    void missingWorkerFileIsNotFound() {
        assertThrows(ResourceNotFoundException.class, () -> locator.locateOne(LogSelector.worker(777)));
    }

    @Test
    void actorLogsResolveHostingNodeAndPid() throws IOException {
        addMachine(NODE_B);
        states.get(HEAD.nodeId()).put(StateRecords.create(ResourceKind.ACTOR, "actor-1",
                Map.of(ActorRecord.CLASS_NAME, "Counter"),
                Map.of("state", "ALIVE", ActorRecord.NODE_ID, "node-b", ActorRecord.PID, 555)));
        Files.writeString(dirOf(NODE_B).resolve("worker-ffff-01000000-555.out"), "counting\n");

        LogTarget target = locator.locateOne(LogSelector.actor("actor-1"));

        assertEquals(NODE_B, target.node());
        assertEquals("worker-ffff-01000000-555.out", target.filename());
        assertEquals(List.of("counting"), streamer.read(LogSelector.actor("actor-1"), -1));
    }

    @Test
    void actorOnUnreachableNodeIsNotFound() {
        states.get(HEAD.nodeId()).put(StateRecords.create(ResourceKind.ACTOR, "actor-1",
                Map.of(ActorRecord.CLASS_NAME, "Counter"),
                Map.of("state", "ALIVE", ActorRecord.NODE_ID, "node-gone", ActorRecord.PID, 555)));

        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                () -> locator.locateOne(LogSelector.actor("actor-1")));
        assertTrue(e.getMessage().contains("node-gone"));
    }

    @Test
    void unknownActorIsNotFound() {
        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                () -> locator.locateOne(LogSelector.actor("actor-404")));
        assertEquals(ResourceKind.ACTOR, e.kind().orElseThrow());
    }
}
