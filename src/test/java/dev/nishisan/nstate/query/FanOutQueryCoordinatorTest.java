package dev.nishisan.nstate.query;

import dev.nishisan.nstate.cluster.registry.SourceRegistry;
import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;
import dev.nishisan.nstate.model.ActorRecord;
import dev.nishisan.nstate.model.ResourceKind;
import dev.nishisan.nstate.model.StateRecord;
import dev.nishisan.nstate.model.StateRecords;
import dev.nishisan.nstate.model.TaskRecord;
import dev.nishisan.nstate.source.InMemoryStateSource;
import dev.nishisan.nstate.source.LogSource;
import dev.nishisan.nstate.source.RecordBatch;
import dev.nishisan.nstate.source.RecordLookup;
import dev.nishisan.nstate.source.SourceConnector;
import dev.nishisan.nstate.source.SourceUnavailableException;
import dev.nishisan.nstate.source.StateSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class FanOutQueryCoordinatorTest {

    private static final NodeInfo HEAD = new NodeInfo(NodeId.of("node-a"), "10.0.0.1", 7000,
            Set.of(NodeInfo.ROLE_HEAD, NodeInfo.ROLE_NODE));
    private static final NodeInfo NODE_B = new NodeInfo(NodeId.of("node-b"), "10.0.0.2", 7000);
    private static final NodeInfo NODE_C = new NodeInfo(NodeId.of("node-c"), "10.0.0.3", 7000);

    private final Map<NodeId, StateSource> sources = new ConcurrentHashMap<>();
    private SourceRegistry registry;
    private FanOutQueryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        registry = new SourceRegistry();
        SourceConnector connector = new SourceConnector() {
            @Override
            public StateSource stateSource(NodeInfo node) {
                StateSource source = sources.get(node.nodeId());
                if (source == null) {
                    throw new IllegalStateException("no source for " + node);
                }
                return source;
            }

            @Override
            public LogSource logSource(NodeInfo node) {
                throw new UnsupportedOperationException();
            }
        };
        coordinator = new FanOutQueryCoordinator(registry, connector, 8);
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    private InMemoryStateSource addSource(NodeInfo node) {
        InMemoryStateSource source = new InMemoryStateSource(node.nodeId());
        sources.put(node.nodeId(), source);
        registry.register(node);
        return source;
    }

    private void addSource(NodeInfo node, StateSource source) {
        sources.put(node.nodeId(), source);
        registry.register(node);
    }

    private static StateRecord task(String id, String state) {
        return StateRecords.create(ResourceKind.TASK, id,
                Map.of(TaskRecord.FUNC_OR_CLASS_NAME, "f", TaskRecord.REQUIRED_RESOURCES, "CPU:1"),
                Map.of("state", state));
    }

    private static List<String> ids(Snapshot snapshot) {
        return snapshot.records().stream().map(StateRecord::id).toList();
    }

    @Test
    void mergesMachineSourcesInIdOrder() {
        addSource(HEAD).put(task("t-3", "RUNNING"));
        InMemoryStateSource b = addSource(NODE_B);
        b.put(task("t-1", "RUNNING"));
        b.put(task("t-2", "FINISHED"));

        Snapshot snapshot = coordinator.query(ResourceKind.TASK, List.of(), 100, false, Duration.ofSeconds(5));

        assertEquals(List.of("t-1", "t-2", "t-3"), ids(snapshot));
        assertFalse(snapshot.truncated());
        assertFalse(snapshot.partial());
        assertTrue(snapshot.warnings().isEmpty());
        assertTrue(snapshot.records().stream().noneMatch(StateRecord::isDetailed));
    }

    @Test
    void clusterWideKindsOnlyAskTheHead() {
        InMemoryStateSource head = addSource(HEAD);
        head.put(StateRecords.create(ResourceKind.ACTOR, "a-1", Map.of(ActorRecord.CLASS_NAME, "Counter"), Map.of("state", "ALIVE")));
        addSource(NODE_B, failing("should not be called"));

        Snapshot snapshot = coordinator.query(ResourceKind.ACTOR, List.of(), 100, false, Duration.ofSeconds(5));

        assertEquals(List.of("a-1"), ids(snapshot));
        assertFalse(snapshot.partial());
        assertEquals(List.of(HEAD), coordinator.targets(ResourceKind.ACTOR));
    }

    @Test
    void failedSourceBecomesWarning() {
        addSource(HEAD).put(task("t-1", "RUNNING"));
        addSource(NODE_B, failing("connection refused"));

        Snapshot snapshot = coordinator.query(ResourceKind.TASK, List.of(), 100, false, Duration.ofSeconds(5));

        assertEquals(List.of("t-1"), ids(snapshot));
        assertTrue(snapshot.partial());
        assertEquals(1, snapshot.warnings().size());
        assertTrue(snapshot.warnings().get(0).contains("node-b"));
        assertTrue(snapshot.warnings().get(0).contains("connection refused"));
    }

    @Test
    void slowSourceTimesOutWithinTheDeadline() {
        addSource(HEAD).put(task("t-1", "RUNNING"));
        addSource(NODE_B, slow(Duration.ofSeconds(30)));

        long start = System.nanoTime();
        Snapshot snapshot = coordinator.query(ResourceKind.TASK, List.of(), 100, false, Duration.ofMillis(300));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertTrue(elapsed.compareTo(Duration.ofSeconds(5)) < 0, "query took " + elapsed);
        assertEquals(List.of("t-1"), ids(snapshot));
        assertTrue(snapshot.partial());
        assertTrue(snapshot.warnings().get(0).contains("did not answer"));
    }

    @Test
    void allSourcesFailing() {
        addSource(HEAD, failing("disk on fire"));
        addSource(NODE_B, failing("connection refused"));

        AllSourcesFailedException e = assertThrows(AllSourcesFailedException.class,
                () -> coordinator.query(ResourceKind.TASK, List.of(), 100, false, Duration.ofSeconds(5)));

        assertEquals(Set.of(HEAD.nodeId(), NODE_B.nodeId()), e.reasons().keySet());
    }

    @Test
    void noReachableSource() {
        AllSourcesFailedException e = assertThrows(AllSourcesFailedException.class,
                () -> coordinator.query(ResourceKind.TASK, List.of(), 100, false, Duration.ofSeconds(5)));

        assertTrue(e.reasons().isEmpty());
    }

    @Test
    void clusterWideQueryWithoutHeadFails() {
        addSource(NODE_B);

        assertThrows(AllSourcesFailedException.class,
                () -> coordinator.query(ResourceKind.JOB, List.of(), 100, false, Duration.ofSeconds(5)));
    }

    @Test
    void filtersAreAppliedAcrossSources() {
        addSource(HEAD).put(task("t-1", "RUNNING"));
        InMemoryStateSource b = addSource(NODE_B);
        b.put(task("t-2", "FINISHED"));
        b.put(task("t-3", "RUNNING"));

        Snapshot snapshot = coordinator.query(ResourceKind.TASK, List.of(FilterPredicate.eq("state", "RUNNING")),
                100, false, Duration.ofSeconds(5));

        assertEquals(List.of("t-1", "t-3"), ids(snapshot));
    }

    @Test
    void unfilteredBatchesAreFilteredByTheCoordinator() {
        addSource(HEAD, new StateSource() {
            @Override
            public NodeId sourceId() {
                return HEAD.nodeId();
            }

            @Override
            public RecordBatch list(ResourceKind kind, List<FilterPredicate> filters, int limit) {
                return RecordBatch.of(List.of(task("t-1", "RUNNING").toSummary(), task("t-2", "FINISHED").toSummary()));
            }

            @Override
            public RecordLookup lookup(ResourceKind kind, String id, boolean detail) {
                return RecordLookup.absent();
            }
        });

        Snapshot snapshot = coordinator.query(ResourceKind.TASK, List.of(FilterPredicate.ne("state", "RUNNING")),
                100, false, Duration.ofSeconds(5));

        assertEquals(List.of("t-2"), ids(snapshot));
        assertEquals(1, snapshot.totalMatched());
    }

    @Test
    void truncationAddsWarning() {
        InMemoryStateSource head = addSource(HEAD);
        InMemoryStateSource b = addSource(NODE_B);
        for (int i = 0; i < 10; i++) {
            (i % 2 == 0 ? head : b).put(task("t-" + i, "RUNNING"));
        }

        Snapshot snapshot = coordinator.query(ResourceKind.TASK, List.of(), 4, false, Duration.ofSeconds(5));

        assertEquals(List.of("t-0", "t-1", "t-2", "t-3"), ids(snapshot));
        assertTrue(snapshot.truncated());
        assertEquals(10, snapshot.totalMatched());
        assertEquals(1, snapshot.warnings().size());
        assertTrue(snapshot.warnings().get(0).contains("truncated"));
    }

    @Test
    void detailPassReturnsFullRecords() {
        addSource(HEAD).put(task("t-1", "RUNNING"));
        addSource(NODE_B).put(task("t-2", "RUNNING"));

        Snapshot snapshot = coordinator.query(ResourceKind.TASK, List.of(), 100, true, Duration.ofSeconds(5));

        assertEquals(List.of("t-1", "t-2"), ids(snapshot));
        assertTrue(snapshot.records().stream().allMatch(StateRecord::isDetailed));
        assertEquals("CPU:1", snapshot.records().get(1).field(TaskRecord.REQUIRED_RESOURCES).orElseThrow());
    }

    @Test
    void failedDetailLookupDegradesToSummary() {
        addSource(HEAD).put(task("t-1", "RUNNING"));
        InMemoryStateSource b = new InMemoryStateSource(NODE_B.nodeId());
        b.put(task("t-2", "RUNNING"));
        addSource(NODE_B, new StateSource() {
            @Override
            public NodeId sourceId() {
                return NODE_B.nodeId();
            }

            @Override
            public RecordBatch list(ResourceKind kind, List<FilterPredicate> filters, int limit) {
                return b.list(kind, filters, limit);
            }

            @Override
            public RecordLookup lookup(ResourceKind kind, String id, boolean detail) throws IOException {
                throw new SourceUnavailableException(NODE_B.nodeId(), "lookup failed");
            }
        });

        Snapshot snapshot = coordinator.query(ResourceKind.TASK, List.of(), 100, true, Duration.ofSeconds(5));

        assertEquals(List.of("t-1", "t-2"), ids(snapshot));
        assertTrue(snapshot.records().get(0).isDetailed());
        assertFalse(snapshot.records().get(1).isDetailed());
        assertEquals(1, snapshot.warnings().size());
        assertTrue(snapshot.warnings().get(0).contains("t-2"));
    }

    @Test
    void lookupFindsRecordOnAnySource() {
        addSource(HEAD);
        addSource(NODE_B).put(task("t-9", "RUNNING"));

        StateRecord record = coordinator.lookup(ResourceKind.TASK, "t-9", true, Duration.ofSeconds(5));

        assertEquals("t-9", record.id());
        assertTrue(record.isDetailed());
    }

    @Test
    void lookupOfReclaimedRecordIsStale() {
        InMemoryStateSource head = addSource(HEAD);
        head.put(task("t-1", "FINISHED"));
        head.reclaim(ResourceKind.TASK, "t-1");
        addSource(NODE_B);

        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                () -> coordinator.lookup(ResourceKind.TASK, "t-1", true, Duration.ofSeconds(5)));

        assertTrue(e.stale());
        assertEquals(ResourceKind.TASK, e.kind().orElseThrow());
        assertTrue(e.getMessage().contains("garbage collected"));
    }

    @Test
    void lookupOfUnknownRecord() {
        addSource(HEAD);
        addSource(NODE_B);

        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                () -> coordinator.lookup(ResourceKind.TASK, "nope", true, Duration.ofSeconds(5)));

        assertFalse(e.stale());
        assertEquals("nope", e.id());
    }

    @Test
    void lookupWithSomeSourcesDownMentionsThem() {
        addSource(HEAD);
        addSource(NODE_B, failing("down"));
        addSource(NODE_C, failing("down"));

        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                () -> coordinator.lookup(ResourceKind.TASK, "nope", true, Duration.ofSeconds(5)));

        assertTrue(e.getMessage().contains("2 of 3"));
    }

    @Test
    void serviceUsesConfiguredDefaults() {
        addSource(HEAD).put(task("t-1", "RUNNING"));
        ClusterStateService service = new ClusterStateService(coordinator, 1, Duration.ofSeconds(5));
        addSource(NODE_B).put(task("t-2", "RUNNING"));

        Snapshot snapshot = service.list(ResourceKind.TASK, List.of());
        StateSummary summary = service.summarize(ResourceKind.TASK, List.of());
        TaskRecord task = service.get(ResourceKind.TASK, "t-2", TaskRecord.class);

        assertEquals(1, snapshot.size());
        assertTrue(snapshot.truncated());
        assertTrue(summary.truncated());
        assertEquals("t-2", task.id());
    }

    private static StateSource failing(String message) {
        return new StateSource() {
            @Override
            public NodeId sourceId() {
                return NodeId.of("failing");
            }

            @Override
            public RecordBatch list(ResourceKind kind, List<FilterPredicate> filters, int limit) throws IOException {
                throw new SourceUnavailableException(sourceId(), message);
            }

            @Override
            public RecordLookup lookup(ResourceKind kind, String id, boolean detail) throws IOException {
                throw new SourceUnavailableException(sourceId(), message);
            }
        };
    }

    private static StateSource slow(Duration delay) {
        return new StateSource() {
            @Override
            public NodeId sourceId() {
                return NodeId.of("slow");
            }

            @Override
            public RecordBatch list(ResourceKind kind, List<FilterPredicate> filters, int limit) throws IOException {
                sleep();
                return RecordBatch.of(List.of());
            }

            @Override
            public RecordLookup lookup(ResourceKind kind, String id, boolean detail) throws IOException {
                sleep();
                return RecordLookup.absent();
            }

            private void sleep() throws IOException {
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new java.io.InterruptedIOException("cancelled");
                }
            }
        };
    }
}
