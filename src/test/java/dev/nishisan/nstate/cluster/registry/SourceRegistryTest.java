package dev.nishisan.nstate.cluster.registry;

import dev.nishisan.nstate.cluster.FakeTransport;
import dev.nishisan.nstate.common.ClusterMessage;
import dev.nishisan.nstate.common.HeartbeatPayload;
import dev.nishisan.nstate.common.MessageType;
import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class SourceRegistryTest {

    private static final NodeInfo OBSERVER = new NodeInfo(NodeId.of("observer"), "10.0.0.9", 7100,
            Set.of(NodeInfo.ROLE_OBSERVER));
    private static final NodeInfo HEAD = new NodeInfo(NodeId.of("node-a"), "10.0.0.1", 7000,
            Set.of(NodeInfo.ROLE_HEAD, NodeInfo.ROLE_NODE));
    private static final NodeInfo NODE_B = new NodeInfo(NodeId.of("node-b"), "10.0.0.2", 7000);

    private FakeTransport transport;
    private ScheduledExecutorService scheduler;
    private SourceRegistry registry;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport(OBSERVER);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        registry = new SourceRegistry(transport,
                SourceRegistryConfig.of(Duration.ofMillis(400), Duration.ofMillis(50)), scheduler);
        registry.start();
    }

    @AfterEach
    void tearDown() {
        registry.close();
        scheduler.shutdownNow();
    }

    @Test
    void connectedSourcesFormTheView() {
        transport.simulatePeerConnected(NODE_B);
        transport.simulatePeerConnected(HEAD);
        transport.simulatePeerConnected(new NodeInfo(NodeId.of("observer-2"), "10.0.0.8", 7100,
                Set.of(NodeInfo.ROLE_OBSERVER)));

        SourceView view = registry.snapshot();

        assertEquals(List.of(HEAD, NODE_B), view.machines());
        assertEquals(HEAD, view.head().orElseThrow());
        assertEquals(List.of(NODE_B), registry.findByHost("10.0.0.2"));
    }

    @Test
    void viewsAreImmutableCopies() {
        transport.simulatePeerConnected(HEAD);
        SourceView before = registry.snapshot();

        transport.simulatePeerConnected(NODE_B);

        assertEquals(1, before.machines().size());
        assertEquals(2, registry.snapshot().machines().size());
    }

    @Test
    void disconnectedSourceLeavesAndRejoins() {
        List<String> events = new CopyOnWriteArrayList<>();
        registry.addMembershipListener(new MembershipListener() {
            @Override
            public void onSourceJoined(NodeInfo source) {
                events.add("+" + source.nodeId());
            }

            @Override
            public void onSourceLeft(NodeInfo source) {
                events.add("-" + source.nodeId());
            }
        });
        transport.simulatePeerConnected(NODE_B);
        transport.simulatePeerDisconnected(NODE_B.nodeId());

        assertTrue(registry.snapshot().machines().isEmpty());

        transport.deliver(ClusterMessage.request(MessageType.HEARTBEAT, NODE_B.nodeId(), OBSERVER.nodeId(),
                HeartbeatPayload.now()));

        assertEquals(List.of(NODE_B), registry.snapshot().machines());
        assertEquals(List.of("+node-b", "-node-b", "+node-b"), events);
    }

    @Test
    void silentSourceIsEvicted() {
        transport.simulatePeerConnected(NODE_B);
        assertEquals(1, registry.snapshot().machines().size());

        await().atMost(Duration.ofSeconds(5)).until(() -> registry.snapshot().machines().isEmpty());
    }

    @Test
    void heartbeatsKeepSourceAlive() throws InterruptedException {
        transport.simulatePeerConnected(NODE_B);
        for (int i = 0; i < 10; i++) {
            transport.deliver(ClusterMessage.request(MessageType.HEARTBEAT, NODE_B.nodeId(), OBSERVER.nodeId(),
                    HeartbeatPayload.now()));
            Thread.sleep(100);
        }

        assertEquals(List.of(NODE_B), registry.snapshot().machines());
    }

    @Test
    void manualRegistryHasNoEviction() {
        SourceRegistry manual = new SourceRegistry();
        assertTrue(manual.register(HEAD));
        assertFalse(manual.register(HEAD));
        assertFalse(manual.register(OBSERVER));

        assertEquals(List.of(HEAD), manual.snapshot().machines());
        assertTrue(manual.deregister(HEAD.nodeId()));
        assertTrue(manual.snapshot().head().isEmpty());
    }
}
