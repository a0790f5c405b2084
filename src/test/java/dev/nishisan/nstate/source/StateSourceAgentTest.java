package dev.nishisan.nstate.source;

import dev.nishisan.nstate.cluster.FakeTransport;
import dev.nishisan.nstate.common.ClusterMessage;
import dev.nishisan.nstate.common.LogTailRequest;
import dev.nishisan.nstate.common.LookupRecordRequest;
import dev.nishisan.nstate.common.MessageType;
import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;
import dev.nishisan.nstate.common.SourceCommand;
import dev.nishisan.nstate.common.SourceErrorCode;
import dev.nishisan.nstate.common.SourceRequestPayload;
import dev.nishisan.nstate.common.SourceResponsePayload;
import dev.nishisan.nstate.model.ResourceKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Serializable;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class StateSourceAgentTest {

    private static final NodeInfo SELF = new NodeInfo(NodeId.of("node-a"), "10.0.0.1", 7000);
    private static final NodeInfo OBSERVER = new NodeInfo(NodeId.of("observer"), "10.0.0.9", 7100);

    @TempDir
    Path logDir;

    private FakeTransport transport;
    private StateSourceAgent agent;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport(SELF);
        agent = new StateSourceAgent(transport, new InMemoryStateSource(SELF.nodeId()),
                new LocalLogDirectory(logDir), Duration.ofMillis(50));
    }

    @AfterEach
    void tearDown() {
        agent.close();
    }

    @Test
    void errorsAreMappedToCodes() {
        SourceResponsePayload missing = agent.handle(request(SourceCommand.TAIL_LOG, new LogTailRequest("gone.out", 10)));
        SourceResponsePayload escape = agent.handle(request(SourceCommand.TAIL_LOG, new LogTailRequest("../etc/passwd", 10)));
        SourceResponsePayload wrongBody = agent.handle(request(SourceCommand.LIST_RECORDS, new LogTailRequest("x", 1)));
        SourceResponsePayload ok = agent.handle(request(SourceCommand.LOOKUP_RECORD,
                new LookupRecordRequest(ResourceKind.TASK, "t-1", false)));

        assertEquals(SourceErrorCode.NOT_FOUND, missing.errorCode());
        assertEquals(SourceErrorCode.BAD_REQUEST, escape.errorCode());
        assertEquals(SourceErrorCode.BAD_REQUEST, wrongBody.errorCode());
        assertTrue(ok.success());
        assertEquals(RecordLookup.Status.ABSENT, ((RecordLookup) ok.body()).status());
    }

    @Test
    void answersOnlyRequestsAddressedToItself() {
        agent.start();
        ClusterMessage forUs = request(SourceCommand.LOOKUP_RECORD, new LookupRecordRequest(ResourceKind.TASK, "t-1", false));
        ClusterMessage forOther = ClusterMessage.request(MessageType.SOURCE_REQUEST, OBSERVER.nodeId(), NodeId.of("node-b"),
                new SourceRequestPayload(SourceCommand.LOOKUP_RECORD, new LookupRecordRequest(ResourceKind.TASK, "t-1", false)));

        transport.deliver(forOther);
        transport.deliver(forUs);

        await().atMost(2, TimeUnit.SECONDS).until(() -> transport.sent().stream()
                .anyMatch(m -> m.type() == MessageType.SOURCE_RESPONSE));
        ClusterMessage response = transport.sent().stream()
                .filter(m -> m.type() == MessageType.SOURCE_RESPONSE)
                .findFirst().orElseThrow();
        assertEquals(forUs.messageId(), response.correlationId().orElseThrow());
        assertEquals(OBSERVER.nodeId(), response.destination());
        assertEquals(1, transport.sent().stream().filter(m -> m.type() == MessageType.SOURCE_RESPONSE).count());
    }

    @Test
    void heartbeatsReachKnownPeers() {
        transport.simulatePeerConnected(OBSERVER);
        agent.start();

        await().atMost(2, TimeUnit.SECONDS).until(() -> transport.sent().stream()
                .filter(m -> m.type() == MessageType.HEARTBEAT)
                .count() >= 2);
        assertTrue(transport.sent().stream()
                .filter(m -> m.type() == MessageType.HEARTBEAT)
                .allMatch(m -> m.destination().equals(OBSERVER.nodeId()) && m.source().equals(SELF.nodeId())));
    }

    private static ClusterMessage request(SourceCommand command, Serializable body) {
        return ClusterMessage.request(MessageType.SOURCE_REQUEST, OBSERVER.nodeId(), SELF.nodeId(),
                new SourceRequestPayload(command, body));
    }
}
