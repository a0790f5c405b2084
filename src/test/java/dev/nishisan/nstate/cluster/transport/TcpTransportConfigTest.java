package dev.nishisan.nstate.cluster.transport;

import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TcpTransportConfigTest {

    private static final NodeInfo LOCAL = new NodeInfo(NodeId.of("node-a"), "10.0.0.1", 7000);

    @Test
    void seedsAreAddressesWithoutTheLocalListener() {
        TcpTransportConfig config = TcpTransportConfig.builder(LOCAL)
                .addSeed("10.0.0.2", 7000)
                .addSeed(" 10.0.0.1 ", 7000)
                .addSeed("10.0.0.1", 7001)
                .addSeed(new NodeInfo(NodeId.of("node-b"), "10.0.0.2", 7000))
                .addSeed(new NodeInfo(NodeId.of("node-a"), "192.168.0.1", 9000))
                .build();

        assertEquals(List.of(
                        InetSocketAddress.createUnresolved("10.0.0.2", 7000),
                        InetSocketAddress.createUnresolved("10.0.0.1", 7001)),
                List.copyOf(config.seeds()));
        InetSocketAddress first = config.seeds().iterator().next();
        assertTrue(first.isUnresolved());
        assertEquals("10.0.0.2", first.getHostString());
    }

    @Test
    void rejectsInvalidSeedsAndTimings() {
        TcpTransportConfig.Builder builder = TcpTransportConfig.builder(LOCAL);

        assertThrows(IllegalArgumentException.class, () -> builder.addSeed(" ", 7000));
        assertThrows(IllegalArgumentException.class, () -> builder.addSeed("10.0.0.2", 0));
        assertThrows(IllegalArgumentException.class, () -> builder.addSeed("10.0.0.2", 65536));
        assertThrows(IllegalArgumentException.class, () -> builder.connectTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> builder.reconnectInterval(Duration.ofSeconds(-1)));
        assertTrue(builder.build().seeds().isEmpty());
    }

    @Test
    void defaultsApplyWhenNotSet() {
        TcpTransportConfig config = TcpTransportConfig.builder(LOCAL).build();

        assertSame(LOCAL, config.local());
        assertEquals(Duration.ofSeconds(5), config.connectTimeout());
        assertEquals(Duration.ofSeconds(3), config.reconnectInterval());
    }
}
