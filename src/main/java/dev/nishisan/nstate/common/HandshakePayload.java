package dev.nishisan.nstate.common;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;
import java.util.Set;

/**
 * First message on every connection: the sender's identity plus the peers it already knows,
 * so that observers discover machine sources from a single seed. The accepting side answers
 * with {@code reply = true}, which is never answered again.
 */
public record HandshakePayload(NodeInfo local, Set<NodeInfo> peers, boolean reply) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public HandshakePayload {
        Objects.requireNonNull(local, "local");
        peers = Set.copyOf(Objects.requireNonNull(peers, "peers"));
    }
}
