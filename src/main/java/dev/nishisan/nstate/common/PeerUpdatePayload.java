package dev.nishisan.nstate.common;

import java.io.Serial;
import java.io.Serializable;
import java.util.Set;

public record PeerUpdatePayload(Set<NodeInfo> peers) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public PeerUpdatePayload {
        peers = Set.copyOf(peers);
    }
}
