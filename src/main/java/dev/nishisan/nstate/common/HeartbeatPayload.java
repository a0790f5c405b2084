package dev.nishisan.nstate.common;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;

/**
 * Liveness signal broadcast by source agents.
 */
public record HeartbeatPayload(long epochMilli) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public static HeartbeatPayload now() {
        return new HeartbeatPayload(Instant.now().toEpochMilli());
    }
}
