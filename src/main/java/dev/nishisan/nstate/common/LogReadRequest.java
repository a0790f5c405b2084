package dev.nishisan.nstate.common;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

public record LogReadRequest(String filename, long offset, int maxBytes) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public LogReadRequest {
        Objects.requireNonNull(filename, "filename");
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be > 0");
        }
    }
}
