package dev.nishisan.nstate.common;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

public record LogListRequest(String glob) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public LogListRequest {
        Objects.requireNonNull(glob, "glob");
    }
}
