package dev.nishisan.nstate.common;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * @param maxLines number of trailing lines wanted, {@code -1} for the whole file
 */
public record LogTailRequest(String filename, int maxLines) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public LogTailRequest {
        Objects.requireNonNull(filename, "filename");
    }
}
