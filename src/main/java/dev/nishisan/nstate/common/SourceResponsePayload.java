package dev.nishisan.nstate.common;

import java.io.Serial;
import java.io.Serializable;

/**
 * Answer of a source agent. Exactly one of {@code body} (on success) or
 * {@code errorCode}/{@code error} (on failure) is meaningful.
 */
public record SourceResponsePayload(boolean success,
                                    Serializable body,
                                    SourceErrorCode errorCode,
                                    String error) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public static SourceResponsePayload ok(Serializable body) {
        return new SourceResponsePayload(true, body, null, null);
    }

    public static SourceResponsePayload failed(SourceErrorCode code, String error) {
        return new SourceResponsePayload(false, null, code, error);
    }
}
