package dev.nishisan.nstate.common;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * RPC style request addressed to a source agent. The body type depends on the command:
 * {@link ListRecordsRequest}, {@link LookupRecordRequest}, {@link LogListRequest},
 * {@link LogTailRequest} or {@link LogReadRequest}.
 */
public record SourceRequestPayload(SourceCommand command, Serializable body) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public SourceRequestPayload {
        Objects.requireNonNull(command, "command");
    }
}
