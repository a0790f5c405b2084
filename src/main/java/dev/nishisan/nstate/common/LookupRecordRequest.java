package dev.nishisan.nstate.common;

import dev.nishisan.nstate.model.ResourceKind;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

public record LookupRecordRequest(ResourceKind kind, String id, boolean detail) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public LookupRecordRequest {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
    }
}
