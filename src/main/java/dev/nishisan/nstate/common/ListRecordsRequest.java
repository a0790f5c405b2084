package dev.nishisan.nstate.common;

import dev.nishisan.nstate.model.ResourceKind;
import dev.nishisan.nstate.query.FilterPredicate;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;
import java.util.Objects;

public record ListRecordsRequest(ResourceKind kind, List<FilterPredicate> filters, int limit) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public ListRecordsRequest {
        Objects.requireNonNull(kind, "kind");
        filters = List.copyOf(filters);
    }
}
