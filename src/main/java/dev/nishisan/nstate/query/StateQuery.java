/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.nstate.query;

import dev.nishisan.nstate.model.ResourceKind;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of one list/summarize call.
 */
public final class StateQuery {
    public static final int DEFAULT_LIMIT = 100_000;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final ResourceKind kind;
    private final List<FilterPredicate> filters;
    private final int limit;
    private final boolean detail;
    private final Duration timeout;

    private StateQuery(Builder builder) {
        this.kind = builder.kind;
        this.filters = List.copyOf(builder.filters);
        this.limit = builder.limit;
        this.detail = builder.detail;
        this.timeout = builder.timeout;
    }

    public ResourceKind kind() {
        return kind;
    }

    public List<FilterPredicate> filters() {
        return filters;
    }

    public int limit() {
        return limit;
    }

    public boolean detail() {
        return detail;
    }

    public Duration timeout() {
        return timeout;
    }

    public static Builder builder(ResourceKind kind) {
        return new Builder(kind);
    }

    @Override
    public String toString() {
        return "StateQuery{" + kind + ", filters=" + filters + ", limit=" + limit
                + ", detail=" + detail + ", timeout=" + timeout + '}';
    }

    public static final class Builder {
        private final ResourceKind kind;
        private final List<FilterPredicate> filters = new ArrayList<>();
        private int limit = DEFAULT_LIMIT;
        private boolean detail;
        private Duration timeout = DEFAULT_TIMEOUT;

        private Builder(ResourceKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Builder filter(FilterPredicate predicate) {
            filters.add(Objects.requireNonNull(predicate, "predicate"));
            return this;
        }

        public Builder filters(List<FilterPredicate> predicates) {
            predicates.forEach(this::filter);
            return this;
        }

        public Builder limit(int limit) {
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be > 0");
            }
            this.limit = limit;
            return this;
        }

        public Builder detail(boolean detail) {
            this.detail = detail;
            return this;
        }

        public Builder timeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public StateQuery build() {
            return new StateQuery(this);
        }
    }
}
