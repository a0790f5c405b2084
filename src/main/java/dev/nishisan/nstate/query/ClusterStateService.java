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
import dev.nishisan.nstate.model.StateRecord;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Query surface used by command line front ends: per kind summaries, listings and by-id
 * lookups. Results are plain objects; rendering is up to the caller.
 */
public final class ClusterStateService {
    private final FanOutQueryCoordinator coordinator;
    private final int defaultLimit;
    private final Duration defaultTimeout;

    public ClusterStateService(FanOutQueryCoordinator coordinator) {
        this(coordinator, StateQuery.DEFAULT_LIMIT, StateQuery.DEFAULT_TIMEOUT);
    }

    public ClusterStateService(FanOutQueryCoordinator coordinator, int defaultLimit, Duration defaultTimeout) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        if (defaultLimit <= 0) {
            throw new IllegalArgumentException("defaultLimit must be > 0");
        }
        this.defaultLimit = defaultLimit;
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout");
    }

    public StateQuery.Builder newQuery(ResourceKind kind) {
        return StateQuery.builder(kind).limit(defaultLimit).timeout(defaultTimeout);
    }

    public StateSummary summarize(ResourceKind kind, List<FilterPredicate> filters) {
        Snapshot snapshot = coordinator.query(newQuery(kind).filters(filters).build());
        return Summarizer.summarize(kind, snapshot);
    }

    public Snapshot list(ResourceKind kind, List<FilterPredicate> filters) {
        return list(newQuery(kind).filters(filters).build());
    }

    public Snapshot list(ResourceKind kind, List<FilterPredicate> filters, int limit, boolean detail) {
        return list(newQuery(kind).filters(filters).limit(limit).detail(detail).build());
    }

    public Snapshot list(StateQuery query) {
        return coordinator.query(query);
    }

    /**
     * Full record of one resource.
     *
     * @throws ResourceNotFoundException when no data source holds it
     */
    public StateRecord get(ResourceKind kind, String id) {
        return coordinator.lookup(kind, id, true, defaultTimeout);
    }

    /**
     * Typed variant of {@link #get(ResourceKind, String)}.
     */
    public <T extends StateRecord> T get(ResourceKind kind, String id, Class<T> type) {
        return type.cast(get(kind, id));
    }
}
