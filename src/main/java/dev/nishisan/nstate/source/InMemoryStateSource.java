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

package dev.nishisan.nstate.source;

import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.model.ObjectRecord;
import dev.nishisan.nstate.model.ResourceKind;
import dev.nishisan.nstate.model.StateRecord;
import dev.nishisan.nstate.query.FilterEngine;
import dev.nishisan.nstate.query.FilterPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * State source keeping DETAIL records in memory, ordered by id within each kind.
 *
 * <p>Reclaimed ids are remembered in a bounded tombstone set so that lookups can tell
 * "garbage collected" apart from "never existed". Once more than {@code maxTombstones} ids
 * were reclaimed for a kind, the oldest ones are forgotten and report absent again.
 */
public final class InMemoryStateSource implements StateSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryStateSource.class);

    public static final int DEFAULT_MAX_TOMBSTONES = 10_000;

    private final NodeId sourceId;
    private final boolean recordCallsite;
    private final int maxTombstones;
    private final Map<ResourceKind, ConcurrentNavigableMap<String, StateRecord>> records = new EnumMap<>(ResourceKind.class);
    private final Map<ResourceKind, Set<String>> tombstones = new EnumMap<>(ResourceKind.class);

    public InMemoryStateSource(NodeId sourceId) {
        this(sourceId, false, DEFAULT_MAX_TOMBSTONES);
    }

    /**
     * @param recordCallsite whether object creation callsites are kept; when off they are
     *                       dropped as records are stored
     */
    public InMemoryStateSource(NodeId sourceId, boolean recordCallsite, int maxTombstones) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.recordCallsite = recordCallsite;
        if (maxTombstones < 0) {
            throw new IllegalArgumentException("maxTombstones must be >= 0");
        }
        this.maxTombstones = maxTombstones;
        for (ResourceKind kind : ResourceKind.values()) {
            records.put(kind, new ConcurrentSkipListMap<>());
            tombstones.put(kind, new LinkedHashSet<>());
        }
    }

    @Override
    public NodeId sourceId() {
        return sourceId;
    }

    public boolean recordsCallsite() {
        return recordCallsite;
    }

    /**
     * Stores or replaces a record. Summary records are accepted as they are.
     */
    public void put(StateRecord record) {
        Objects.requireNonNull(record, "record");
        StateRecord stored = record;
        if (!recordCallsite && record instanceof ObjectRecord object) {
            stored = object.withoutCallSite();
        }
        records.get(stored.kind()).put(stored.id(), stored);
        Set<String> dead = tombstones.get(stored.kind());
        synchronized (dead) {
            dead.remove(stored.id());
        }
    }

    public void putAll(Iterable<? extends StateRecord> batch) {
        batch.forEach(this::put);
    }

    /**
     * Merges state changes into a stored record.
     *
     * @return false when the record is not held
     */
    public boolean updateState(ResourceKind kind, String id, Map<String, ?> changes) {
        StateRecord updated = records.get(kind).computeIfPresent(id, (key, current) -> current.withState(changes));
        return updated != null;
    }

    /**
     * Drops the data of a record while remembering that it existed.
     */
    public boolean reclaim(ResourceKind kind, String id) {
        StateRecord removed = records.get(kind).remove(id);
        if (removed == null) {
            return false;
        }
        Set<String> dead = tombstones.get(kind);
        synchronized (dead) {
            dead.add(id);
            while (dead.size() > maxTombstones) {
                String oldest = dead.iterator().next();
                dead.remove(oldest);
            }
        }
        LOGGER.debug("Reclaimed {} {} on {}", kind, id, sourceId);
        return true;
    }

    public Optional<StateRecord> get(ResourceKind kind, String id) {
        return Optional.ofNullable(records.get(kind).get(id));
    }

    public int size(ResourceKind kind) {
        return records.get(kind).size();
    }

    @Override
    public RecordBatch list(ResourceKind kind, List<FilterPredicate> filters, int limit) {
        Objects.requireNonNull(kind, "kind");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        List<StateRecord> page = new ArrayList<>(Math.min(limit, 1024));
        long total = 0;
        for (StateRecord record : records.get(kind).values()) {
            if (!FilterEngine.matches(record, filters)) {
                continue;
            }
            total++;
            if (page.size() < limit) {
                page.add(record.toSummary());
            }
        }
        return RecordBatch.filtered(page, total);
    }

    @Override
    public RecordLookup lookup(ResourceKind kind, String id, boolean detail) {
        StateRecord record = records.get(kind).get(id);
        if (record != null) {
            return RecordLookup.found(detail ? record : record.toSummary());
        }
        Set<String> dead = tombstones.get(kind);
        synchronized (dead) {
            return dead.contains(id) ? RecordLookup.reclaimed() : RecordLookup.absent();
        }
    }
}
