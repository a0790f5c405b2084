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

import dev.nishisan.nstate.cluster.registry.SourceRegistry;
import dev.nishisan.nstate.cluster.registry.SourceView;
import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;
import dev.nishisan.nstate.model.ResourceKind;
import dev.nishisan.nstate.model.StateRecord;
import dev.nishisan.nstate.source.RecordBatch;
import dev.nishisan.nstate.source.RecordLookup;
import dev.nishisan.nstate.source.SourceConnector;
import dev.nishisan.nstate.source.StateSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Sends one query to every data source owning the requested kind and folds the answers into
 * a {@link Snapshot}.
 *
 * <p>Cluster-wide kinds are asked to the head source only, per-machine kinds to every
 * reachable machine source. All calls run concurrently against one deadline; a source that
 * fails or is still running when the deadline passes is cancelled and reported as a warning.
 * Only when no targeted source answers does the query fail, with
 * {@link AllSourcesFailedException}. Calls are never retried.
 */
public final class FanOutQueryCoordinator implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(FanOutQueryCoordinator.class);

    private final SourceRegistry registry;
    private final SourceConnector connector;
    private final ExecutorService pool;
    private final boolean ownsPool;

    public FanOutQueryCoordinator(SourceRegistry registry, SourceConnector connector, int workers) {
        this(registry, connector, newPool(workers), true);
    }

    public FanOutQueryCoordinator(SourceRegistry registry, SourceConnector connector, ExecutorService pool) {
        this(registry, connector, pool, false);
    }

    private FanOutQueryCoordinator(SourceRegistry registry, SourceConnector connector, ExecutorService pool, boolean ownsPool) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.ownsPool = ownsPool;
    }

    private static ExecutorService newPool(int workers) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be > 0");
        }
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "nstate-query-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Sources owning records of the given kind, taken from the current registry view.
     */
    public List<NodeInfo> targets(ResourceKind kind) {
        SourceView view = registry.snapshot();
        if (kind.isClusterWide()) {
            return view.head().map(List::of).orElse(List.of());
        }
        return view.machines();
    }

    public Snapshot query(ResourceKind kind, List<FilterPredicate> filters, int limit, boolean detail, Duration timeout) {
        return query(StateQuery.builder(kind).filters(filters).limit(limit).detail(detail).timeout(timeout).build());
    }

    public Snapshot query(StateQuery query) {
        ResourceKind kind = query.kind();
        List<NodeInfo> targets = targets(kind);
        if (targets.isEmpty()) {
            throw new AllSourcesFailedException(kind, Map.of());
        }
        List<Outcome<NodeInfo, RecordBatch>> outcomes = dispatch(targets, target -> target, query.timeout(),
                (source, target) -> source.list(kind, query.filters(), query.limit()));

        List<SourceResponse> responses = new ArrayList<>(outcomes.size());
        Map<StateRecord, NodeInfo> owners = new IdentityHashMap<>();
        for (Outcome<NodeInfo, RecordBatch> outcome : outcomes) {
            if (outcome.succeeded()) {
                RecordBatch batch = outcome.value();
                if (!batch.filtered()) {
                    batch = batch.retain(FilterEngine.filter(batch.records(), query.filters()));
                }
                batch.records().forEach(record -> owners.put(record, outcome.source()));
                responses.add(new SourceResponse.Success(outcome.source(), batch));
            } else {
                responses.add(outcome.failure());
            }
        }
        List<String> warnings = failureWarnings(kind, responses);

        AggregationResult aggregated = Aggregator.aggregate(responses, query.limit());
        List<StateRecord> records = aggregated.records();
        if (query.detail()) {
            records = fetchDetails(kind, records, owners, query.timeout(), warnings);
        }
        if (aggregated.truncated()) {
            warnings.add(truncationWarning(records.size(), aggregated.total()));
        }
        boolean partial = responses.stream().anyMatch(response -> !response.isSuccess());
        return new Snapshot(records, aggregated.truncated(), warnings, aggregated.total(), partial);
    }

    /**
     * Finds one record by id on the sources owning its kind.
     *
     * @throws ResourceNotFoundException  when no source holds it; {@code stale()} is set when a
     *                                    source reports it as garbage collected
     * @throws AllSourcesFailedException when no source answered
     */
    public StateRecord lookup(ResourceKind kind, String id, boolean detail, Duration timeout) {
        Objects.requireNonNull(id, "id");
        List<NodeInfo> targets = targets(kind);
        if (targets.isEmpty()) {
            throw new AllSourcesFailedException(kind, Map.of());
        }
        List<Outcome<NodeInfo, RecordLookup>> outcomes = dispatch(targets, target -> target, timeout,
                (source, target) -> source.lookup(kind, id, detail));

        boolean reclaimed = false;
        Map<NodeId, String> reasons = new LinkedHashMap<>();
        for (Outcome<NodeInfo, RecordLookup> outcome : outcomes) {
            if (!outcome.succeeded()) {
                reasons.put(outcome.source().nodeId(), outcome.failure().describeFailure());
                continue;
            }
            RecordLookup result = outcome.value();
            if (result.status() == RecordLookup.Status.FOUND) {
                return result.record();
            }
            reclaimed |= result.status() == RecordLookup.Status.RECLAIMED;
        }
        if (reclaimed) {
            throw ResourceNotFoundException.reclaimed(kind, id);
        }
        if (reasons.size() == targets.size()) {
            throw new AllSourcesFailedException(kind, reasons);
        }
        if (!reasons.isEmpty()) {
            throw ResourceNotFoundException.absent(kind, id,
                    reasons.size() + " of " + targets.size() + " data sources did not answer");
        }
        throw ResourceNotFoundException.absent(kind, id);
    }

    private List<StateRecord> fetchDetails(ResourceKind kind,
                                           List<StateRecord> records,
                                           Map<StateRecord, NodeInfo> owners,
                                           Duration timeout,
                                           List<String> warnings) {
        if (records.isEmpty()) {
            return records;
        }
        List<Outcome<StateRecord, RecordLookup>> outcomes = dispatch(records, owners::get, timeout,
                (source, record) -> source.lookup(kind, record.id(), true));

        Map<StateRecord, StateRecord> detailed = new IdentityHashMap<>();
        for (Outcome<StateRecord, RecordLookup> outcome : outcomes) {
            StateRecord summary = outcome.item();
            if (outcome.succeeded() && outcome.value().status() == RecordLookup.Status.FOUND) {
                detailed.put(summary, outcome.value().record());
                continue;
            }
            String reason = outcome.succeeded()
                    ? "the data source no longer holds it"
                    : outcome.failure().describeFailure();
            warnings.add("Showing summary of " + kind + " " + summary.id() + ": details unavailable, " + reason);
        }
        List<StateRecord> result = new ArrayList<>(records.size());
        for (StateRecord record : records) {
            result.add(detailed.getOrDefault(record, record.toSummary()));
        }
        return result;
    }

    private <I, T> List<Outcome<I, T>> dispatch(List<I> items,
                                                Function<I, NodeInfo> ownerOf,
                                                Duration timeout,
                                                SourceCall<I, T> call) {
        ExecutorCompletionService<Outcome<I, T>> completion = new ExecutorCompletionService<>(pool);
        Map<Future<Outcome<I, T>>, I> running = new LinkedHashMap<>();
        for (I item : items) {
            NodeInfo owner = ownerOf.apply(item);
            running.put(completion.submit(() -> invoke(owner, item, call)), item);
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        List<Outcome<I, T>> outcomes = new ArrayList<>(items.size());
        try {
            while (!running.isEmpty()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                Future<Outcome<I, T>> done = completion.poll(remaining, TimeUnit.NANOSECONDS);
                if (done == null) {
                    break;
                }
                I item = running.remove(done);
                outcomes.add(collect(done, ownerOf.apply(item), item));
            }
        } catch (InterruptedException e) {
            running.keySet().forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new CancellationException("Query interrupted while waiting for data sources");
        }

        running.forEach((future, item) -> {
            future.cancel(true);
            outcomes.add(Outcome.failed(ownerOf.apply(item), item, new SourceResponse.Timeout(ownerOf.apply(item), timeout)));
        });
        return outcomes;
    }

    private <I, T> Outcome<I, T> invoke(NodeInfo owner, I item, SourceCall<I, T> call) {
        try {
            StateSource source = connector.stateSource(owner);
            return Outcome.succeeded(owner, item, call.apply(source, item));
        } catch (IOException | RuntimeException e) {
            return Outcome.failed(owner, item, new SourceResponse.PartialFailure(owner, describe(e)));
        }
    }

    private static <I, T> Outcome<I, T> collect(Future<Outcome<I, T>> done, NodeInfo owner, I item) {
        try {
            return done.get();
        } catch (ExecutionException e) {
            return Outcome.failed(owner, item, new SourceResponse.PartialFailure(owner, describe(e.getCause())));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Query interrupted while collecting results");
        }
    }

    private static List<String> failureWarnings(ResourceKind kind, List<SourceResponse> responses) {
        List<String> warnings = new ArrayList<>();
        Map<NodeId, String> reasons = new LinkedHashMap<>();
        for (SourceResponse response : responses) {
            if (!response.isSuccess()) {
                String warning = response.describeFailure();
                warnings.add(warning);
                reasons.put(response.source().nodeId(), warning);
                LOGGER.warn("{} query: {}", kind, warning);
            }
        }
        if (!responses.isEmpty() && reasons.size() == responses.size()) {
            throw new AllSourcesFailedException(kind, reasons);
        }
        return warnings;
    }

    static String truncationWarning(int shown, long total) {
        return "Showing " + shown + " of " + total + " matching records; the result was truncated. "
                + "Narrow the query with filters or raise the limit.";
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null ? error.getClass().getSimpleName() : message;
    }

    @Override
    public void close() {
        if (ownsPool) {
            pool.shutdownNow();
        }
    }

    @FunctionalInterface
    private interface SourceCall<I, T> {
        T apply(StateSource source, I item) throws IOException;
    }

    private record Outcome<I, T>(NodeInfo source, I item, T value, SourceResponse failure) {

        static <I, T> Outcome<I, T> succeeded(NodeInfo source, I item, T value) {
            return new Outcome<>(source, item, value, null);
        }

        static <I, T> Outcome<I, T> failed(NodeInfo source, I item, SourceResponse failure) {
            return new Outcome<>(source, item, null, failure);
        }

        boolean succeeded() {
            return failure == null;
        }
    }
}
