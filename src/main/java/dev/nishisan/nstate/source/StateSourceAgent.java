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

import dev.nishisan.nstate.cluster.transport.Transport;
import dev.nishisan.nstate.cluster.transport.TransportListener;
import dev.nishisan.nstate.common.ClusterMessage;
import dev.nishisan.nstate.common.HeartbeatPayload;
import dev.nishisan.nstate.common.ListRecordsRequest;
import dev.nishisan.nstate.common.LogListRequest;
import dev.nishisan.nstate.common.LogReadRequest;
import dev.nishisan.nstate.common.LogTailRequest;
import dev.nishisan.nstate.common.LookupRecordRequest;
import dev.nishisan.nstate.common.MessageType;
import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.SourceErrorCode;
import dev.nishisan.nstate.common.SourceRequestPayload;
import dev.nishisan.nstate.common.SourceResponsePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.Serializable;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Machine side endpoint: answers source requests from the local state source and log
 * directory, and broadcasts heartbeats so observers keep this machine in their registry.
 */
public final class StateSourceAgent implements TransportListener, Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(StateSourceAgent.class);

    private final Transport transport;
    private final StateSource stateSource;
    private final LogSource logSource;
    private final Duration heartbeatInterval;
    private final ExecutorService requestPool;
    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> heartbeatTask;
    private volatile boolean running;

    public StateSourceAgent(Transport transport, StateSource stateSource, LogSource logSource, Duration heartbeatInterval) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.stateSource = Objects.requireNonNull(stateSource, "stateSource");
        this.logSource = Objects.requireNonNull(logSource, "logSource");
        this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        this.requestPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "nstate-agent-request");
            t.setDaemon(true);
            return t;
        });
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "nstate-agent-heartbeat");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (running) {
            return;
        }
        running = true;
        transport.addListener(this);
        long interval = heartbeatInterval.toMillis();
        heartbeatTask = scheduler.scheduleAtFixedRate(this::sendHeartbeat, 0, interval, TimeUnit.MILLISECONDS);
        LOGGER.info("Source agent started on {}", transport.local());
    }

    private void sendHeartbeat() {
        try {
            NodeId self = transport.local().nodeId();
            transport.broadcast(ClusterMessage.announce(MessageType.HEARTBEAT, self, HeartbeatPayload.now()));
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to broadcast heartbeat", e);
        }
    }

    @Override
    public void onMessage(ClusterMessage message) {
        if (!running || message.type() != MessageType.SOURCE_REQUEST) {
            return;
        }
        if (!message.isAddressedTo(transport.local().nodeId())) {
            return;
        }
        requestPool.submit(() -> transport.send(ClusterMessage.response(message, handle(message))));
    }

    /**
     * Runs one request against the local sources and packs the outcome.
     */
    SourceResponsePayload handle(ClusterMessage message) {
        SourceRequestPayload request = message.payload(SourceRequestPayload.class);
        try {
            return SourceResponsePayload.ok(dispatch(request));
        } catch (NoSuchFileException e) {
            return SourceResponsePayload.failed(SourceErrorCode.NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException | ClassCastException e) {
            LOGGER.debug("Rejected {} from {}: {}", request.command(), message.source(), e.getMessage());
            return SourceResponsePayload.failed(SourceErrorCode.BAD_REQUEST, e.getMessage());
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Failed to serve {} for {}", request.command(), message.source(), e);
            return SourceResponsePayload.failed(SourceErrorCode.INTERNAL, e.toString());
        }
    }

    private Serializable dispatch(SourceRequestPayload request) throws IOException {
        Serializable body = request.body();
        return switch (request.command()) {
            case LIST_RECORDS -> {
                ListRecordsRequest list = (ListRecordsRequest) body;
                yield stateSource.list(list.kind(), list.filters(), list.limit());
            }
            case LOOKUP_RECORD -> {
                LookupRecordRequest lookup = (LookupRecordRequest) body;
                yield stateSource.lookup(lookup.kind(), lookup.id(), lookup.detail());
            }
            case LIST_LOGS -> new ArrayList<>(logSource.listLogs(((LogListRequest) body).glob()));
            case TAIL_LOG -> {
                LogTailRequest tail = (LogTailRequest) body;
                yield logSource.tail(tail.filename(), tail.maxLines());
            }
            case READ_LOG -> {
                LogReadRequest read = (LogReadRequest) body;
                yield logSource.read(read.filename(), read.offset(), read.maxBytes());
            }
        };
    }

    @Override
    public void close() {
        running = false;
        transport.removeListener(this);
        ScheduledFuture<?> task = heartbeatTask;
        if (task != null) {
            task.cancel(false);
        }
        scheduler.shutdownNow();
        requestPool.shutdownNow();
    }
}
