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

import dev.nishisan.nstate.cluster.transport.PeerDisconnectedException;
import dev.nishisan.nstate.cluster.transport.Transport;
import dev.nishisan.nstate.common.ClusterMessage;
import dev.nishisan.nstate.common.ListRecordsRequest;
import dev.nishisan.nstate.common.LogListRequest;
import dev.nishisan.nstate.common.LogReadRequest;
import dev.nishisan.nstate.common.LogTailRequest;
import dev.nishisan.nstate.common.LookupRecordRequest;
import dev.nishisan.nstate.common.MessageType;
import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;
import dev.nishisan.nstate.common.SourceCommand;
import dev.nishisan.nstate.common.SourceRequestPayload;
import dev.nishisan.nstate.common.SourceResponsePayload;
import dev.nishisan.nstate.model.ResourceKind;
import dev.nishisan.nstate.query.FilterPredicate;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.Serializable;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Client side of a source agent reached through the transport. Every call is one
 * request/response exchange; transport failures surface as {@link SourceUnavailableException}.
 */
public final class RemoteSource implements StateSource, LogSource {
    private final Transport transport;
    private final NodeInfo target;
    private final Duration requestTimeout;

    public RemoteSource(Transport transport, NodeInfo target, Duration requestTimeout) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.target = Objects.requireNonNull(target, "target");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    public NodeInfo target() {
        return target;
    }

    @Override
    public NodeId sourceId() {
        return target.nodeId();
    }

    @Override
    public RecordBatch list(ResourceKind kind, List<FilterPredicate> filters, int limit) throws IOException {
        return expect(RecordBatch.class,
                call(SourceCommand.LIST_RECORDS, new ListRecordsRequest(kind, filters, limit)));
    }

    @Override
    public RecordLookup lookup(ResourceKind kind, String id, boolean detail) throws IOException {
        return expect(RecordLookup.class,
                call(SourceCommand.LOOKUP_RECORD, new LookupRecordRequest(kind, id, detail)));
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<String> listLogs(String glob) throws IOException {
        return new ArrayList<>((List<String>) expect(List.class, call(SourceCommand.LIST_LOGS, new LogListRequest(glob))));
    }

    @Override
    public LogTail tail(String filename, int maxLines) throws IOException {
        return expect(LogTail.class, call(SourceCommand.TAIL_LOG, new LogTailRequest(filename, maxLines)));
    }

    @Override
    public LogChunk read(String filename, long offset, int maxBytes) throws IOException {
        return expect(LogChunk.class, call(SourceCommand.READ_LOG, new LogReadRequest(filename, offset, maxBytes)));
    }

    private Serializable call(SourceCommand command, Serializable body) throws IOException {
        ClusterMessage request = ClusterMessage.request(MessageType.SOURCE_REQUEST,
                transport.local().nodeId(), target.nodeId(), new SourceRequestPayload(command, body));
        CompletableFuture<ClusterMessage> future = transport.sendAndAwait(request, requestTimeout);
        ClusterMessage response;
        try {
            response = future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException(command + " to " + target.nodeId() + " interrupted");
        } catch (ExecutionException e) {
            throw unavailable(command, e.getCause());
        }

        SourceResponsePayload payload = response.payload(SourceResponsePayload.class);
        if (payload.success()) {
            return payload.body();
        }
        String error = payload.error() == null ? "unknown error" : payload.error();
        switch (payload.errorCode()) {
            case NOT_FOUND:
                throw new NoSuchFileException(error);
            case BAD_REQUEST:
                throw new IllegalArgumentException(error);
            default:
                throw new SourceUnavailableException(target.nodeId(), command + " failed remotely: " + error);
        }
    }

    private SourceUnavailableException unavailable(SourceCommand command, Throwable cause) {
        if (cause instanceof TimeoutException) {
            return new SourceUnavailableException(target.nodeId(),
                    command + " timed out after " + requestTimeout, cause);
        }
        if (cause instanceof PeerDisconnectedException) {
            return new SourceUnavailableException(target.nodeId(), "disconnected during " + command, cause);
        }
        return new SourceUnavailableException(target.nodeId(), String.valueOf(cause.getMessage()), cause);
    }

    private <T> T expect(Class<T> type, Serializable body) throws SourceUnavailableException {
        if (!type.isInstance(body)) {
            throw new SourceUnavailableException(target.nodeId(), "unexpected response body "
                    + (body == null ? "null" : body.getClass().getName()));
        }
        return type.cast(body);
    }
}
