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

package dev.nishisan.nstate.cluster.transport;

import dev.nishisan.nstate.common.ClusterMessage;
import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;

import java.io.Closeable;
import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;

/**
 * Messaging between observers and source agents.
 */
public interface Transport extends Closeable {
    void start();

    NodeInfo local();

    /**
     * Every node this transport has heard of, the local one included.
     */
    Collection<NodeInfo> peers();

    void addListener(TransportListener listener);

    void removeListener(TransportListener listener);

    void broadcast(ClusterMessage message);

    void send(ClusterMessage message);

    /**
     * Sends a request and completes with the message whose correlation id matches it. The
     * future fails with {@link java.util.concurrent.TimeoutException} after {@code timeout}
     * and with {@link PeerDisconnectedException} if the destination drops first.
     */
    CompletableFuture<ClusterMessage> sendAndAwait(ClusterMessage message, Duration timeout);

    boolean isConnected(NodeId nodeId);
}
