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

package dev.nishisan.nstate.cluster;

import dev.nishisan.nstate.cluster.transport.Transport;
import dev.nishisan.nstate.cluster.transport.TransportListener;
import dev.nishisan.nstate.common.ClusterMessage;
import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * In-process transport: records what is sent and lets tests inject connectivity events and
 * inbound messages.
 */
public final class FakeTransport implements Transport {
    private final NodeInfo local;
    private final Map<NodeId, NodeInfo> peers = new ConcurrentHashMap<>();
    private final Map<NodeId, Boolean> connected = new ConcurrentHashMap<>();
    private final CopyOnWriteArraySet<TransportListener> listeners = new CopyOnWriteArraySet<>();
    private final List<ClusterMessage> sent = new CopyOnWriteArrayList<>();

    public FakeTransport(NodeInfo local) {
        this.local = local;
    }

    public void simulatePeerConnected(NodeInfo peer) {
        peers.put(peer.nodeId(), peer);
        connected.put(peer.nodeId(), true);
        listeners.forEach(l -> l.onPeerConnected(peer));
    }

    public void simulatePeerDisconnected(NodeId peerId) {
        connected.put(peerId, false);
        listeners.forEach(l -> l.onPeerDisconnected(peerId));
    }

    public void deliver(ClusterMessage message) {
        listeners.forEach(l -> l.onMessage(message));
    }

    public List<ClusterMessage> sent() {
        return sent;
    }

    @Override
    public void start() {
    }

    @Override
    public NodeInfo local() {
        return local;
    }

    @Override
    public Collection<NodeInfo> peers() {
        List<NodeInfo> all = new ArrayList<>();
        all.add(local);
        all.addAll(peers.values());
        return all;
    }

    @Override
    public void addListener(TransportListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(TransportListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void broadcast(ClusterMessage message) {
        for (NodeId peer : peers.keySet()) {
            sent.add(message.redirect(peer));
        }
    }

    @Override
    public void send(ClusterMessage message) {
        sent.add(message);
    }

    @Override
    public CompletableFuture<ClusterMessage> sendAndAwait(ClusterMessage message, Duration timeout) {
        sent.add(message);
        return new CompletableFuture<>();
    }

    @Override
    public boolean isConnected(NodeId nodeId) {
        return connected.getOrDefault(nodeId, false);
    }

    @Override
    public void close() throws IOException {
        listeners.clear();
    }
}
