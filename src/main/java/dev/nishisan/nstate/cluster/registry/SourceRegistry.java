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

package dev.nishisan.nstate.cluster.registry;

import dev.nishisan.nstate.cluster.transport.Transport;
import dev.nishisan.nstate.cluster.transport.TransportListener;
import dev.nishisan.nstate.common.ClusterMessage;
import dev.nishisan.nstate.common.MessageType;
import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps track of the data sources that can currently be queried.
 *
 * <p>Membership follows the transport: a source joins when its connection handshake completes,
 * stays alive through heartbeats and leaves when it disconnects or misses heartbeats for longer
 * than {@link SourceRegistryConfig#heartbeatTimeout()}. Sources can also be registered by hand,
 * which is how embedded setups and tests populate the registry.
 *
 * <p>All membership changes are serialized under one lock and publish a fresh immutable
 * {@link SourceView}; queries only ever read such a view and never observe a change in
 * progress.
 */
public final class SourceRegistry implements TransportListener, Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SourceRegistry.class);

    private final Transport transport;
    private final SourceRegistryConfig config;
    private final ScheduledExecutorService scheduler;
    private final Map<NodeId, SourceEndpoint> endpoints = new HashMap<>();
    private final Set<MembershipListener> listeners = new CopyOnWriteArraySet<>();
    private final Object membershipLock = new Object();
    private volatile SourceView view = new SourceView(Optional.empty(), List.of());
    private volatile ScheduledFuture<?> evictionTask;
    private volatile boolean running;

    /**
     * Registry populated only through {@link #register(NodeInfo)} and {@link #deregister(NodeId)}.
     */
    public SourceRegistry() {
        this.transport = null;
        this.config = SourceRegistryConfig.defaults();
        this.scheduler = null;
    }

    public SourceRegistry(Transport transport, SourceRegistryConfig config, ScheduledExecutorService scheduler) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.config = Objects.requireNonNull(config, "config");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Subscribes to the transport and starts evicting silent sources. Peers the transport
     * already knows as connected are registered right away.
     */
    public void start() {
        if (running || transport == null) {
            return;
        }
        running = true;
        transport.addListener(this);
        for (NodeInfo peer : transport.peers()) {
            if (transport.isConnected(peer.nodeId())) {
                onPeerConnected(peer);
            }
        }
        long interval = config.evictionInterval().toMillis();
        evictionTask = scheduler.scheduleAtFixedRate(this::evictSilentSources, interval, interval, TimeUnit.MILLISECONDS);
    }

    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        transport.removeListener(this);
        ScheduledFuture<?> task = evictionTask;
        if (task != null) {
            task.cancel(false);
        }
    }

    /**
     * @return the current reachable sources; never changes after being returned
     */
    public SourceView snapshot() {
        return view;
    }

    public Optional<NodeInfo> find(NodeId nodeId) {
        return view.find(nodeId);
    }

    public List<NodeInfo> findByHost(String host) {
        return view.findByHost(host);
    }

    /**
     * Adds (or revives) a source. Entries whose roles do not include a source role are ignored.
     *
     * @return true if the source was not reachable before
     */
    public boolean register(NodeInfo source) {
        Objects.requireNonNull(source, "source");
        if (!source.isSource()) {
            return false;
        }
        boolean joined;
        synchronized (membershipLock) {
            SourceEndpoint existing = endpoints.get(source.nodeId());
            joined = existing == null || !existing.isReachable();
            if (existing == null || !existing.info().equals(source)) {
                endpoints.put(source.nodeId(), new SourceEndpoint(source));
                publish();
            } else {
                existing.touch();
                if (joined) {
                    publish();
                }
            }
        }
        if (joined) {
            LOGGER.info("Source joined: {}", source);
            listeners.forEach(l -> l.onSourceJoined(source));
        }
        return joined;
    }

    /**
     * Removes a source permanently, e.g. when its machine leaves the cluster.
     */
    public boolean deregister(NodeId nodeId) {
        SourceEndpoint removed;
        synchronized (membershipLock) {
            removed = endpoints.remove(nodeId);
            if (removed != null) {
                publish();
            }
        }
        if (removed != null && removed.isReachable()) {
            LOGGER.info("Source removed: {}", removed.info());
            listeners.forEach(l -> l.onSourceLeft(removed.info()));
        }
        return removed != null;
    }

    public void addMembershipListener(MembershipListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeMembershipListener(MembershipListener listener) {
        listeners.remove(listener);
    }

    private void markUnreachable(NodeId nodeId, String why) {
        SourceEndpoint endpoint;
        synchronized (membershipLock) {
            endpoint = endpoints.get(nodeId);
            if (endpoint == null || !endpoint.isReachable()) {
                return;
            }
            endpoint.markUnreachable();
            publish();
        }
        LOGGER.warn("Source {} is no longer reachable ({})", endpoint.info(), why);
        listeners.forEach(l -> l.onSourceLeft(endpoint.info()));
    }

    private void publish() {
        List<NodeInfo> machines = new ArrayList<>();
        for (SourceEndpoint endpoint : endpoints.values()) {
            if (endpoint.isReachable()) {
                machines.add(endpoint.info());
            }
        }
        machines.sort(Comparator.comparing(NodeInfo::nodeId));
        Optional<NodeInfo> head = machines.stream().filter(NodeInfo::isHead).findFirst();
        view = new SourceView(head, machines);
    }

    private void evictSilentSources() {
        try {
            if (!running) {
                return;
            }
            long now = Instant.now().toEpochMilli();
            NodeId self = transport.local().nodeId();
            List<NodeId> silent = new ArrayList<>();
            synchronized (membershipLock) {
                for (SourceEndpoint endpoint : endpoints.values()) {
                    if (endpoint.id().equals(self)) {
                        continue;
                    }
                    if (endpoint.isReachable() && now - endpoint.lastSeen() > config.heartbeatTimeout().toMillis()) {
                        silent.add(endpoint.id());
                    }
                }
            }
            silent.forEach(id -> markUnreachable(id, "missed heartbeats for " + config.heartbeatTimeout()));
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected error while evicting silent sources", e);
        }
    }

    @Override
    public void onPeerConnected(NodeInfo peer) {
        register(peer);
    }

    @Override
    public void onPeerDisconnected(NodeId peerId) {
        markUnreachable(peerId, "connection closed");
    }

    @Override
    public void onMessage(ClusterMessage message) {
        if (message.type() != MessageType.HEARTBEAT) {
            return;
        }
        NodeId sourceId = message.source();
        SourceEndpoint endpoint;
        synchronized (membershipLock) {
            endpoint = endpoints.get(sourceId);
        }
        if (endpoint == null || !endpoint.isReachable()) {
            transport.peers().stream()
                    .filter(info -> info.nodeId().equals(sourceId))
                    .findFirst()
                    .ifPresent(this::register);
        } else {
            endpoint.touch();
        }
    }

    @Override
    public void close() {
        stop();
    }
}
