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
import dev.nishisan.nstate.common.HandshakePayload;
import dev.nishisan.nstate.common.MessageType;
import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;
import dev.nishisan.nstate.common.PeerUpdatePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * TCP transport based on Java serialization of {@link ClusterMessage} envelopes.
 *
 * <p>Each connection starts with a handshake carrying the sender's identity and the peers it
 * knows; peers learned that way are connected in the background, so an observer configured
 * with a single seed ends up connected to every source agent. Lost connections are retried
 * every {@link TcpTransportConfig#reconnectInterval()}.
 */
public final class TcpTransport implements Transport {
    private static final Logger LOGGER = LoggerFactory.getLogger(TcpTransport.class);

    private final TcpTransportConfig config;
    private final Map<NodeId, NodeInfo> knownPeers = new ConcurrentHashMap<>();
    private final Map<NodeId, Connection> connections = new ConcurrentHashMap<>();
    private final Set<TransportListener> listeners = new CopyOnWriteArraySet<>();
    private final Map<UUID, PendingResponse> pendingResponses = new ConcurrentHashMap<>();
    private final Map<String, Object> connectLocks = new ConcurrentHashMap<>();
    private final Set<Connection> openConnections = ConcurrentHashMap.newKeySet();
    private final ExecutorService workerPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "nstate-transport-worker");
        t.setDaemon(true);
        return t;
    });
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "nstate-transport-scheduler");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean running;
    private ServerSocket serverSocket;

    public TcpTransport(TcpTransportConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        knownPeers.put(config.local().nodeId(), config.local());
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(config.local().host(), config.local().port()));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to bind TCP transport on " + config.local().address(), e);
        }
        running = true;
        workerPool.submit(this::acceptLoop);
        long interval = config.reconnectInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::reconnectLoop, interval, interval, TimeUnit.MILLISECONDS);
        config.seeds().forEach(seed -> workerPool.submit(() -> connect(seed.getHostString(), seed.getPort(), null)));
    }

    /**
     * Port actually bound, useful when the configuration asked for an ephemeral port.
     */
    public int boundPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? config.local().port() : socket.getLocalPort();
    }

    @Override
    public NodeInfo local() {
        return config.local();
    }

    @Override
    public Collection<NodeInfo> peers() {
        return Collections.unmodifiableCollection(knownPeers.values());
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
        for (NodeId nodeId : knownPeers.keySet()) {
            if (!nodeId.equals(config.local().nodeId())) {
                send(message.redirect(nodeId));
            }
        }
    }

    @Override
    public void send(ClusterMessage message) {
        NodeId destination = message.destination();
        if (destination == null) {
            return;
        }
        Connection connection = ensureConnection(destination);
        if (connection != null) {
            connection.send(message);
        } else {
            LOGGER.debug("No connection available for {}, dropping {}", destination, message);
        }
    }

    @Override
    public CompletableFuture<ClusterMessage> sendAndAwait(ClusterMessage message, Duration timeout) {
        CompletableFuture<ClusterMessage> future = new CompletableFuture<>();
        NodeId destination = message.destination();
        if (destination == null) {
            future.completeExceptionally(new IOException("sendAndAwait requires a destination"));
            return future;
        }
        UUID requestId = message.messageId();
        PendingResponse pending = new PendingResponse(destination, future);
        pendingResponses.put(requestId, pending);

        Connection connection = ensureConnection(destination);
        if (connection == null) {
            pendingResponses.remove(requestId, pending);
            future.completeExceptionally(new IOException("No connection available for " + destination));
            return future;
        }
        connection.send(message);

        ScheduledFuture<?> timeoutTask = scheduler.schedule(() -> {
            if (pendingResponses.remove(requestId, pending)) {
                future.completeExceptionally(new TimeoutException(
                        "Request " + requestId + " to " + destination + " timed out after " + timeout));
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        future.whenComplete((response, error) -> {
            timeoutTask.cancel(false);
            pendingResponses.remove(requestId, pending);
        });
        return future;
    }

    @Override
    public boolean isConnected(NodeId nodeId) {
        Connection connection = connections.get(nodeId);
        return connection != null && connection.isOpen();
    }

    private void acceptLoop() {
        while (running) {
            try {
                Socket socket = serverSocket.accept();
                registerConnection(socket, null);
            } catch (SocketException se) {
                if (running) {
                    LOGGER.warn("Server socket closed unexpectedly", se);
                }
                break;
            } catch (IOException e) {
                if (running) {
                    LOGGER.warn("Error accepting connection", e);
                }
            }
        }
    }

    private void reconnectLoop() {
        if (!running) {
            return;
        }
        try {
            for (InetSocketAddress seed : config.seeds()) {
                if (!isConnectedTo(seed.getHostString(), seed.getPort())) {
                    workerPool.submit(() -> connect(seed.getHostString(), seed.getPort(), null));
                }
            }
            for (NodeInfo peer : knownPeers.values()) {
                if (!peer.nodeId().equals(config.local().nodeId()) && !isConnected(peer.nodeId())) {
                    workerPool.submit(() -> ensureConnection(peer.nodeId()));
                }
            }
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected error in reconnect task", e);
        }
    }

    private boolean isConnectedTo(String host, int port) {
        for (Connection connection : openConnections) {
            NodeInfo remote = connection.remote;
            if (remote != null && connection.isOpen() && remote.host().equals(host) && remote.port() == port) {
                return true;
            }
        }
        return false;
    }

    private Connection ensureConnection(NodeId nodeId) {
        if (nodeId.equals(config.local().nodeId())) {
            return null;
        }
        Connection current = connections.get(nodeId);
        if (current != null && current.isOpen()) {
            return current;
        }
        NodeInfo info = knownPeers.get(nodeId);
        if (info == null || !running) {
            return null;
        }
        return connect(info.host(), info.port(), info);
    }

    private Connection connect(String host, int port, NodeInfo expected) {
        synchronized (connectLocks.computeIfAbsent(host + ':' + port, k -> new Object())) {
            if (expected != null) {
                Connection current = connections.get(expected.nodeId());
                if (current != null && current.isOpen()) {
                    return current;
                }
            } else if (isConnectedTo(host, port)) {
                return null;
            }
            try {
                Socket socket = new Socket();
                socket.connect(new InetSocketAddress(host, port), (int) config.connectTimeout().toMillis());
                Connection connection = registerConnection(socket, expected);
                sendHandshake(connection, false);
                return connection;
            } catch (IOException e) {
                LOGGER.debug("Unable to connect to {}:{}: {}", host, port, e.getMessage());
                return null;
            }
        }
    }

    private Connection registerConnection(Socket socket, NodeInfo preResolved) throws IOException {
        socket.setTcpNoDelay(true);
        Connection connection = new Connection(socket);
        openConnections.add(connection);
        if (preResolved != null) {
            connection.remote = preResolved;
            connections.put(preResolved.nodeId(), connection);
        }
        workerPool.submit(connection::writeLoop);
        workerPool.submit(connection::readLoop);
        return connection;
    }

    private void sendHandshake(Connection connection, boolean reply) {
        NodeInfo local = config.local();
        HandshakePayload payload = new HandshakePayload(local, Set.copyOf(knownPeers.values()), reply);
        NodeId remoteId = connection.remote == null ? null : connection.remote.nodeId();
        connection.send(ClusterMessage.request(MessageType.HANDSHAKE, local.nodeId(), remoteId, payload));
    }

    private void handleHandshake(Connection connection, ClusterMessage message) {
        HandshakePayload payload = message.payload(HandshakePayload.class);
        NodeInfo remote = payload.local();
        connection.remote = remote;
        knownPeers.put(remote.nodeId(), remote);
        connections.put(remote.nodeId(), connection);
        if (!payload.reply()) {
            sendHandshake(connection, true);
        }
        listeners.forEach(listener -> listener.onPeerConnected(remote));
        boolean learned = mergePeers(payload.peers());
        if (learned) {
            broadcast(ClusterMessage.announce(MessageType.PEER_UPDATE, config.local().nodeId(),
                    new PeerUpdatePayload(Set.copyOf(knownPeers.values()))));
        }
    }

    private boolean mergePeers(Collection<NodeInfo> peers) {
        boolean learned = false;
        for (NodeInfo peer : peers) {
            if (peer.nodeId().equals(config.local().nodeId())) {
                continue;
            }
            if (knownPeers.putIfAbsent(peer.nodeId(), peer) == null) {
                learned = true;
                if (!isConnected(peer.nodeId())) {
                    scheduler.schedule(() -> workerPool.submit(() -> ensureConnection(peer.nodeId())),
                            100, TimeUnit.MILLISECONDS);
                }
            }
        }
        return learned;
    }

    private void handleMessage(Connection connection, ClusterMessage message) {
        switch (message.type()) {
            case HANDSHAKE -> handleHandshake(connection, message);
            case PEER_UPDATE -> mergePeers(message.payload(PeerUpdatePayload.class).peers());
            default -> {
                Optional<UUID> correlation = message.correlationId();
                if (correlation.isPresent()) {
                    PendingResponse pending = pendingResponses.remove(correlation.get());
                    if (pending != null) {
                        pending.future.complete(message);
                        return;
                    }
                }
                listeners.forEach(listener -> listener.onMessage(message));
            }
        }
    }

    private void handleDisconnect(Connection connection) {
        openConnections.remove(connection);
        NodeInfo remote = connection.remote;
        if (remote == null) {
            return;
        }
        NodeId nodeId = remote.nodeId();
        if (!connections.remove(nodeId, connection)) {
            return;
        }
        List<Map.Entry<UUID, PendingResponse>> toFail = new ArrayList<>();
        for (Map.Entry<UUID, PendingResponse> entry : pendingResponses.entrySet()) {
            if (nodeId.equals(entry.getValue().destination)) {
                toFail.add(entry);
            }
        }
        for (Map.Entry<UUID, PendingResponse> entry : toFail) {
            if (pendingResponses.remove(entry.getKey(), entry.getValue())) {
                entry.getValue().future.completeExceptionally(new PeerDisconnectedException(nodeId, entry.getKey()));
            }
        }
        if (running) {
            listeners.forEach(listener -> listener.onPeerDisconnected(nodeId));
        }
    }

    @Override
    public void close() throws IOException {
        running = false;
        if (serverSocket != null) {
            serverSocket.close();
        }
        scheduler.shutdownNow();
        for (Connection connection : openConnections) {
            connection.close();
        }
        openConnections.clear();
        connections.clear();
        workerPool.shutdownNow();
        pendingResponses.values().forEach(pending -> pending.future.completeExceptionally(new IOException("Transport closed")));
        pendingResponses.clear();
    }

    private final class Connection implements Closeable {
        private final Socket socket;
        private final ObjectOutputStream outputStream;
        private final ObjectInputStream inputStream;
        private final BlockingQueue<ClusterMessage> outbound = new LinkedBlockingQueue<>();
        private volatile NodeInfo remote;
        private volatile boolean open = true;

        private Connection(Socket socket) throws IOException {
            this.socket = socket;
            this.outputStream = new ObjectOutputStream(socket.getOutputStream());
            this.outputStream.flush();
            this.inputStream = new ObjectInputStream(socket.getInputStream());
        }

        boolean isOpen() {
            return open && !socket.isClosed();
        }

        void send(ClusterMessage message) {
            if (isOpen()) {
                outbound.offer(message);
            }
        }

        void writeLoop() {
            try {
                while (isOpen()) {
                    ClusterMessage message = outbound.poll(200, TimeUnit.MILLISECONDS);
                    if (message == null) {
                        continue;
                    }
                    outputStream.writeObject(message);
                    outputStream.reset();
                    outputStream.flush();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (IOException e) {
                if (open) {
                    LOGGER.debug("Writer terminating for {}: {}", remote, e.getMessage());
                }
            } finally {
                shutdownSocket();
            }
        }

        void readLoop() {
            try {
                while (isOpen()) {
                    ClusterMessage message = (ClusterMessage) inputStream.readObject();
                    handleMessage(this, message);
                }
            } catch (IOException | ClassNotFoundException | ClassCastException e) {
                if (open) {
                    LOGGER.debug("Connection to {} closed: {}", remote, e.getMessage());
                }
            } finally {
                shutdownSocket();
                handleDisconnect(this);
            }
        }

        @Override
        public void close() {
            shutdownSocket();
        }

        private void shutdownSocket() {
            open = false;
            try {
                socket.close();
            } catch (IOException e) {
                LOGGER.trace("Error closing socket to {}", remote, e);
            }
        }
    }

    private static final class PendingResponse {
        private final NodeId destination;
        private final CompletableFuture<ClusterMessage> future;

        private PendingResponse(NodeId destination, CompletableFuture<ClusterMessage> future) {
            this.destination = destination;
            this.future = future;
        }
    }
}
