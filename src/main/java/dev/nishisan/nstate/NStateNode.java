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

package dev.nishisan.nstate;

import dev.nishisan.nstate.cluster.registry.SourceRegistry;
import dev.nishisan.nstate.cluster.registry.SourceRegistryConfig;
import dev.nishisan.nstate.cluster.transport.TcpTransport;
import dev.nishisan.nstate.cluster.transport.TcpTransportConfig;
import dev.nishisan.nstate.cluster.transport.Transport;
import dev.nishisan.nstate.logs.LogLocator;
import dev.nishisan.nstate.logs.LogOutput;
import dev.nishisan.nstate.logs.LogSelector;
import dev.nishisan.nstate.logs.LogStream;
import dev.nishisan.nstate.logs.LogStreamer;
import dev.nishisan.nstate.logs.LogTarget;
import dev.nishisan.nstate.query.ClusterStateService;
import dev.nishisan.nstate.query.FanOutQueryCoordinator;
import dev.nishisan.nstate.source.InMemoryStateSource;
import dev.nishisan.nstate.source.LocalLogDirectory;
import dev.nishisan.nstate.source.StateSourceAgent;
import dev.nishisan.nstate.source.TransportSourceConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One process taking part in the cluster: a source agent when its roles include
 * {@code head} or {@code node}, and always a query client able to summarize, list and get
 * records and to read logs from every reachable machine.
 */
public final class NStateNode implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(NStateNode.class);

    private final NStateConfig config;
    private final AtomicBoolean started = new AtomicBoolean();

    private TcpTransport transport;
    private ScheduledExecutorService registryScheduler;
    private SourceRegistry registry;
    private InMemoryStateSource localState;
    private LocalLogDirectory localLogs;
    private StateSourceAgent agent;
    private FanOutQueryCoordinator coordinator;
    private ClusterStateService stateService;
    private LogLocator logLocator;
    private LogStreamer logStreamer;

    public NStateNode(NStateConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        TcpTransportConfig.Builder transportBuilder = TcpTransportConfig.builder(config.local())
                .connectTimeout(config.connectTimeout())
                .reconnectInterval(Duration.ofSeconds(2));
        config.seeds().forEach(transportBuilder::addSeed);
        transport = new TcpTransport(transportBuilder.build());

        registryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "nstate-registry");
            t.setDaemon(true);
            return t;
        });
        registry = new SourceRegistry(transport,
                SourceRegistryConfig.of(config.heartbeatTimeout(), config.heartbeatInterval()), registryScheduler);

        if (config.local().isSource()) {
            localState = new InMemoryStateSource(config.local().nodeId(), config.recordCallsite(),
                    InMemoryStateSource.DEFAULT_MAX_TOMBSTONES);
            Path logDir = config.logDirectory().orElseGet(() -> Path.of(System.getProperty("java.io.tmpdir"),
                    "nstate", config.local().nodeId().value(), "logs"));
            localLogs = new LocalLogDirectory(logDir);
            agent = new StateSourceAgent(transport, localState, localLogs, config.heartbeatInterval());
        }

        // the query timeout bounds remote calls; the coordinator cancels them earlier when needed
        TransportSourceConnector connector = new TransportSourceConnector(transport,
                config.queryTimeout().plus(config.connectTimeout()), localState, localLogs);
        coordinator = new FanOutQueryCoordinator(registry, connector, config.queryWorkers());
        stateService = new ClusterStateService(coordinator, config.maxRecords(), config.queryTimeout());
        logLocator = new LogLocator(registry, connector, stateService);
        logStreamer = new LogStreamer(logLocator, connector, config.logOptions());

        transport.start();
        registry.start();
        if (agent != null) {
            registry.register(config.local());
            agent.start();
        }
        LOGGER.info("NState node {} started with roles {}", config.local(), config.local().roles());
    }

    public NStateConfig config() {
        return config;
    }

    public Transport transport() {
        return transport;
    }

    public SourceRegistry registry() {
        return registry;
    }

    public ClusterStateService stateService() {
        return stateService;
    }

    public LogStreamer logStreamer() {
        return logStreamer;
    }

    /**
     * State held by this node when it acts as a source; the orchestration layer feeds it.
     */
    public Optional<InMemoryStateSource> localState() {
        return Optional.ofNullable(localState);
    }

    public Optional<LocalLogDirectory> localLogs() {
        return Optional.ofNullable(localLogs);
    }

    /**
     * Files matching a glob on one node.
     *
     * @param node node id or IP; null lists the head node
     */
    public List<LogTarget> listLogs(String node, String glob) throws IOException {
        return logStreamer.list(LogSelector.nodeGlob(node, glob));
    }

    public LogStream actorLogs(String actorId, boolean follow) throws IOException {
        return logStreamer.open(LogSelector.actor(actorId), follow);
    }

    /**
     * @param nodeIp may be null when only one machine is registered
     */
    public LogStream workerLogs(int pid, String nodeIp, LogOutput output, boolean follow) throws IOException {
        return logStreamer.open(LogSelector.worker(pid, nodeIp, output), follow);
    }

    @Override
    public void close() throws IOException {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        if (agent != null) {
            agent.close();
        }
        coordinator.close();
        registry.close();
        registryScheduler.shutdownNow();
        transport.close();
    }
}
