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

package dev.nishisan.nstate.logs;

import dev.nishisan.nstate.cluster.registry.SourceRegistry;
import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;
import dev.nishisan.nstate.model.ActorRecord;
import dev.nishisan.nstate.model.ResourceKind;
import dev.nishisan.nstate.query.ClusterStateService;
import dev.nishisan.nstate.query.ResourceNotFoundException;
import dev.nishisan.nstate.source.SourceConnector;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Resolves {@link LogSelector}s into files on the machines currently in the registry.
 */
public final class LogLocator {
    private final SourceRegistry registry;
    private final SourceConnector connector;
    private final ClusterStateService stateService;

    public LogLocator(SourceRegistry registry, SourceConnector connector, ClusterStateService stateService) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.stateService = Objects.requireNonNull(stateService, "stateService");
    }

    /**
     * Every file the selector matches, possibly none.
     */
    public List<LogTarget> locate(LogSelector selector) throws IOException {
        return switch (selector.mode()) {
            case NODE_GLOB -> list(resolveNode(selector), selector.pattern().orElseThrow());
            case FILE -> list(resolveNode(selector), escapeGlob(selector.pattern().orElseThrow()));
            case ACTOR -> locateActor(selector);
            case WORKER -> locateWorker(selector);
        };
    }

    /**
     * The single file the selector designates.
     *
     * @throws ResourceNotFoundException    when nothing matches
     * @throws AmbiguousLogTargetException when several files match
     */
    public LogTarget locateOne(LogSelector selector) throws IOException {
        List<LogTarget> targets = locate(selector);
        if (targets.isEmpty()) {
            throw ResourceNotFoundException.logTarget(selector.describe());
        }
        if (targets.size() > 1) {
            List<String> names = new ArrayList<>(targets.size());
            targets.forEach(target -> names.add(target.toString()));
            throw new AmbiguousLogTargetException(selector.describe(), names);
        }
        return targets.get(0);
    }

    private List<LogTarget> locateActor(LogSelector selector) throws IOException {
        String actorId = selector.actorId().orElseThrow();
        ActorRecord actor = stateService.get(ResourceKind.ACTOR, actorId, ActorRecord.class);
        String nodeId = actor.nodeId().orElseThrow(() ->
                ResourceNotFoundException.absent(ResourceKind.ACTOR, actorId, "the actor is not placed on any node"));
        OptionalLong pid = actor.pid();
        if (pid.isEmpty()) {
            throw ResourceNotFoundException.absent(ResourceKind.ACTOR, actorId, "the actor has no worker process");
        }
        NodeInfo node = registry.find(NodeId.of(nodeId)).orElseThrow(() ->
                ResourceNotFoundException.logTarget(selector.describe() + ": hosting node " + nodeId + " is not reachable"));
        return list(node, LogSelector.processGlob(pid.getAsLong(), selector.output()));
    }

    private List<LogTarget> locateWorker(LogSelector selector) throws IOException {
        String glob = LogSelector.processGlob(selector.pid().orElseThrow(), selector.output());
        Optional<String> nodeIp = selector.node();
        List<NodeInfo> machines = nodeIp.isPresent()
                ? registry.findByHost(nodeIp.get())
                : registry.snapshot().machines();
        if (machines.isEmpty()) {
            throw ResourceNotFoundException.logTarget(selector.describe() + ": no reachable machine");
        }
        if (machines.size() > 1) {
            List<String> names = new ArrayList<>(machines.size());
            machines.forEach(machine -> names.add(machine.toString()));
            throw new AmbiguousLogTargetException(selector.describe() + " without a node IP", names);
        }
        return list(machines.get(0), glob);
    }

    private NodeInfo resolveNode(LogSelector selector) {
        Optional<String> requested = selector.node();
        if (requested.isEmpty()) {
            return registry.snapshot().head().orElseThrow(() ->
                    ResourceNotFoundException.logTarget(selector.describe() + ": no head node is reachable"));
        }
        String node = requested.get();
        Optional<NodeInfo> byId = registry.find(NodeId.of(node));
        if (byId.isPresent()) {
            return byId.get();
        }
        List<NodeInfo> byHost = registry.findByHost(node);
        if (byHost.isEmpty()) {
            throw ResourceNotFoundException.logTarget(selector.describe() + ": node " + node + " is not reachable");
        }
        if (byHost.size() > 1) {
            List<String> names = new ArrayList<>(byHost.size());
            byHost.forEach(machine -> names.add(machine.toString()));
            throw new AmbiguousLogTargetException("node " + node, names);
        }
        return byHost.get(0);
    }

    private List<LogTarget> list(NodeInfo node, String glob) throws IOException {
        List<LogTarget> targets = new ArrayList<>();
        for (String filename : connector.logSource(node).listLogs(glob)) {
            targets.add(new LogTarget(node, filename));
        }
        return targets;
    }

    static String escapeGlob(String filename) {
        StringBuilder sb = new StringBuilder(filename.length() + 8);
        for (char c : filename.toCharArray()) {
            if ("*?[]{}\\".indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
