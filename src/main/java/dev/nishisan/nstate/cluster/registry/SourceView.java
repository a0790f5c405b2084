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

import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;

import java.util.List;
import java.util.Optional;

/**
 * Immutable copy of the reachable sources taken at the start of a query. Membership changes
 * after the copy is taken do not affect the query.
 *
 * @param head     the central coordinator source, when one is reachable
 * @param machines every reachable machine source (the head included), ordered by node id
 */
public record SourceView(Optional<NodeInfo> head, List<NodeInfo> machines) {

    public SourceView {
        machines = List.copyOf(machines);
    }

    public Optional<NodeInfo> find(NodeId nodeId) {
        return machines.stream().filter(n -> n.nodeId().equals(nodeId)).findFirst();
    }

    public List<NodeInfo> findByHost(String host) {
        return machines.stream().filter(n -> n.host().equals(host)).toList();
    }
}
