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

package dev.nishisan.nstate.common;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;
import java.util.Set;

/**
 * Address and roles of a machine taking part in the cluster. The {@code host} doubles as the
 * machine IP used by log selectors.
 *
 * <p>Roles understood by the library:
 * <ul>
 *     <li>{@link #ROLE_HEAD}: hosts the central coordinator source (cluster-wide records) and
 *     also acts as a machine source;</li>
 *     <li>{@link #ROLE_NODE}: a regular machine source (per-machine records and logs);</li>
 *     <li>{@link #ROLE_OBSERVER}: a query client, never targeted by queries.</li>
 * </ul>
 */
public record NodeInfo(NodeId nodeId, String host, int port, Set<String> roles) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public static final String ROLE_HEAD = "head";
    public static final String ROLE_NODE = "node";
    public static final String ROLE_OBSERVER = "observer";

    public NodeInfo {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(host, "host");
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public NodeInfo(NodeId nodeId, String host, int port) {
        this(nodeId, host, port, Set.of(ROLE_NODE));
    }

    public boolean isHead() {
        return roles.contains(ROLE_HEAD);
    }

    /**
     * @return true when the machine serves state and logs (head or regular node)
     */
    public boolean isSource() {
        return roles.contains(ROLE_HEAD) || roles.contains(ROLE_NODE);
    }

    public String address() {
        return host + ':' + port;
    }

    @Override
    public String toString() {
        return nodeId + "@" + host + ':' + port;
    }
}
