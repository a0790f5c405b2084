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

/**
 * Callbacks for message delivery and peer connectivity. Invoked on transport threads.
 */
public interface TransportListener {
    default void onPeerConnected(NodeInfo peer) {
    }

    default void onPeerDisconnected(NodeId peerId) {
    }

    void onMessage(ClusterMessage message);
}
