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

import dev.nishisan.nstate.common.NodeId;

import java.io.IOException;
import java.io.Serial;
import java.util.Objects;
import java.util.UUID;

/**
 * Completes a pending request whose destination disconnected before answering. Remote
 * sources report it as an unavailable source.
 */
public final class PeerDisconnectedException extends IOException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final NodeId peerId;
    private final UUID requestId;

    public PeerDisconnectedException(NodeId peerId, UUID requestId) {
        super("Peer " + peerId + " disconnected before answering request " + requestId);
        this.peerId = Objects.requireNonNull(peerId, "peerId");
        this.requestId = Objects.requireNonNull(requestId, "requestId");
    }

    public NodeId peerId() {
        return peerId;
    }

    public UUID requestId() {
        return requestId;
    }
}
