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
import java.util.Optional;
import java.util.UUID;

/**
 * Envelope exchanged between nodes.
 * <p>
 * A message without destination is an announcement (heartbeat, peer update) meant for every
 * peer that receives it. A response names the request it answers in {@code inReplyTo}; the
 * transport uses it to complete the pending request future.
 *
 * @param messageId   unique id of this message
 * @param inReplyTo   id of the answered request, {@code null} unless this is a response
 * @param type        message type
 * @param source      sending node
 * @param destination addressed node, {@code null} for announcements and for handshakes sent
 *                    before the remote node is known
 * @param payload     type-specific body
 */
public record ClusterMessage(UUID messageId,
                             UUID inReplyTo,
                             MessageType type,
                             NodeId source,
                             NodeId destination,
                             Serializable payload) implements Serializable {
    @Serial
    private static final long serialVersionUID = 2L;

    public ClusterMessage {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(source, "source");
    }

    public static ClusterMessage request(MessageType type, NodeId source, NodeId destination, Serializable payload) {
        return new ClusterMessage(UUID.randomUUID(), null, type, source, destination, payload);
    }

    /**
     * Message for every peer, such as a heartbeat or a peer list update.
     */
    public static ClusterMessage announce(MessageType type, NodeId source, Serializable payload) {
        return new ClusterMessage(UUID.randomUUID(), null, type, source, null, payload);
    }

    /**
     * Answer to {@code request}, sent back from its destination to its source.
     *
     * @throws IllegalArgumentException when the request was an announcement
     */
    public static ClusterMessage response(ClusterMessage request, Serializable payload) {
        if (request.isAnnouncement()) {
            throw new IllegalArgumentException("Cannot answer an announcement: " + request);
        }
        return new ClusterMessage(UUID.randomUUID(), request.messageId, MessageType.SOURCE_RESPONSE,
                request.destination, request.source, payload);
    }

    /**
     * Copy of this message addressed to another node, with a fresh message id.
     */
    public ClusterMessage redirect(NodeId newDestination) {
        return new ClusterMessage(UUID.randomUUID(), inReplyTo, type, source,
                Objects.requireNonNull(newDestination, "newDestination"), payload);
    }

    public Optional<UUID> correlationId() {
        return Optional.ofNullable(inReplyTo);
    }

    public boolean isAnnouncement() {
        return destination == null;
    }

    public boolean isAddressedTo(NodeId node) {
        return destination != null && destination.equals(node);
    }

    public <T extends Serializable> T payload(Class<T> expected) {
        if (!expected.isInstance(payload)) {
            throw new ClassCastException(type + " from " + source + " carries "
                    + (payload == null ? "no payload" : payload.getClass().getSimpleName())
                    + ", expected " + expected.getSimpleName());
        }
        return expected.cast(payload);
    }

    @Override
    public String toString() {
        return type + "[" + messageId + "] " + source + " -> " + (destination == null ? "*" : destination);
    }
}
