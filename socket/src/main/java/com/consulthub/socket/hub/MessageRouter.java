package com.consulthub.socket.hub;

import com.consulthub.core.msg.Envelope;
import com.consulthub.core.msg.MessageType;
import com.consulthub.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Routes inbound envelopes to their handler by type.
 * <p>
 * Handlers run synchronously inside the hub's serialized processing and keep no state
 * beyond room membership.
 * </p>
 * <ul>
 *   <li>join_consultation: add sender to room, no broadcast</li>
 *   <li>leave_consultation: remove sender from room</li>
 *   <li>chat_message: broadcast to all members, sender included</li>
 *   <li>typing_start / typing_stop: broadcast to all members except the sender</li>
 *   <li>ping: reply pong to the sender only</li>
 * </ul>
 */
class MessageRouter {
    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final HubOperations ops;

    MessageRouter(HubOperations ops) {
        this.ops = ops;
    }

    /**
     * Routes one envelope. Envelopes failing a handler precondition are dropped.
     *
     * @param envelope inbound envelope with {@code user_id} already set by the connection
     * @return true if a handler accepted the envelope
     */
    boolean route(Envelope envelope) {
        Optional<MessageType> type = envelope.messageType();
        if (type.isEmpty()) {
            log.warn("Unknown message type '{}' from {}", envelope.getType(), envelope.getUserId());
            return false;
        }

        return switch (type.get()) {
            case JOIN_CONSULTATION -> handleJoin(envelope);
            case LEAVE_CONSULTATION -> handleLeave(envelope);
            case CHAT_MESSAGE -> handleChat(envelope);
            case TYPING_START, TYPING_STOP -> handleTyping(envelope, type.get());
            case PING -> handlePing(envelope);
            default -> {
                // Server-produced types are never acted upon when received
                log.warn("Ignoring server-side message type '{}' from {}", envelope.getType(), envelope.getUserId());
                yield false;
            }
        };
    }

    private boolean handleJoin(Envelope envelope) {
        Optional<String> sessionId = requireSessionId(envelope);
        return sessionId.isPresent() && ops.join(envelope.getUserId(), sessionId.get());
    }

    private boolean handleLeave(Envelope envelope) {
        Optional<String> sessionId = requireMembership(envelope);
        return sessionId.isPresent() && ops.leave(envelope.getUserId(), sessionId.get());
    }

    private boolean handleChat(Envelope envelope) {
        Optional<String> sessionId = requireMembership(envelope);
        if (sessionId.isEmpty()) {
            return false;
        }

        Envelope chat = Envelope.builder()
            .type(MessageType.CHAT_MESSAGE.getWireName())
            .data(envelope.getData())
            .id(envelope.getId())
            .userId(envelope.getUserId())
            .build();

        int delivered = ops.deliverToRoom(sessionId.get(), chat, null);
        log.debug("Chat message from {} delivered to {} members of {}",
            envelope.getUserId(), delivered, sessionId.get());
        return true;
    }

    private boolean handleTyping(Envelope envelope, MessageType type) {
        Optional<String> sessionId = requireMembership(envelope);
        if (sessionId.isEmpty()) {
            return false;
        }

        Envelope typing = Envelope.builder()
            .type(type.getWireName())
            .data(JsonUtils.objectNode().put("userId", envelope.getUserId()))
            .userId(envelope.getUserId())
            .build();

        ops.deliverToRoom(sessionId.get(), typing, envelope.getUserId());
        return true;
    }

    private boolean handlePing(Envelope envelope) {
        Envelope pong = Envelope.builder()
            .type(MessageType.PONG.getWireName())
            .build();
        return ops.reply(envelope.getUserId(), pong);
    }

    private Optional<String> requireSessionId(Envelope envelope) {
        Optional<String> sessionId = envelope.requestedSessionId();
        if (sessionId.isEmpty()) {
            log.debug("Dropping {} from {}: payload has no session id", envelope.getType(), envelope.getUserId());
        }
        return sessionId;
    }

    private Optional<String> requireMembership(Envelope envelope) {
        return requireSessionId(envelope).filter(sessionId -> {
            boolean member = ops.isMember(envelope.getUserId(), sessionId);
            if (!member) {
                log.debug("Dropping {} from {}: not a member of {}", envelope.getType(), envelope.getUserId(), sessionId);
            }
            return member;
        });
    }
}
