package com.consulthub.core.msg;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed catalog of envelope types the hub consumes or produces.
 * <p>
 * Any other tag is accepted on the wire but never produced and never acted upon.
 * </p>
 */
@Getter
@RequiredArgsConstructor
public enum MessageType {
    /** Server to client, right after registration. */
    CONNECTION_CONFIRMED("connection_confirmed"),
    JOIN_CONSULTATION("join_consultation"),
    LEAVE_CONSULTATION("leave_consultation"),
    CHAT_MESSAGE("chat_message"),
    TYPING_START("typing_start"),
    TYPING_STOP("typing_stop"),
    PING("ping"),
    PONG("pong");

    private static final Map<String, MessageType> BY_WIRE_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(MessageType::getWireName, Function.identity()));

    private final String wireName;

    /**
     * Resolves a wire tag.
     *
     * @param wireName tag as sent on the wire, may be null
     * @return matching type, or empty for unknown tags
     */
    public static Optional<MessageType> fromWire(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }
}
