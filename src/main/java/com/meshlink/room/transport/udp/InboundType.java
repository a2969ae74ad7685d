package com.meshlink.room.transport.udp;

import java.util.Optional;

/** Relay'den gelen mesaj türleri. */
enum InboundType {
    ROOM_USER_JOIN,
    ROOM_USER_LEAVE,
    ROOM_USERS,
    OFFER,
    ANSWER,
    CANDIDATE,
    ROOM_DATA,
    ROOM_LOGS,
    PONG;

    static Optional<InboundType> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
