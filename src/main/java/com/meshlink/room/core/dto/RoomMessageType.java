package com.meshlink.room.core.dto;

/** Odanın taşıma katmanına gönderdiği mesaj türleri. */
public enum RoomMessageType {
    JOIN,
    LEAVE,
    GET_PEERS,
    OFFER,
    ANSWER,
    CANDIDATE,
    BROADCAST_BY_WS,
    BROADCAST_BY_DC,
    GET_LOG,
    PING
}
