package com.meshlink.room.core.dto;

import com.meshlink.room.core.model.ConnectionType;

/**
 * Taşıma katmanına giden mesaj. Her zaman oda adını taşır; diğer alanlar türe göre dolar:
 * - GET_PEERS: kind
 * - OFFER/ANSWER/CANDIDATE: signal
 * - BROADCAST_BY_WS/BROADCAST_BY_DC: data
 */
public class RoomMessage {
    private final RoomMessageType type;
    private final String roomName;
    private final ConnectionType kind;
    private final SignalingMessage signal;
    private final Object data;

    private RoomMessage(RoomMessageType type, String roomName, ConnectionType kind,
                        SignalingMessage signal, Object data) {
        this.type = type;
        this.roomName = roomName;
        this.kind = kind;
        this.signal = signal;
        this.data = data;
    }

    public static RoomMessage of(RoomMessageType type, String roomName) {
        return new RoomMessage(type, roomName, null, null, null);
    }

    public static RoomMessage getPeers(String roomName, ConnectionType kind) {
        return new RoomMessage(RoomMessageType.GET_PEERS, roomName, kind, null, null);
    }

    public static RoomMessage signal(RoomMessageType type, String roomName, SignalingMessage signal) {
        return new RoomMessage(type, roomName, null, signal.withRoomName(roomName), null);
    }

    public static RoomMessage broadcast(RoomMessageType type, String roomName, Object data) {
        return new RoomMessage(type, roomName, null, null, data);
    }

    public RoomMessageType getType() { return type; }
    public String getRoomName() { return roomName; }
    public ConnectionType getKind() { return kind; }
    public SignalingMessage getSignal() { return signal; }
    public Object getData() { return data; }

    @Override
    public String toString() {
        return type + "|" + roomName + (kind != null ? "|kind=" + kind : "")
                + (signal != null ? "|" + signal : "");
    }
}
