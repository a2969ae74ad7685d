package com.meshlink.room.core.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Taşıma katmanıyla değiş tokuş edilen zarf.
 * connectionType ham string olarak tutulur; bilinmeyen türler de temsil edilebilsin diye.
 * join/leave mesajlarında yalnızca src doludur.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SignalingMessage {

    private String roomName;
    private String connectionId;
    private String connectionType;
    private String src;
    private String dst;
    private JsonNode payload;   // offer / answer / candidate gövdesi
    private JsonNode metadata;

    public SignalingMessage() { }

    public SignalingMessage(String connectionId, String connectionType, String src, JsonNode payload) {
        this.connectionId = connectionId;
        this.connectionType = connectionType;
        this.src = src;
        this.payload = payload;
    }

    /** Yalnızca kaynak eşi taşıyan join/leave zarfı. */
    public static SignalingMessage fromPeer(String src) {
        SignalingMessage m = new SignalingMessage();
        m.setSrc(src);
        return m;
    }

    /** Oda adını damgalanmış sığ kopya; orijinal zarf değişmez. */
    public SignalingMessage withRoomName(String roomName) {
        SignalingMessage m = new SignalingMessage(connectionId, connectionType, src, payload);
        m.setDst(dst);
        m.setMetadata(metadata);
        m.setRoomName(roomName);
        return m;
    }

    // --- getters & setters ---
    public String getRoomName() { return roomName; }
    public void setRoomName(String roomName) { this.roomName = roomName; }

    public String getConnectionId() { return connectionId; }
    public void setConnectionId(String connectionId) { this.connectionId = connectionId; }

    public String getConnectionType() { return connectionType; }
    public void setConnectionType(String connectionType) { this.connectionType = connectionType; }

    public String getSrc() { return src; }
    public void setSrc(String src) { this.src = src; }

    public String getDst() { return dst; }
    public void setDst(String dst) { this.dst = dst; }

    public JsonNode getPayload() { return payload; }
    public void setPayload(JsonNode payload) { this.payload = payload; }

    public JsonNode getMetadata() { return metadata; }
    public void setMetadata(JsonNode metadata) { this.metadata = metadata; }

    @Override
    public String toString() {
        return "SignalingMessage{room=" + roomName + ", connectionId=" + connectionId
                + ", type=" + connectionType + ", src=" + src + ", dst=" + dst + "}";
    }
}
