package com.meshlink.room.core.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/** Odaya yayınlanan uygulama verisi: kim gönderdi, ne gönderdi. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataMessage {
    private String roomName;
    private String src;
    private JsonNode data;

    public DataMessage() { }

    public DataMessage(String roomName, String src, JsonNode data) {
        this.roomName = roomName;
        this.src = src;
        this.data = data;
    }

    public String getRoomName() { return roomName; }
    public void setRoomName(String roomName) { this.roomName = roomName; }

    public String getSrc() { return src; }
    public void setSrc(String src) { this.src = src; }

    public JsonNode getData() { return data; }
    public void setData(JsonNode data) { this.data = data; }

    @Override public String toString() { return "DataMessage{room=" + roomName + ", src=" + src + "}"; }
}
