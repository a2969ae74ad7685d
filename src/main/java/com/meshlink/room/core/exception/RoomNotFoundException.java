package com.meshlink.room.core.exception;

public class RoomNotFoundException extends RuntimeException {
    public RoomNotFoundException(String roomName) {
        super("Room not found: " + roomName);
    }
}
