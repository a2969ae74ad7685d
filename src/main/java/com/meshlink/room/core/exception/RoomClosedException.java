package com.meshlink.room.core.exception;

public class RoomClosedException extends RuntimeException {
    public RoomClosedException(String roomName) {
        super("Room is closed: " + roomName);
    }
}
