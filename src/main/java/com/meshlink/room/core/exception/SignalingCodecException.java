package com.meshlink.room.core.exception;

public class SignalingCodecException extends RuntimeException {
    public SignalingCodecException(String message) {
        super(message);
    }

    public SignalingCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
