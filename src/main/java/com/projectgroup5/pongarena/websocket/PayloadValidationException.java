package com.projectgroup5.pongarena.websocket;

public class PayloadValidationException extends RuntimeException {
    public PayloadValidationException(String message) {
        super(message);
    }
}
