package com.projectgroup5.pongarena.service;

public class GameConflictException extends RuntimeException {
    private final GameErrorCode code;

    public GameConflictException(GameErrorCode code) {
        super(code.getMessage());
        this.code = code;
    }

    public GameErrorCode getCode() {
        return code;
    }
}
