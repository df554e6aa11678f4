package com.projectgroup5.pongarena.service;

/**
 * 锦标赛相关的状态冲突（tournament:error）
 */
public enum TournamentErrorCode {
    NOT_FOUND("Tournament not found"),
    INVALID_NAME("Tournament name is required"),
    INVALID_SIZE("Tournament size must be 4, 8 or 16"),
    UNSUPPORTED_BRACKET("Only single_elimination brackets are supported"),
    NOT_REGISTERING("Tournament is not open for registration"),
    FULL("Tournament is full"),
    ALREADY_REGISTERED("Already registered in this tournament"),
    NOT_REGISTERED("Not registered in this tournament"),
    NOT_CREATOR("Only the creator can start the tournament"),
    CANCEL_NOT_CREATOR("Only the creator can cancel the tournament"),
    ALREADY_FINISHED("Tournament has already finished"),
    NOT_ENOUGH_PLAYERS("At least 2 players are required to start");

    private final String message;

    TournamentErrorCode(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
