package com.projectgroup5.pongarena.service;

/**
 * 对局相关的状态冲突，message 原样回给客户端（game:error）
 */
public enum GameErrorCode {
    ALREADY_QUEUED("Already in matchmaking queue"),
    ALREADY_IN_SESSION("Already in a game"),
    GAME_NOT_FOUND("Game not found"),
    GAME_FULL("Game is full"),
    CANNOT_JOIN_OWN_GAME("Cannot join your own game"),
    NOT_A_PLAYER("You are not a player in this game"),
    GAME_NOT_ACTIVE("Game is not active"),
    NOT_IN_GAME("Not in a game"),
    CANNOT_INVITE_SELF("Cannot invite yourself"),
    TARGET_OFFLINE("Invited user is not online");

    private final String message;

    GameErrorCode(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
