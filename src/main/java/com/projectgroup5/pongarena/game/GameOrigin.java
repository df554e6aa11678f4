package com.projectgroup5.pongarena.game;

/** 对局来源 */
public enum GameOrigin {
    MATCHMAKING,
    PRIVATE,
    AI,
    TOURNAMENT
}
