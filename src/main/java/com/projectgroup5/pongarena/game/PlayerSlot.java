package com.projectgroup5.pongarena.game;

import java.util.Objects;

/**
 * 对局中的一个席位：真人玩家或 AI
 */
public final class PlayerSlot {
    /** AI 席位对外使用的保留用户 id */
    public static final long AI_PLAYER_ID = 0L;

    private final long userId;
    private final AiDifficulty difficulty;

    private PlayerSlot(long userId, AiDifficulty difficulty) {
        this.userId = userId;
        this.difficulty = difficulty;
    }

    public static PlayerSlot human(long userId) {
        return new PlayerSlot(userId, null);
    }

    public static PlayerSlot ai(AiDifficulty difficulty) {
        return new PlayerSlot(AI_PLAYER_ID, Objects.requireNonNull(difficulty));
    }

    public boolean isAi() {
        return difficulty != null;
    }

    public boolean isHuman(long candidate) {
        return !isAi() && userId == candidate;
    }

    public long getUserId() {
        return userId;
    }

    public AiDifficulty getDifficulty() {
        return difficulty;
    }

    @Override
    public String toString() {
        return isAi() ? "AI(" + difficulty.getValue() + ")" : "user " + userId;
    }
}
