package com.projectgroup5.pongarena.game;

/**
 * AI 难度参数
 * - reactionDelayTicks：重新计算目标位置的间隔
 * - predictionHorizonTicks：预测落点的最大步数，0 表示只跟随当前球的 y
 * - positioningError：目标位置的随机误差（±）
 * - deadZone：目标与挡板中心的距离小于该值时不移动
 */
public enum AiDifficulty {
    EASY("easy", 12, 0, 10.0, 4.0),
    MEDIUM("medium", 6, 60, 5.0, 2.0),
    HARD("hard", 2, 240, 2.0, 1.0);

    private final String value;
    private final int reactionDelayTicks;
    private final int predictionHorizonTicks;
    private final double positioningError;
    private final double deadZone;

    AiDifficulty(String value, int reactionDelayTicks, int predictionHorizonTicks,
                 double positioningError, double deadZone) {
        this.value = value;
        this.reactionDelayTicks = reactionDelayTicks;
        this.predictionHorizonTicks = predictionHorizonTicks;
        this.positioningError = positioningError;
        this.deadZone = deadZone;
    }

    /** 未知或缺省时使用 MEDIUM */
    public static AiDifficulty fromValue(String value) {
        if (value == null) {
            return MEDIUM;
        }
        for (AiDifficulty difficulty : values()) {
            if (difficulty.value.equalsIgnoreCase(value.trim())) {
                return difficulty;
            }
        }
        return MEDIUM;
    }

    public String getValue() {
        return value;
    }

    public int getReactionDelayTicks() {
        return reactionDelayTicks;
    }

    public int getPredictionHorizonTicks() {
        return predictionHorizonTicks;
    }

    public double getPositioningError() {
        return positioningError;
    }

    public double getDeadZone() {
        return deadZone;
    }
}
