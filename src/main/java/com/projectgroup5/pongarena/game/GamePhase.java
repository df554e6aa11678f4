package com.projectgroup5.pongarena.game;

/**
 * 对局生命周期
 */
public enum GamePhase {
    WAITING,      // 私人房间等待第二名玩家
    COUNTDOWN,    // 倒计时
    PLAYING,      // 游戏中
    PAUSED,       // 有玩家掉线，等待重连
    FINISHED,     // 有人达到胜利分数
    CANCELLED;    // 离开 / 掉线超时 / 内部错误

    public boolean isTerminal() {
        return this == FINISHED || this == CANCELLED;
    }

    /** 接受移动指令的阶段 */
    public boolean acceptsInput() {
        return this == COUNTDOWN || this == PLAYING;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
