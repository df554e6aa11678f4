package com.projectgroup5.pongarena.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 对局引擎参数（application.yml 中的 pong.*）
 * 未配置或非正数时使用默认值
 */
@ConfigurationProperties(prefix = "pong")
public record GameProperties(
        int tickRate,
        int winScore,
        int countdownSeconds,
        int reconnectGraceSeconds,
        int cleanupDelaySeconds,
        int tickThreads,
        int tournamentRetentionSeconds) {

    public GameProperties {
        tickRate = tickRate > 0 ? tickRate : 60;
        winScore = winScore > 0 ? winScore : 11;
        countdownSeconds = countdownSeconds > 0 ? countdownSeconds : 3;
        reconnectGraceSeconds = reconnectGraceSeconds > 0 ? reconnectGraceSeconds : 30;
        cleanupDelaySeconds = cleanupDelaySeconds >= 0 ? cleanupDelaySeconds : 5;
        tickThreads = tickThreads > 0 ? tickThreads : 4;
        tournamentRetentionSeconds = tournamentRetentionSeconds > 0 ? tournamentRetentionSeconds : 300;
    }

    public static GameProperties defaults() {
        return new GameProperties(0, 0, 0, 0, 0, 0, 0);
    }

    /** 固定时间步长（秒） */
    public double deltaSeconds() {
        return 1.0 / tickRate;
    }

    public long tickPeriodMicros() {
        return 1_000_000L / tickRate;
    }

    public int countdownTicks() {
        return countdownSeconds * tickRate;
    }

    public int reconnectGraceTicks() {
        return reconnectGraceSeconds * tickRate;
    }
}
