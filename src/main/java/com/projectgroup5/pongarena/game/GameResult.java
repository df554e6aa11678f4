package com.projectgroup5.pongarena.game;

import java.time.Instant;

/**
 * 对局结束时的结果；winnerId 为 null 表示无胜者
 */
public record GameResult(
        long gameId,
        GameOrigin origin,
        long player1Id,
        long player2Id,
        Long winnerId,
        int player1Score,
        int player2Score,
        GamePhase phase,
        String endReason,
        Instant startedAt,
        Instant endedAt) {

    public boolean hasWinner() {
        return winnerId != null;
    }
}
