package com.projectgroup5.pongarena.tournament;

/**
 * 对阵表中的一场；player2Id 为 null 表示轮空
 */
public class TournamentMatch {
    private final int round;
    private final int index;
    private final long player1Id;
    private final Long player2Id;
    private Long gameId;
    private Long winnerId;

    public TournamentMatch(int round, int index, long player1Id, Long player2Id) {
        this.round = round;
        this.index = index;
        this.player1Id = player1Id;
        this.player2Id = player2Id;
        if (player2Id == null) {
            // 轮空直接晋级
            this.winnerId = player1Id;
        }
    }

    public static TournamentMatch bye(int round, int index, long playerId) {
        return new TournamentMatch(round, index, playerId, null);
    }

    public boolean isBye() {
        return player2Id == null;
    }

    public boolean involves(long userId) {
        return player1Id == userId || (player2Id != null && player2Id == userId);
    }

    public long opponentOf(long userId) {
        if (player1Id == userId && player2Id != null) {
            return player2Id;
        }
        if (player2Id != null && player2Id == userId) {
            return player1Id;
        }
        throw new IllegalArgumentException("User " + userId + " has no opponent in this match");
    }

    /**
     * 记录胜者，只有第一次生效
     */
    public boolean recordWinner(long userId) {
        if (winnerId != null) {
            return false;
        }
        if (!involves(userId)) {
            throw new IllegalArgumentException("User " + userId + " is not in this match");
        }
        winnerId = userId;
        return true;
    }

    public boolean hasWinner() {
        return winnerId != null;
    }

    public int getRound() {
        return round;
    }

    public int getIndex() {
        return index;
    }

    public long getPlayer1Id() {
        return player1Id;
    }

    public Long getPlayer2Id() {
        return player2Id;
    }

    public Long getGameId() {
        return gameId;
    }

    public void setGameId(Long gameId) {
        this.gameId = gameId;
    }

    public Long getWinnerId() {
        return winnerId;
    }

    @Override
    public String toString() {
        return "R" + round + "#" + index + "(" + player1Id + " vs " + (isBye() ? "bye" : player2Id) + ")";
    }
}
