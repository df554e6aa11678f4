package com.projectgroup5.pongarena.dto;

/**
 * 可观战对局列表项（game:active-games）
 */
public class ActiveGameDto {
    private long gameId;
    private PlayerInfoDto player1;
    private PlayerInfoDto player2;
    private int player1Score;
    private int player2Score;
    private String origin;
    private String status;
    private int spectators;

    public long getGameId() {
        return gameId;
    }

    public void setGameId(long gameId) {
        this.gameId = gameId;
    }

    public PlayerInfoDto getPlayer1() {
        return player1;
    }

    public void setPlayer1(PlayerInfoDto player1) {
        this.player1 = player1;
    }

    public PlayerInfoDto getPlayer2() {
        return player2;
    }

    public void setPlayer2(PlayerInfoDto player2) {
        this.player2 = player2;
    }

    public int getPlayer1Score() {
        return player1Score;
    }

    public void setPlayer1Score(int player1Score) {
        this.player1Score = player1Score;
    }

    public int getPlayer2Score() {
        return player2Score;
    }

    public void setPlayer2Score(int player2Score) {
        this.player2Score = player2Score;
    }

    public String getOrigin() {
        return origin;
    }

    public void setOrigin(String origin) {
        this.origin = origin;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public int getSpectators() {
        return spectators;
    }

    public void setSpectators(int spectators) {
        this.spectators = spectators;
    }
}
