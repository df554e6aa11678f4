package com.projectgroup5.pongarena.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * game-update 快照：挡板、球、比分和阶段
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GameUpdateDto {
    private long gameId;
    private double paddleLeft;
    private double paddleRight;
    private double ballX;
    private double ballY;
    private int player1Score;
    private int player2Score;
    private String status;
    private Integer countdownValue;     // 仅倒计时阶段

    public long getGameId() {
        return gameId;
    }

    public void setGameId(long gameId) {
        this.gameId = gameId;
    }

    public double getPaddleLeft() {
        return paddleLeft;
    }

    public void setPaddleLeft(double paddleLeft) {
        this.paddleLeft = paddleLeft;
    }

    public double getPaddleRight() {
        return paddleRight;
    }

    public void setPaddleRight(double paddleRight) {
        this.paddleRight = paddleRight;
    }

    public double getBallX() {
        return ballX;
    }

    public void setBallX(double ballX) {
        this.ballX = ballX;
    }

    public double getBallY() {
        return ballY;
    }

    public void setBallY(double ballY) {
        this.ballY = ballY;
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

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Integer getCountdownValue() {
        return countdownValue;
    }

    public void setCountdownValue(Integer countdownValue) {
        this.countdownValue = countdownValue;
    }
}
