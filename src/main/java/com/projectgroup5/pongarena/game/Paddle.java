package com.projectgroup5.pongarena.game;

/**
 * 挡板，y 为上边缘
 */
public class Paddle {
    public static final double HEIGHT = 10;

    public double y;
    public double velocity;
    public PaddleDirection direction = PaddleDirection.NONE;

    public Paddle(double y) {
        this.y = y;
    }

    public double center() {
        return y + HEIGHT / 2;
    }
}
