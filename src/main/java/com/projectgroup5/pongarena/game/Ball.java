package com.projectgroup5.pongarena.game;

/**
 * 球（服务器权威），只由所属对局的 tick 修改
 * 坐标为百分比，速度单位为 每秒
 */
public class Ball {
    public static final double RADIUS = 1;

    public double x, y;
    public double velocityX, velocityY;

    public Ball(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double speed() {
        return Math.hypot(velocityX, velocityY);
    }
}
