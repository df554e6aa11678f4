package com.projectgroup5.pongarena.game;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * 物理引擎 - 处理挡板移动、球的运动和碰撞（服务器权威）
 * 场地坐标为百分比：宽 100，高 100；速度单位为 每秒，按固定步长推进
 */
@Component
public class PhysicsEngine {
    private static final Logger logger = LoggerFactory.getLogger(PhysicsEngine.class);

    public static final double FIELD_WIDTH = 100;
    public static final double FIELD_HEIGHT = 100;
    public static final double CENTER_X = FIELD_WIDTH / 2;
    public static final double CENTER_Y = FIELD_HEIGHT / 2;

    // 挡板击球面的 x 坐标
    public static final double LEFT_PADDLE_FACE = 4;
    public static final double RIGHT_PADDLE_FACE = 96;

    // 每帧 1 / 0.35 / 1.2，按 60 fps 换算为每秒
    public static final double PADDLE_SPEED = 60.0;
    public static final double INITIAL_BALL_SPEED = 21.0;
    public static final double MAX_BALL_SPEED = 72.0;
    public static final double BALL_ACCELERATION = 1.08;

    private static final double MAX_BOUNCE_ANGLE = Math.PI / 3;  // 60°
    private static final double MAX_SERVE_ANGLE = Math.PI / 6;   // 发球 ±30°

    /** 单步推进后的得分结果 */
    public enum Outcome {
        NONE,
        PLAYER1_SCORED,
        PLAYER2_SCORED
    }

    /**
     * 按指令方向移动挡板，限制在 [0, 100 - 挡板高度]
     */
    public void movePaddle(Paddle paddle, double deltaSeconds) {
        paddle.velocity = paddle.direction.getSign() * PADDLE_SPEED;
        paddle.y += paddle.velocity * deltaSeconds;
        paddle.y = Math.max(0, Math.min(FIELD_HEIGHT - Paddle.HEIGHT, paddle.y));
    }

    /**
     * 推进球一个步长：上下边界反弹、挡板碰撞、出界判分
     */
    public Outcome updateBall(Ball ball, Paddle left, Paddle right, double deltaSeconds) {
        double prevX = ball.x;
        double prevY = ball.y;
        double nextX = ball.x + ball.velocityX * deltaSeconds;
        double nextY = ball.y + ball.velocityY * deltaSeconds;

        // 1) 上下边界反弹
        if (nextY <= Ball.RADIUS) {
            nextY = Ball.RADIUS + (Ball.RADIUS - nextY);
            ball.velocityY = Math.abs(ball.velocityY);
        } else if (nextY >= FIELD_HEIGHT - Ball.RADIUS) {
            nextY = (FIELD_HEIGHT - Ball.RADIUS) - (nextY - (FIELD_HEIGHT - Ball.RADIUS));
            ball.velocityY = -Math.abs(ball.velocityY);
        }

        // 2) 挡板碰撞：按穿过击球面的位置插值求击球点
        if (ball.velocityX < 0) {
            double edgeBefore = prevX - Ball.RADIUS;
            double edgeAfter = nextX - Ball.RADIUS;
            if (edgeBefore >= LEFT_PADDLE_FACE && edgeAfter < LEFT_PADDLE_FACE) {
                double t = (edgeBefore - LEFT_PADDLE_FACE) / (edgeBefore - edgeAfter);
                double hitY = prevY + t * (nextY - prevY);
                if (intersects(left, hitY)) {
                    deflect(ball, left, hitY, true);
                    nextX = LEFT_PADDLE_FACE + Ball.RADIUS;
                    nextY = hitY;
                }
            }
        } else if (ball.velocityX > 0) {
            double edgeBefore = prevX + Ball.RADIUS;
            double edgeAfter = nextX + Ball.RADIUS;
            if (edgeBefore <= RIGHT_PADDLE_FACE && edgeAfter > RIGHT_PADDLE_FACE) {
                double t = (RIGHT_PADDLE_FACE - edgeBefore) / (edgeAfter - edgeBefore);
                double hitY = prevY + t * (nextY - prevY);
                if (intersects(right, hitY)) {
                    deflect(ball, right, hitY, false);
                    nextX = RIGHT_PADDLE_FACE - Ball.RADIUS;
                    nextY = hitY;
                }
            }
        }

        ball.x = nextX;
        ball.y = nextY;

        // 3) 出界判分：左侧出界右方得分，右侧出界左方得分
        if (ball.x + Ball.RADIUS < 0) {
            return Outcome.PLAYER2_SCORED;
        }
        if (ball.x - Ball.RADIUS > FIELD_WIDTH) {
            return Outcome.PLAYER1_SCORED;
        }
        return Outcome.NONE;
    }

    /**
     * 挡板反弹：角度由击球点偏离挡板中心的比例决定，速度乘以加速系数（有上限）
     */
    public void deflect(Ball ball, Paddle paddle, double hitY, boolean leftPaddle) {
        double offset = (hitY - paddle.center()) / (Paddle.HEIGHT / 2);
        offset = Math.max(-1, Math.min(1, offset));
        double angle = offset * MAX_BOUNCE_ANGLE;
        double speed = Math.min(ball.speed() * BALL_ACCELERATION, MAX_BALL_SPEED);
        double direction = leftPaddle ? 1 : -1;

        ball.velocityX = direction * speed * Math.cos(angle);
        ball.velocityY = speed * Math.sin(angle);

        logger.debug("Ball deflected by {} paddle, offset={}, speed={}",
                leftPaddle ? "left" : "right", offset, speed);
    }

    /**
     * 发球：球回到正中心，方向由对局自己的 Random 决定
     */
    public void serveBall(Ball ball, Random random) {
        double angle = (random.nextDouble() * 2 - 1) * MAX_SERVE_ANGLE;
        double direction = random.nextBoolean() ? 1 : -1;

        ball.x = CENTER_X;
        ball.y = CENTER_Y;
        ball.velocityX = direction * INITIAL_BALL_SPEED * Math.cos(angle);
        ball.velocityY = INITIAL_BALL_SPEED * Math.sin(angle);
    }

    private boolean intersects(Paddle paddle, double hitY) {
        return hitY >= paddle.y - Ball.RADIUS && hitY <= paddle.y + Paddle.HEIGHT + Ball.RADIUS;
    }
}
