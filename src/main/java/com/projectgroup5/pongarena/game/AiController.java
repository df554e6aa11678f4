package com.projectgroup5.pongarena.game;

import java.util.Random;

/**
 * AI 控制器 - 在所属对局的 tick 内为 AI 席位决定挡板方向
 * 只读取球和自己挡板的状态，不直接修改对局
 */
public class AiController {

    private final AiDifficulty difficulty;
    private final boolean leftSide;
    private final Random random;

    private int ticksUntilRethink = 0;
    private double targetY = PhysicsEngine.CENTER_Y;

    public AiController(AiDifficulty difficulty, boolean leftSide, Random random) {
        this.difficulty = difficulty;
        this.leftSide = leftSide;
        this.random = random;
    }

    /**
     * 每个 tick 调用一次；目标位置按反应延迟刷新，方向每个 tick 对照目标重新判断
     */
    public PaddleDirection decide(Ball ball, Paddle own, double deltaSeconds) {
        if (ticksUntilRethink > 0) {
            ticksUntilRethink--;
        } else {
            targetY = chooseTarget(ball, deltaSeconds);
            ticksUntilRethink = difficulty.getReactionDelayTicks();
        }

        double diff = targetY - own.center();
        if (Math.abs(diff) <= difficulty.getDeadZone()) {
            return PaddleDirection.NONE;
        }
        return diff > 0 ? PaddleDirection.DOWN : PaddleDirection.UP;
    }

    double getTargetY() {
        return targetY;
    }

    private double chooseTarget(Ball ball, double deltaSeconds) {
        if (!isApproaching(ball)) {
            // 球远离时回到中间
            return PhysicsEngine.CENTER_Y;
        }
        double base = difficulty.getPredictionHorizonTicks() == 0
                ? ball.y
                : predictInterceptY(ball, deltaSeconds, difficulty.getPredictionHorizonTicks());
        double error = (random.nextDouble() * 2 - 1) * difficulty.getPositioningError();
        return Math.max(0, Math.min(PhysicsEngine.FIELD_HEIGHT, base + error));
    }

    private boolean isApproaching(Ball ball) {
        return leftSide ? ball.velocityX < 0 : ball.velocityX > 0;
    }

    /**
     * 逐步模拟球的轨迹（含上下边界反弹），直到到达己方击球面或用完预测步数
     */
    double predictInterceptY(Ball ball, double deltaSeconds, int horizonTicks) {
        double x = ball.x;
        double y = ball.y;
        double vy = ball.velocityY;
        double top = Ball.RADIUS;
        double bottom = PhysicsEngine.FIELD_HEIGHT - Ball.RADIUS;

        for (int i = 0; i < horizonTicks; i++) {
            if (reachedFace(x)) {
                break;
            }
            x += ball.velocityX * deltaSeconds;
            y += vy * deltaSeconds;
            if (y <= top) {
                y = top + (top - y);
                vy = Math.abs(vy);
            } else if (y >= bottom) {
                y = bottom - (y - bottom);
                vy = -Math.abs(vy);
            }
        }
        return y;
    }

    private boolean reachedFace(double x) {
        return leftSide
                ? x - Ball.RADIUS <= PhysicsEngine.LEFT_PADDLE_FACE
                : x + Ball.RADIUS >= PhysicsEngine.RIGHT_PADDLE_FACE;
    }
}
