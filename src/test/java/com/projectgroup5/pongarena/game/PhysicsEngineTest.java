package com.projectgroup5.pongarena.game;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PhysicsEngineTest {

    private static final double DT = 1.0 / 60;

    private PhysicsEngine physics;
    private Paddle left;
    private Paddle right;

    @BeforeEach
    void setUp() {
        physics = new PhysicsEngine();
        left = new Paddle(45);
        right = new Paddle(45);
    }

    @Test
    void paddleMovesByCommandedDirectionAndIsClampedToField() {
        final Paddle paddle = new Paddle(89);
        paddle.direction = PaddleDirection.DOWN;
        physics.movePaddle(paddle, DT);
        assertThat(paddle.y).isEqualTo(90.0);

        paddle.y = 0.5;
        paddle.direction = PaddleDirection.UP;
        physics.movePaddle(paddle, DT);
        assertThat(paddle.y).isEqualTo(0.0);

        paddle.y = 40;
        paddle.direction = PaddleDirection.UP;
        physics.movePaddle(paddle, DT);
        assertThat(paddle.y).isCloseTo(39.0, within(1e-9));
    }

    @Test
    void paddleStaysWhenDirectionIsNone() {
        final Paddle paddle = new Paddle(30);
        physics.movePaddle(paddle, DT);
        assertThat(paddle.y).isEqualTo(30.0);
        assertThat(paddle.velocity).isZero();
    }

    @Test
    void centreHitReflectsStraightAndAccelerates() {
        final Ball ball = new Ball(5.5, 50);
        ball.velocityX = -60;

        final PhysicsEngine.Outcome outcome = physics.updateBall(ball, left, right, DT);

        assertThat(outcome).isEqualTo(PhysicsEngine.Outcome.NONE);
        assertThat(ball.velocityX).isCloseTo(60 * 1.08, within(1e-9));
        assertThat(ball.velocityY).isCloseTo(0, within(1e-9));
        assertThat(ball.x).isEqualTo(PhysicsEngine.LEFT_PADDLE_FACE + Ball.RADIUS);
    }

    @Test
    void edgeHitDeflectsAtSixtyDegrees() {
        final Ball ball = new Ball(94.5, 55);
        ball.velocityX = 60;

        physics.updateBall(ball, left, right, DT);

        final double speed = 60 * 1.08;
        assertThat(ball.velocityX).isCloseTo(-speed * Math.cos(Math.PI / 3), within(1e-9));
        assertThat(ball.velocityY).isCloseTo(speed * Math.sin(Math.PI / 3), within(1e-9));
    }

    @Test
    void ballSpeedIsCappedAfterDeflection() {
        final Ball ball = new Ball(5.5, 50);
        ball.velocityX = -70;

        physics.updateBall(ball, left, right, DT);

        assertThat(ball.speed()).isCloseTo(PhysicsEngine.MAX_BALL_SPEED, within(1e-9));
    }

    @Test
    void ballPassingThePaddleIsNotDeflected() {
        final Ball ball = new Ball(5.5, 80);
        ball.velocityX = -60;

        physics.updateBall(ball, left, right, DT);

        assertThat(ball.velocityX).isEqualTo(-60.0);
    }

    @Test
    void ballLeavingLeftSideScoresForPlayerTwo() {
        final Ball ball = new Ball(-0.5, 80);
        ball.velocityX = -36;

        assertThat(physics.updateBall(ball, left, right, DT)).isEqualTo(PhysicsEngine.Outcome.PLAYER2_SCORED);
    }

    @Test
    void ballLeavingRightSideScoresForPlayerOne() {
        final Ball ball = new Ball(100.5, 20);
        ball.velocityX = 36;

        assertThat(physics.updateBall(ball, left, right, DT)).isEqualTo(PhysicsEngine.Outcome.PLAYER1_SCORED);
    }

    @Test
    void topWallReflectsVerticalVelocity() {
        final Ball ball = new Ball(50, 1.2);
        ball.velocityX = 10;
        ball.velocityY = -60;

        physics.updateBall(ball, left, right, DT);

        assertThat(ball.velocityY).isEqualTo(60.0);
        assertThat(ball.y).isGreaterThanOrEqualTo(Ball.RADIUS);
    }

    @Test
    void serveResetsBallToExactCentreWithInitialSpeed() {
        final Ball ball = new Ball(3, 97);

        physics.serveBall(ball, new Random(42));

        assertThat(ball.x).isEqualTo(50.0);
        assertThat(ball.y).isEqualTo(50.0);
        assertThat(ball.speed()).isCloseTo(PhysicsEngine.INITIAL_BALL_SPEED, within(1e-9));
    }

    @Test
    void serveIsDeterministicForTheSameSeed() {
        final Ball first = new Ball(0, 0);
        final Ball second = new Ball(0, 0);

        physics.serveBall(first, new Random(7));
        physics.serveBall(second, new Random(7));

        assertThat(first.velocityX).isEqualTo(second.velocityX);
        assertThat(first.velocityY).isEqualTo(second.velocityY);
    }
}
