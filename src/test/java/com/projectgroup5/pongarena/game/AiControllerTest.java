package com.projectgroup5.pongarena.game;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AiControllerTest {

    private static final double DT = 1.0 / 60;

    @Test
    void easyAiTracksCurrentBallY() {
        final AiController ai = new AiController(AiDifficulty.EASY, true, new Random(1));
        final Ball ball = new Ball(50, 10);
        ball.velocityX = -36;
        final Paddle paddle = new Paddle(45);

        assertThat(ai.decide(ball, paddle, DT)).isEqualTo(PaddleDirection.UP);
        assertThat(ai.getTargetY()).isBetween(0.0, 20.0);
    }

    @Test
    void aiReturnsToCentreWhenBallMovesAway() {
        final AiController ai = new AiController(AiDifficulty.HARD, true, new Random(1));
        final Ball ball = new Ball(50, 90);
        ball.velocityX = 36;

        assertThat(ai.decide(ball, new Paddle(70), DT)).isEqualTo(PaddleDirection.UP);
        assertThat(ai.getTargetY()).isEqualTo(50.0);
        assertThat(ai.decide(ball, new Paddle(45), DT)).isEqualTo(PaddleDirection.NONE);
    }

    @Test
    void targetIsOnlyRefreshedAfterReactionDelay() {
        final AiController ai = new AiController(AiDifficulty.EASY, true, new Random(3));
        final Ball ball = new Ball(50, 10);
        ball.velocityX = -36;
        final Paddle paddle = new Paddle(45);

        ai.decide(ball, paddle, DT);
        ball.y = 90;
        for (int i = 0; i < AiDifficulty.EASY.getReactionDelayTicks(); i++) {
            ai.decide(ball, paddle, DT);
        }
        assertThat(ai.getTargetY()).isLessThan(25.0);

        ai.decide(ball, paddle, DT);
        assertThat(ai.getTargetY()).isGreaterThan(75.0);
    }

    @Test
    void hardAiPredictsInterceptAcrossWallBounce() {
        final AiController ai = new AiController(AiDifficulty.HARD, false, new Random(1));
        final Ball ball = new Ball(50.5, 50);
        ball.velocityX = 60;
        ball.velocityY = 100;

        final double predicted = ai.predictInterceptY(ball, DT, AiDifficulty.HARD.getPredictionHorizonTicks());

        assertThat(predicted).isCloseTo(73.0, within(0.5));
    }

    @Test
    void predictionStopsAtHorizon() {
        final AiController ai = new AiController(AiDifficulty.MEDIUM, false, new Random(1));
        final Ball ball = new Ball(10, 50);
        ball.velocityX = 30;
        ball.velocityY = 30;

        final double predicted = ai.predictInterceptY(ball, DT, AiDifficulty.MEDIUM.getPredictionHorizonTicks());

        assertThat(predicted).isCloseTo(80.0, within(0.5));
    }

    @Test
    void hardAiMovesTowardsPredictedIntercept() {
        final AiController ai = new AiController(AiDifficulty.HARD, false, new Random(5));
        final Ball ball = new Ball(50, 50);
        ball.velocityX = 60;
        ball.velocityY = 60;

        assertThat(ai.decide(ball, new Paddle(45), DT)).isEqualTo(PaddleDirection.DOWN);
    }
}
