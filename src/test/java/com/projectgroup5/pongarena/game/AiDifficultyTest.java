package com.projectgroup5.pongarena.game;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AiDifficultyTest {

    @Test
    void fromValueIsCaseInsensitive() {
        assertThat(AiDifficulty.fromValue("easy")).isEqualTo(AiDifficulty.EASY);
        assertThat(AiDifficulty.fromValue("HARD")).isEqualTo(AiDifficulty.HARD);
    }

    @Test
    void unknownOrMissingDifficultyDefaultsToMedium() {
        assertThat(AiDifficulty.fromValue("impossible")).isEqualTo(AiDifficulty.MEDIUM);
        assertThat(AiDifficulty.fromValue(null)).isEqualTo(AiDifficulty.MEDIUM);
        assertThat(AiDifficulty.fromValue("")).isEqualTo(AiDifficulty.MEDIUM);
    }

    @Test
    void harderLevelsReactFasterWithLessError() {
        assertThat(AiDifficulty.HARD.getReactionDelayTicks()).isLessThan(AiDifficulty.MEDIUM.getReactionDelayTicks());
        assertThat(AiDifficulty.MEDIUM.getReactionDelayTicks()).isLessThan(AiDifficulty.EASY.getReactionDelayTicks());
        assertThat(AiDifficulty.HARD.getPositioningError()).isLessThan(AiDifficulty.EASY.getPositioningError());
        assertThat(AiDifficulty.EASY.getPredictionHorizonTicks()).isZero();
    }
}
