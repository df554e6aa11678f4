package com.projectgroup5.pongarena.game;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PaddleDirectionTest {

    @Test
    void fromCodeMapsWireCodes() {
        assertThat(PaddleDirection.fromCode(0)).contains(PaddleDirection.NONE);
        assertThat(PaddleDirection.fromCode(1)).contains(PaddleDirection.UP);
        assertThat(PaddleDirection.fromCode(2)).contains(PaddleDirection.DOWN);
    }

    @Test
    void fromCodeRejectsOutOfRange() {
        assertThat(PaddleDirection.fromCode(3)).isEmpty();
        assertThat(PaddleDirection.fromCode(-1)).isEmpty();
    }
}
