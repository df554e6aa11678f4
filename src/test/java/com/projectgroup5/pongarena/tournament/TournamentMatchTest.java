package com.projectgroup5.pongarena.tournament;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TournamentMatchTest {

    @Test
    void winnerIsRecordedOnlyOnce() {
        final TournamentMatch match = new TournamentMatch(1, 0, 1L, 2L);

        assertThat(match.recordWinner(2L)).isTrue();
        assertThat(match.recordWinner(1L)).isFalse();
        assertThat(match.getWinnerId()).isEqualTo(2L);
        assertThat(match.opponentOf(2L)).isEqualTo(1L);
    }

    @Test
    void outsiderCannotWin() {
        final TournamentMatch match = new TournamentMatch(1, 0, 1L, 2L);

        assertThatThrownBy(() -> match.recordWinner(3L)).isInstanceOf(IllegalArgumentException.class);
        assertThat(match.hasWinner()).isFalse();
    }

    @Test
    void byeAdvancesItsPlayer() {
        final TournamentMatch bye = TournamentMatch.bye(1, 0, 5L);

        assertThat(bye.hasWinner()).isTrue();
        assertThat(bye.involves(5L)).isTrue();
        assertThatThrownBy(() -> bye.opponentOf(5L)).isInstanceOf(IllegalArgumentException.class);
    }
}
