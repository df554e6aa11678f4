package com.projectgroup5.pongarena.tournament;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Round {
    private final int number;
    private final List<TournamentMatch> matches;

    public Round(int number, List<TournamentMatch> matches) {
        this.number = number;
        this.matches = Collections.unmodifiableList(new ArrayList<>(matches));
    }

    /** 本轮所有场次都有胜者 */
    public boolean isComplete() {
        return matches.stream().allMatch(TournamentMatch::hasWinner);
    }

    public List<Long> winners() {
        List<Long> winners = new ArrayList<>(matches.size());
        for (TournamentMatch match : matches) {
            if (match.hasWinner()) {
                winners.add(match.getWinnerId());
            }
        }
        return winners;
    }

    public int getNumber() {
        return number;
    }

    public List<TournamentMatch> getMatches() {
        return matches;
    }
}
