package com.projectgroup5.pongarena.tournament;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 单败淘汰对阵生成
 * - 第一轮：nextPowerOfTwo(n) - n 名高种子轮空，其余按 i 对 n-1-i 配对
 * - 之后每轮：胜者按种子顺序排列，同样首尾配对
 * 种子顺序即报名顺序
 */
public final class BracketPlanner {

    private BracketPlanner() {
    }

    public static Round firstRound(List<Long> seeds) {
        if (seeds.size() < 2) {
            throw new IllegalArgumentException("At least 2 participants are required, got " + seeds.size());
        }
        int byes = nextPowerOfTwo(seeds.size()) - seeds.size();
        List<TournamentMatch> matches = new ArrayList<>();
        int index = 0;
        for (int i = 0; i < byes; i++) {
            matches.add(TournamentMatch.bye(1, index++, seeds.get(i)));
        }
        for (TournamentMatch match : pairOutside(seeds.subList(byes, seeds.size()), 1, index)) {
            matches.add(match);
        }
        return new Round(1, matches);
    }

    public static Round nextRound(Round completed, List<Long> seeds) {
        if (!completed.isComplete()) {
            throw new IllegalStateException("Round " + completed.getNumber() + " is not complete");
        }
        List<Long> winners = new ArrayList<>(completed.winners());
        winners.sort(Comparator.comparingInt(seeds::indexOf));
        if (winners.size() % 2 != 0) {
            throw new IllegalStateException("Odd number of winners after round " + completed.getNumber());
        }
        int number = completed.getNumber() + 1;
        return new Round(number, pairOutside(winners, number, 0));
    }

    public static int totalRounds(int participants) {
        return Integer.numberOfTrailingZeros(nextPowerOfTwo(participants));
    }

    /** 决赛 / 半决赛 / 四分之一决赛，其余为 Round n */
    public static String roundName(int round, int totalRounds) {
        switch (totalRounds - round) {
            case 0:
                return "Finals";
            case 1:
                return "Semi-Finals";
            case 2:
                return "Quarter-Finals";
            default:
                return "Round " + round;
        }
    }

    static int nextPowerOfTwo(int n) {
        int power = 1;
        while (power < n) {
            power <<= 1;
        }
        return power;
    }

    private static List<TournamentMatch> pairOutside(List<Long> players, int round, int firstIndex) {
        List<TournamentMatch> matches = new ArrayList<>();
        int n = players.size();
        for (int i = 0; i < n / 2; i++) {
            matches.add(new TournamentMatch(round, firstIndex + i, players.get(i), players.get(n - 1 - i)));
        }
        return matches;
    }
}
