package com.projectgroup5.pongarena.tournament;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 锦标赛状态；所有读写都在 synchronized (tournament) 内进行
 */
public class Tournament {
    public static final String SINGLE_ELIMINATION = "single_elimination";

    private final long id;
    private final String name;
    private final long creatorId;
    private final int maxPlayers;
    private final String bracketType;
    private final Instant createdAt;

    // 报名顺序即种子顺序
    private final List<Long> participants = new ArrayList<>();
    private final List<Round> rounds = new ArrayList<>();
    private final Map<Long, Integer> eliminatedInRound = new HashMap<>();

    private TournamentStatus status = TournamentStatus.REGISTERING;
    private Long winnerId;
    private int totalRounds;                  // 开赛时确定

    public Tournament(long id, String name, long creatorId, int maxPlayers, String bracketType, Instant createdAt) {
        this.id = id;
        this.name = name;
        this.creatorId = creatorId;
        this.maxPlayers = maxPlayers;
        this.bracketType = bracketType;
        this.createdAt = createdAt;
    }

    public boolean isRegistered(long userId) {
        return participants.contains(userId);
    }

    public boolean isFull() {
        return participants.size() >= maxPlayers;
    }

    public void addParticipant(long userId) {
        participants.add(userId);
    }

    public boolean removeParticipant(long userId) {
        return participants.remove(Long.valueOf(userId));
    }

    public void addRound(Round round) {
        rounds.add(round);
    }

    /** 当前进行中的轮次，未开始时为 null */
    public Round currentRound() {
        return rounds.isEmpty() ? null : rounds.get(rounds.size() - 1);
    }

    public int getCurrentRoundNumber() {
        return rounds.size();
    }

    public void markEliminated(long userId, int round) {
        eliminatedInRound.put(userId, round);
    }

    public Integer eliminatedIn(long userId) {
        return eliminatedInRound.get(userId);
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public long getCreatorId() {
        return creatorId;
    }

    public int getMaxPlayers() {
        return maxPlayers;
    }

    public String getBracketType() {
        return bracketType;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public List<Long> getParticipants() {
        return Collections.unmodifiableList(participants);
    }

    public List<Round> getRounds() {
        return Collections.unmodifiableList(rounds);
    }

    public TournamentStatus getStatus() {
        return status;
    }

    public void setStatus(TournamentStatus status) {
        this.status = status;
    }

    public int getTotalRounds() {
        return totalRounds;
    }

    public void setTotalRounds(int totalRounds) {
        this.totalRounds = totalRounds;
    }

    public Long getWinnerId() {
        return winnerId;
    }

    public void setWinnerId(Long winnerId) {
        this.winnerId = winnerId;
    }
}
