package com.projectgroup5.pongarena.service;

import com.projectgroup5.pongarena.config.GameProperties;
import com.projectgroup5.pongarena.dto.TournamentSummaryDto;
import com.projectgroup5.pongarena.event.EventBus;
import com.projectgroup5.pongarena.event.UserDisconnectedEvent;
import com.projectgroup5.pongarena.game.GameOrigin;
import com.projectgroup5.pongarena.game.GameResult;
import com.projectgroup5.pongarena.game.GameSession;
import com.projectgroup5.pongarena.game.GameSessionManager;
import com.projectgroup5.pongarena.game.PlayerSlot;
import com.projectgroup5.pongarena.tournament.BracketPlanner;
import com.projectgroup5.pongarena.tournament.Round;
import com.projectgroup5.pongarena.tournament.Tournament;
import com.projectgroup5.pongarena.tournament.TournamentMatch;
import com.projectgroup5.pongarena.tournament.TournamentStatus;
import com.projectgroup5.pongarena.websocket.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 锦标赛编排 - 单败淘汰
 *
 * 每个锦标赛用自身对象加锁；比赛结束回调在 tick 线程上执行，
 * 在锁内记录胜者并判断本轮是否全部结束（轮次屏障），不做轮询。
 * 结束或取消的锦标赛保留 tournamentRetentionSeconds 供查询，之后移出内存
 */
@Service
public class TournamentService {
    private static final Logger logger = LoggerFactory.getLogger(TournamentService.class);

    private static final Set<Integer> ALLOWED_SIZES = Set.of(4, 8, 16);

    private final Map<Long, Tournament> tournaments = new ConcurrentHashMap<>();
    private final AtomicLong tournamentIdSeq = new AtomicLong(1);

    private final GameSessionManager sessionManager;
    private final MatchmakingService matchmakingService;
    private final ConnectionRegistry connections;
    private final ProfileLookup profiles;
    private final ResultRecorder resultRecorder;
    private final GameProperties properties;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    public TournamentService(GameSessionManager sessionManager,
                             MatchmakingService matchmakingService,
                             ConnectionRegistry connections,
                             ProfileLookup profiles,
                             ResultRecorder resultRecorder,
                             GameProperties properties,
                             @Qualifier("gameLoopExecutor") ScheduledExecutorService scheduler,
                             Clock clock,
                             EventBus eventBus) {
        this.sessionManager = sessionManager;
        this.matchmakingService = matchmakingService;
        this.connections = connections;
        this.profiles = profiles;
        this.resultRecorder = resultRecorder;
        this.properties = properties;
        this.scheduler = scheduler;
        this.clock = clock;

        eventBus.subscribe(UserDisconnectedEvent.class, event -> onUserDisconnected(event.getUserId()));
    }

    // ==================== 报名阶段 ====================

    /**
     * 创建锦标赛，创建者自动报名；通知所有在线用户（含创建者）
     */
    public Tournament create(long creatorId, String name, int maxPlayers, String bracketType) {
        if (name == null || name.isBlank()) {
            throw new TournamentConflictException(TournamentErrorCode.INVALID_NAME);
        }
        if (!ALLOWED_SIZES.contains(maxPlayers)) {
            throw new TournamentConflictException(TournamentErrorCode.INVALID_SIZE);
        }
        String bracket = bracketType == null ? Tournament.SINGLE_ELIMINATION : bracketType;
        if (!Tournament.SINGLE_ELIMINATION.equals(bracket)) {
            throw new TournamentConflictException(TournamentErrorCode.UNSUPPORTED_BRACKET);
        }

        Tournament tournament = new Tournament(tournamentIdSeq.getAndIncrement(), name.trim(),
                creatorId, maxPlayers, bracket, clock.instant());
        tournament.addParticipant(creatorId);
        tournaments.put(tournament.getId(), tournament);

        connections.broadcastAll("tournament:created", Map.of("tournament", toSummary(tournament)));

        logger.info("User {} created tournament {} '{}' ({} players)",
                creatorId, tournament.getId(), tournament.getName(), maxPlayers);
        return tournament;
    }

    public Tournament join(long tournamentId, long userId) {
        Tournament tournament = require(tournamentId);
        synchronized (tournament) {
            if (tournament.getStatus() != TournamentStatus.REGISTERING) {
                throw new TournamentConflictException(TournamentErrorCode.NOT_REGISTERING);
            }
            if (tournament.isRegistered(userId)) {
                throw new TournamentConflictException(TournamentErrorCode.ALREADY_REGISTERED);
            }
            if (tournament.isFull()) {
                throw new TournamentConflictException(TournamentErrorCode.FULL);
            }
            tournament.addParticipant(userId);
            logger.info("User {} joined tournament {} ({}/{})", userId, tournamentId,
                    tournament.getParticipants().size(), tournament.getMaxPlayers());
            broadcastPlayerCount(tournament, "tournament:player-joined");
        }
        return tournament;
    }

    /**
     * 仅报名阶段可以退出；创建者退出则取消整个锦标赛
     */
    public Tournament leave(long tournamentId, long userId) {
        Tournament tournament = require(tournamentId);
        synchronized (tournament) {
            if (tournament.getStatus() != TournamentStatus.REGISTERING) {
                throw new TournamentConflictException(TournamentErrorCode.NOT_REGISTERING);
            }
            if (!tournament.isRegistered(userId)) {
                throw new TournamentConflictException(TournamentErrorCode.NOT_REGISTERED);
            }
            if (tournament.getCreatorId() == userId) {
                List<Long> notify = new ArrayList<>(tournament.getParticipants());
                tournament.removeParticipant(userId);
                cancel(tournament, notify, "creator_left");
                return tournament;
            }
            tournament.removeParticipant(userId);
            logger.info("User {} left tournament {}", userId, tournamentId);
            broadcastPlayerCount(tournament, "tournament:player-left");
        }
        return tournament;
    }

    private void broadcastPlayerCount(Tournament tournament, String event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tournamentId", tournament.getId());
        data.put("currentPlayers", tournament.getParticipants().size());
        data.put("maxPlayers", tournament.getMaxPlayers());
        connections.broadcast(tournament.getParticipants(), event, data);
    }

    // ==================== 开赛 / 轮次 ====================

    public void start(long tournamentId, long requesterId) {
        Tournament tournament = require(tournamentId);
        synchronized (tournament) {
            if (tournament.getCreatorId() != requesterId) {
                throw new TournamentConflictException(TournamentErrorCode.NOT_CREATOR);
            }
            if (tournament.getStatus() != TournamentStatus.REGISTERING) {
                throw new TournamentConflictException(TournamentErrorCode.NOT_REGISTERING);
            }
            if (tournament.getParticipants().size() < 2) {
                throw new TournamentConflictException(TournamentErrorCode.NOT_ENOUGH_PLAYERS);
            }

            tournament.setStatus(TournamentStatus.ACTIVE);
            tournament.setTotalRounds(BracketPlanner.totalRounds(tournament.getParticipants().size()));
            Round first = BracketPlanner.firstRound(List.copyOf(tournament.getParticipants()));

            Map<String, Object> started = new LinkedHashMap<>();
            started.put("tournamentId", tournamentId);
            started.put("participants", tournament.getParticipants().size());
            started.put("totalRounds", tournament.getTotalRounds());
            connections.broadcast(tournament.getParticipants(), "tournament:started", started);
            logger.info("Tournament {} started with {} players", tournamentId, tournament.getParticipants().size());

            beginRound(tournament, first);
        }
    }

    /** 调用方持有锁 */
    private void beginRound(Tournament tournament, Round round) {
        if (round.getMatches().isEmpty()) {
            fail(tournament, "Round " + round.getNumber() + " has no matches");
            return;
        }
        tournament.addRound(round);
        List<Long> participants = tournament.getParticipants();
        connections.broadcast(participants, "tournament:round-started",
                Map.of("tournamentId", tournament.getId(), "round", round.getNumber()));
        logger.info("Tournament {} round {} started: {}", tournament.getId(), round.getNumber(), round.getMatches());

        for (TournamentMatch match : round.getMatches()) {
            if (match.isBye()) {
                Map<String, Object> ready = new LinkedHashMap<>();
                ready.put("tournamentId", tournament.getId());
                ready.put("round", round.getNumber());
                ready.put("bye", true);
                connections.unicast(match.getPlayer1Id(), "tournament:match-ready", ready);
            } else {
                launchMatch(tournament, match);
            }
        }

        // 对局可能在 createSession 内同步结束并已经推进过轮次
        if (tournament.getStatus() == TournamentStatus.ACTIVE
                && tournament.currentRound() == round && round.isComplete()) {
            advance(tournament);
        }
    }

    private void launchMatch(Tournament tournament, TournamentMatch match) {
        long p1 = match.getPlayer1Id();
        long p2 = match.getPlayer2Id();
        matchmakingService.cancel(p1);
        matchmakingService.cancel(p2);

        long tournamentId = tournament.getId();
        GameSession session;
        try {
            session = sessionManager.createSession(PlayerSlot.human(p1), PlayerSlot.human(p2),
                    GameOrigin.TOURNAMENT, result -> onMatchFinished(tournamentId, match, result));
        } catch (GameConflictException e) {
            // 有玩家还在别的对局里：另一方直接晋级，都在忙则高种子晋级
            boolean p1Busy = sessionManager.isInSession(p1);
            boolean p2Busy = sessionManager.isInSession(p2);
            long winner = p1Busy && !p2Busy ? p2 : p1;
            logger.warn("Tournament {} match {} could not start ({}), awarding to {}",
                    tournamentId, match, e.getMessage(), winner);
            recordWinner(tournament, match, winner, "walkover");
            return;
        }
        match.setGameId(session.getId());

        sendMatchReady(tournament, match, p1, p2, session.getId());
        sendMatchReady(tournament, match, p2, p1, session.getId());
    }

    private void sendMatchReady(Tournament tournament, TournamentMatch match, long userId, long opponentId, long gameId) {
        Map<String, Object> opponent = new LinkedHashMap<>();
        opponent.put("id", opponentId);
        opponent.put("name", profiles.findProfile(opponentId).displayName());

        Map<String, Object> ready = new LinkedHashMap<>();
        ready.put("tournamentId", tournament.getId());
        ready.put("round", match.getRound());
        ready.put("gameId", gameId);
        ready.put("opponent", opponent);
        connections.unicast(userId, "tournament:match-ready", ready);
    }

    /**
     * 比赛结束回调（tick 线程）；同一场只记录一次胜者
     */
    void onMatchFinished(long tournamentId, TournamentMatch match, GameResult result) {
        Tournament tournament = tournaments.get(tournamentId);
        if (tournament == null) {
            return;
        }
        synchronized (tournament) {
            if (tournament.getStatus() != TournamentStatus.ACTIVE || match.hasWinner()) {
                return;
            }
            long winner;
            if (result.hasWinner() && match.involves(result.winnerId())) {
                winner = result.winnerId();
            } else {
                // 无胜者（内部错误 / 双方掉线超时）：高种子晋级
                winner = match.getPlayer1Id();
                logger.warn("Tournament {} match {} ended without a winner ({}), advancing seed {}",
                        tournamentId, match, result.endReason(), winner);
            }
            recordWinner(tournament, match, winner, result.endReason());

            Round current = tournament.currentRound();
            if (current != null && current.getNumber() == match.getRound() && current.isComplete()) {
                advance(tournament);
            }
        }
    }

    private void recordWinner(Tournament tournament, TournamentMatch match, long winner, String reason) {
        if (!match.recordWinner(winner)) {
            return;
        }
        long loser = match.opponentOf(winner);
        tournament.markEliminated(loser, match.getRound());

        Map<String, Object> completed = new LinkedHashMap<>();
        completed.put("tournamentId", tournament.getId());
        completed.put("round", match.getRound());
        completed.put("gameId", match.getGameId());
        completed.put("winnerId", winner);
        completed.put("winnerName", profiles.findProfile(winner).displayName());
        completed.put("reason", reason);
        connections.broadcast(tournament.getParticipants(), "tournament:match-completed", completed);
        logger.info("Tournament {} match {} won by {}", tournament.getId(), match, winner);
    }

    /** 本轮全部结束：生成下一轮或结束锦标赛，调用方持有锁 */
    private void advance(Tournament tournament) {
        Round current = tournament.currentRound();
        List<Long> winners = current.winners();
        if (winners.size() == 1) {
            complete(tournament, winners.get(0));
            return;
        }
        Round next;
        try {
            next = BracketPlanner.nextRound(current, tournament.getParticipants());
        } catch (IllegalStateException e) {
            fail(tournament, e.getMessage());
            return;
        }
        beginRound(tournament, next);
    }

    private void complete(Tournament tournament, long winnerId) {
        tournament.setStatus(TournamentStatus.COMPLETED);
        tournament.setWinnerId(winnerId);

        List<Map<String, Object>> standings = standings(tournament);
        Map<String, Object> completed = new LinkedHashMap<>();
        completed.put("tournamentId", tournament.getId());
        completed.put("winnerId", winnerId);
        completed.put("winnerName", profiles.findProfile(winnerId).displayName());
        completed.put("standings", standings);
        connections.broadcast(tournament.getParticipants(), "tournament:completed", completed);

        logger.info("Tournament {} completed, winner={}", tournament.getId(), winnerId);
        resultRecorder.recordTournament(tournament, standings);
        scheduleEviction(tournament);
    }

    /**
     * 最终排名：冠军第一，其余按被淘汰的轮次从晚到早
     */
    List<Map<String, Object>> standings(Tournament tournament) {
        List<Long> order = new ArrayList<>();
        Long winnerId = tournament.getWinnerId();
        if (winnerId != null) {
            order.add(winnerId);
        }
        tournament.getParticipants().stream()
                .filter(id -> !id.equals(winnerId))
                .sorted(Comparator.comparing((Long id) -> {
                    Integer round = tournament.eliminatedIn(id);
                    return round != null ? round : 0;
                }).reversed().thenComparingInt(tournament.getParticipants()::indexOf))
                .forEach(order::add);

        List<Map<String, Object>> standings = new ArrayList<>();
        for (int i = 0; i < order.size(); i++) {
            long userId = order.get(i);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("placement", i + 1);
            row.put("userId", userId);
            row.put("name", profiles.findProfile(userId).displayName());
            row.put("eliminatedInRound", tournament.eliminatedIn(userId));
            standings.add(row);
        }
        return standings;
    }

    private void fail(Tournament tournament, String reason) {
        logger.error("Tournament {} cancelled: {}", tournament.getId(), reason);
        cancel(tournament, tournament.getParticipants(), "internal_error");
    }

    private void cancel(Tournament tournament, List<Long> notify, String reason) {
        tournament.setStatus(TournamentStatus.CANCELLED);
        connections.broadcast(notify, "tournament:cancelled",
                Map.of("tournamentId", tournament.getId(), "reason", reason));
        logger.info("Tournament {} cancelled ({})", tournament.getId(), reason);
        scheduleEviction(tournament);
    }

    /**
     * 创建者取消；进行中的对局照常打完，但结果不再计入
     */
    public Tournament cancelByCreator(long tournamentId, long requesterId) {
        Tournament tournament = require(tournamentId);
        synchronized (tournament) {
            if (tournament.getCreatorId() != requesterId) {
                throw new TournamentConflictException(TournamentErrorCode.CANCEL_NOT_CREATOR);
            }
            if (!tournament.getStatus().isOpen()) {
                throw new TournamentConflictException(TournamentErrorCode.ALREADY_FINISHED);
            }
            cancel(tournament, tournament.getParticipants(), "cancelled_by_creator");
        }
        return tournament;
    }

    private void scheduleEviction(Tournament tournament) {
        long tournamentId = tournament.getId();
        try {
            scheduler.schedule(() -> evict(tournamentId), properties.tournamentRetentionSeconds(), TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            // 线程池已关闭，直接移除
            evict(tournamentId);
        }
    }

    void evict(long tournamentId) {
        if (tournaments.remove(tournamentId) != null) {
            logger.info("Evicted tournament {}", tournamentId);
        }
    }

    // ==================== 查询 / 连接事件 ====================

    public List<TournamentSummaryDto> listActive() {
        return tournaments.values().stream()
                .filter(t -> t.getStatus().isOpen())
                .sorted(Comparator.comparingLong(Tournament::getId))
                .map(t -> {
                    synchronized (t) {
                        return toSummary(t);
                    }
                })
                .collect(Collectors.toList());
    }

    public Optional<Tournament> find(long tournamentId) {
        return Optional.ofNullable(tournaments.get(tournamentId));
    }

    public TournamentSummaryDto summarize(Tournament tournament) {
        synchronized (tournament) {
            return toSummary(tournament);
        }
    }

    /**
     * 锦标赛详情：概要 + 按种子排列的参赛者
     */
    public Map<String, Object> details(long tournamentId) {
        Tournament tournament = require(tournamentId);
        synchronized (tournament) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("tournament", toSummary(tournament));
            details.put("players", players(tournament));
            return details;
        }
    }

    /**
     * 对阵表视图；myMatches 为请求者本人参加的场次
     */
    public Map<String, Object> bracket(long tournamentId, long requesterId) {
        Tournament tournament = require(tournamentId);
        synchronized (tournament) {
            List<Map<String, Object>> rounds = new ArrayList<>();
            List<Map<String, Object>> myMatches = new ArrayList<>();
            for (Round round : tournament.getRounds()) {
                List<Map<String, Object>> matches = new ArrayList<>();
                for (TournamentMatch match : round.getMatches()) {
                    matches.add(matchView(tournament, match));
                    if (match.involves(requesterId) && !match.isBye()) {
                        long opponentId = match.opponentOf(requesterId);
                        Map<String, Object> mine = new LinkedHashMap<>();
                        mine.put("round", match.getRound());
                        mine.put("status", matchStatus(match));
                        mine.put("opponentId", opponentId);
                        mine.put("opponentName", profiles.findProfile(opponentId).displayName());
                        mine.put("gameId", match.getGameId());
                        mine.put("isWinner", Long.valueOf(requesterId).equals(match.getWinnerId()));
                        myMatches.add(mine);
                    }
                }
                Map<String, Object> view = new LinkedHashMap<>();
                view.put("roundNumber", round.getNumber());
                view.put("roundName", BracketPlanner.roundName(round.getNumber(), tournament.getTotalRounds()));
                view.put("completed", round.isComplete());
                view.put("matches", matches);
                rounds.add(view);
            }

            Map<String, Object> bracket = new LinkedHashMap<>();
            bracket.put("tournament", toSummary(tournament));
            bracket.put("players", players(tournament));
            bracket.put("rounds", rounds);
            bracket.put("myMatches", myMatches);
            return bracket;
        }
    }

    private List<Map<String, Object>> players(Tournament tournament) {
        List<Map<String, Object>> players = new ArrayList<>();
        List<Long> seeds = tournament.getParticipants();
        for (int i = 0; i < seeds.size(); i++) {
            long userId = seeds.get(i);
            Integer eliminatedIn = tournament.eliminatedIn(userId);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("userId", userId);
            row.put("name", profiles.findProfile(userId).displayName());
            row.put("seed", i + 1);
            row.put("eliminated", eliminatedIn != null);
            row.put("eliminatedInRound", eliminatedIn);
            players.add(row);
        }
        return players;
    }

    private Map<String, Object> matchView(Tournament tournament, TournamentMatch match) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("matchNumber", match.getIndex() + 1);
        view.put("status", matchStatus(match));
        view.put("player1", slotView(match, match.getPlayer1Id()));
        view.put("player2", match.isBye() ? null : slotView(match, match.getPlayer2Id()));
        view.put("winnerId", match.getWinnerId());
        view.put("gameId", match.getGameId());
        view.put("canSpectate", tournament.getStatus() == TournamentStatus.ACTIVE
                && "in_progress".equals(matchStatus(match)));
        return view;
    }

    private Map<String, Object> slotView(TournamentMatch match, long userId) {
        Map<String, Object> slot = new LinkedHashMap<>();
        slot.put("id", userId);
        slot.put("name", profiles.findProfile(userId).displayName());
        slot.put("isWinner", Long.valueOf(userId).equals(match.getWinnerId()));
        return slot;
    }

    private static String matchStatus(TournamentMatch match) {
        if (match.isBye()) {
            return "bye";
        }
        if (match.hasWinner()) {
            return "completed";
        }
        return match.getGameId() != null ? "in_progress" : "pending";
    }

    private void onUserDisconnected(long userId) {
        for (Tournament tournament : tournaments.values()) {
            synchronized (tournament) {
                if (tournament.getStatus() == TournamentStatus.REGISTERING && tournament.isRegistered(userId)) {
                    logger.info("User {} disconnected, leaving tournament {}", userId, tournament.getId());
                    leave(tournament.getId(), userId);
                }
            }
        }
    }

    private Tournament require(long tournamentId) {
        Tournament tournament = tournaments.get(tournamentId);
        if (tournament == null) {
            throw new TournamentConflictException(TournamentErrorCode.NOT_FOUND);
        }
        return tournament;
    }

    private TournamentSummaryDto toSummary(Tournament tournament) {
        TournamentSummaryDto dto = new TournamentSummaryDto();
        dto.setId(tournament.getId());
        dto.setName(tournament.getName());
        dto.setCreatorId(tournament.getCreatorId());
        dto.setCurrentPlayers(tournament.getParticipants().size());
        dto.setMaxPlayers(tournament.getMaxPlayers());
        dto.setBracketType(tournament.getBracketType());
        dto.setStatus(tournament.getStatus().wireName());
        dto.setCurrentRound(tournament.getCurrentRoundNumber());
        dto.setTotalRounds(tournament.getTotalRounds());
        dto.setWinnerId(tournament.getWinnerId());
        return dto;
    }
}
