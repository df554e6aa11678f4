package com.projectgroup5.pongarena.service;

import com.projectgroup5.pongarena.config.GameProperties;
import com.projectgroup5.pongarena.dto.TournamentSummaryDto;
import com.projectgroup5.pongarena.event.EventBus;
import com.projectgroup5.pongarena.event.UserDisconnectedEvent;
import com.projectgroup5.pongarena.game.GameOrigin;
import com.projectgroup5.pongarena.game.GamePhase;
import com.projectgroup5.pongarena.game.GameResult;
import com.projectgroup5.pongarena.game.GameSession;
import com.projectgroup5.pongarena.game.GameSessionManager;
import com.projectgroup5.pongarena.game.PlayerSlot;
import com.projectgroup5.pongarena.tournament.Tournament;
import com.projectgroup5.pongarena.tournament.TournamentStatus;
import com.projectgroup5.pongarena.websocket.ConnectionRegistry;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TournamentServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final GameProperties PROPERTIES = new GameProperties(60, 11, 3, 30, 5, 1, 60);

    /** 一场被启动的锦标赛对局 */
    private record Launched(long player1, long player2, long gameId, Consumer<GameResult> callback) {
    }

    private GameSessionManager sessionManager;
    private MatchmakingService matchmakingService;
    private ConnectionRegistry connections;
    private ResultRecorder resultRecorder;
    private ScheduledExecutorService scheduler;
    private EventBus eventBus;
    private TournamentService service;

    private final List<GameSession> sessionPool = new ArrayList<>();
    private final List<Launched> launched = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        sessionManager = mock(GameSessionManager.class);
        matchmakingService = mock(MatchmakingService.class);
        connections = mock(ConnectionRegistry.class);
        resultRecorder = mock(ResultRecorder.class);
        scheduler = mock(ScheduledExecutorService.class);
        final ProfileLookup profiles = mock(ProfileLookup.class);
        when(profiles.findProfile(anyLong())).thenAnswer(inv -> PlayerProfile.fallback(inv.getArgument(0)));
        eventBus = new EventBus();

        for (long gameId = 100; gameId < 116; gameId++) {
            final GameSession session = mock(GameSession.class);
            when(session.getId()).thenReturn(gameId);
            sessionPool.add(session);
        }
        when(sessionManager.createSession(any(PlayerSlot.class), any(PlayerSlot.class), eq(GameOrigin.TOURNAMENT), any()))
                .thenAnswer(inv -> {
                    final GameSession session = sessionPool.get(launched.size());
                    final PlayerSlot p1 = inv.getArgument(0);
                    final PlayerSlot p2 = inv.getArgument(1);
                    launched.add(new Launched(p1.getUserId(), p2.getUserId(), session.getId(),
                            (Consumer<GameResult>) inv.getArgument(3)));
                    return session;
                });

        service = new TournamentService(sessionManager, matchmakingService, connections, profiles, resultRecorder,
                PROPERTIES, scheduler, Clock.fixed(NOW, ZoneOffset.UTC), eventBus);
    }

    private Tournament registered(long... players) {
        final Tournament tournament = service.create(players[0], "Spring Cup", players.length <= 4 ? 4 : 8, null);
        for (int i = 1; i < players.length; i++) {
            service.join(tournament.getId(), players[i]);
        }
        return tournament;
    }

    private static void finish(Launched match, Long winnerId) {
        final GamePhase phase = winnerId != null ? GamePhase.FINISHED : GamePhase.CANCELLED;
        final String reason = winnerId != null ? "score_reached" : "internal_error";
        match.callback().accept(new GameResult(match.gameId(), GameOrigin.TOURNAMENT, match.player1(),
                match.player2(), winnerId, 11, 4, phase, reason, NOW, NOW));
    }

    private Runnable capturedEviction() {
        final ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(task.capture(), eq(60L), eq(TimeUnit.SECONDS));
        return task.getValue();
    }

    private static void assertConflict(ThrowingCallable call, TournamentErrorCode code) {
        assertThatThrownBy(call).isInstanceOfSatisfying(TournamentConflictException.class,
                e -> assertThat(e.getCode()).isEqualTo(code));
    }

    @Test
    void fourPlayerBracketRunsToCompletion() {
        final Tournament tournament = registered(1, 2, 3, 4);

        service.start(tournament.getId(), 1);

        assertThat(tournament.getStatus()).isEqualTo(TournamentStatus.ACTIVE);
        assertThat(launched).extracting(Launched::player1, Launched::player2)
                .containsExactly(tuple(1L, 4L), tuple(2L, 3L));
        verify(matchmakingService).cancel(1L);
        verify(matchmakingService).cancel(4L);

        finish(launched.get(0), 1L);
        assertThat(launched).hasSize(2);
        finish(launched.get(1), 3L);

        assertThat(launched).hasSize(3);
        assertThat(launched.get(2).player1()).isEqualTo(1L);
        assertThat(launched.get(2).player2()).isEqualTo(3L);

        finish(launched.get(2), 3L);

        assertThat(tournament.getStatus()).isEqualTo(TournamentStatus.COMPLETED);
        assertThat(tournament.getWinnerId()).isEqualTo(3L);
        verify(connections).broadcast(anyList(), eq("tournament:completed"), any());
        verify(resultRecorder).recordTournament(eq(tournament), anyList());

        final List<Map<String, Object>> standings = service.standings(tournament);
        assertThat(standings).extracting(row -> row.get("userId")).containsExactly(3L, 1L, 2L, 4L);
        assertThat(standings.get(0).get("placement")).isEqualTo(1);
        assertThat(standings.get(1).get("eliminatedInRound")).isEqualTo(2);
    }

    @Test
    void startAnnouncesTotalRounds() {
        final Tournament tournament = registered(1, 2, 3);

        service.start(tournament.getId(), 1);

        verify(connections).broadcast(anyList(), eq("tournament:started"),
                argThat(data -> Integer.valueOf(2).equals(((Map<?, ?>) data).get("totalRounds"))));
    }

    @Test
    void topSeedGetsByeInThreePlayerBracket() {
        final Tournament tournament = registered(1, 2, 3);

        service.start(tournament.getId(), 1);

        assertThat(launched).hasSize(1);
        assertThat(launched.get(0).player1()).isEqualTo(2L);
        verify(connections).unicast(eq(1L), eq("tournament:match-ready"),
                argThat(data -> Boolean.TRUE.equals(((Map<?, ?>) data).get("bye"))));

        finish(launched.get(0), 2L);

        assertThat(launched).hasSize(2);
        assertThat(launched.get(1).player1()).isEqualTo(1L);
        assertThat(launched.get(1).player2()).isEqualTo(2L);
    }

    @Test
    void duplicateCompletionIsIgnored() {
        final Tournament tournament = registered(1, 2, 3, 4);
        service.start(tournament.getId(), 1);

        finish(launched.get(0), 4L);
        finish(launched.get(0), 1L);

        assertThat(tournament.currentRound().getMatches().get(0).getWinnerId()).isEqualTo(4L);
        verify(connections, times(1)).broadcast(anyList(), eq("tournament:match-completed"), any());
    }

    @Test
    void concurrentCompletionsStartNextRoundOnce() throws Exception {
        final Tournament tournament = registered(1, 2, 3, 4, 5, 6, 7, 8);
        service.start(tournament.getId(), 1);
        assertThat(launched).hasSize(4);

        final List<Launched> firstRound = new ArrayList<>(launched);
        final ExecutorService pool = Executors.newFixedThreadPool(4);
        final CountDownLatch go = new CountDownLatch(1);
        try {
            for (Launched match : firstRound) {
                pool.submit(() -> {
                    go.await();
                    finish(match, match.player1());
                    return null;
                });
            }
            go.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(launched).hasSize(6);
        assertThat(tournament.currentRound().getNumber()).isEqualTo(2);
        assertThat(launched.subList(4, 6)).extracting(Launched::player1, Launched::player2)
                .containsExactly(tuple(1L, 4L), tuple(2L, 3L));
    }

    @Test
    void busyPlayerForfeitsByWalkover() {
        doThrow(new GameConflictException(GameErrorCode.ALREADY_IN_SESSION)).when(sessionManager)
                .createSession(argThat(slot -> slot != null && slot.getUserId() == 1L), any(PlayerSlot.class),
                        eq(GameOrigin.TOURNAMENT), any());
        when(sessionManager.isInSession(1L)).thenReturn(true);
        final Tournament tournament = registered(1, 2, 3, 4);

        service.start(tournament.getId(), 1);

        assertThat(launched).hasSize(1);
        assertThat(tournament.currentRound().getMatches().get(0).getWinnerId()).isEqualTo(4L);
        assertThat(tournament.eliminatedIn(1L)).isEqualTo(1);

        finish(launched.get(0), 2L);

        assertThat(launched).hasSize(2);
        assertThat(launched.get(1).player1()).isEqualTo(2L);
        assertThat(launched.get(1).player2()).isEqualTo(4L);
    }

    @Test
    void matchWithoutWinnerAdvancesHigherSeed() {
        final Tournament tournament = registered(1, 2, 3, 4);
        service.start(tournament.getId(), 1);

        finish(launched.get(1), null);

        assertThat(tournament.currentRound().getMatches().get(1).getWinnerId()).isEqualTo(2L);
    }

    @Test
    void validationOnCreate() {
        assertConflict(() -> service.create(1, " ", 4, null), TournamentErrorCode.INVALID_NAME);
        assertConflict(() -> service.create(1, "Cup", 5, null), TournamentErrorCode.INVALID_SIZE);
        assertConflict(() -> service.create(1, "Cup", 4, "double_elimination"), TournamentErrorCode.UNSUPPORTED_BRACKET);
    }

    @Test
    void createAnnouncesToEveryone() {
        final Tournament tournament = service.create(1, "  Cup ", 8, "single_elimination");

        assertThat(tournament.getName()).isEqualTo("Cup");
        assertThat(tournament.getParticipants()).containsExactly(1L);
        verify(connections).broadcastAll(eq("tournament:created"), any());
    }

    @Test
    void registrationRules() {
        final Tournament tournament = registered(1, 2, 3, 4);

        assertConflict(() -> service.join(tournament.getId(), 5), TournamentErrorCode.FULL);
        assertConflict(() -> service.join(tournament.getId(), 2), TournamentErrorCode.ALREADY_REGISTERED);
        assertConflict(() -> service.join(999, 5), TournamentErrorCode.NOT_FOUND);
        assertConflict(() -> service.leave(tournament.getId(), 9), TournamentErrorCode.NOT_REGISTERED);
        assertConflict(() -> service.start(tournament.getId(), 2), TournamentErrorCode.NOT_CREATOR);

        service.start(tournament.getId(), 1);
        assertConflict(() -> service.leave(tournament.getId(), 2), TournamentErrorCode.NOT_REGISTERING);
        assertConflict(() -> service.start(tournament.getId(), 1), TournamentErrorCode.NOT_REGISTERING);
    }

    @Test
    void startNeedsTwoPlayers() {
        final Tournament tournament = service.create(1, "Cup", 4, null);

        assertConflict(() -> service.start(tournament.getId(), 1), TournamentErrorCode.NOT_ENOUGH_PLAYERS);
    }

    @Test
    void creatorLeavingCancelsTournament() {
        final Tournament tournament = registered(1, 2);

        service.leave(tournament.getId(), 1);

        assertThat(tournament.getStatus()).isEqualTo(TournamentStatus.CANCELLED);
        verify(connections).broadcast(eq(List.of(1L, 2L)), eq("tournament:cancelled"), any());
        assertThat(service.listActive()).isEmpty();
    }

    @Test
    void disconnectedPlayerLeavesRegisteringTournament() {
        final Tournament tournament = registered(1, 2, 3);

        eventBus.publish(new UserDisconnectedEvent(3));

        assertThat(tournament.getParticipants()).containsExactly(1L, 2L);
        verify(connections).broadcast(anyList(), eq("tournament:player-left"), any());
    }

    @Test
    void listActiveShowsOpenTournamentsInCreationOrder() {
        final Tournament first = service.create(1, "First", 4, null);
        final Tournament second = service.create(2, "Second", 4, null);
        final Tournament third = service.create(3, "Third", 4, null);
        service.leave(second.getId(), 2);

        final List<TournamentSummaryDto> active = service.listActive();

        assertThat(active).extracting(TournamentSummaryDto::getId).containsExactly(first.getId(), third.getId());
        assertThat(active.get(0).getStatus()).isEqualTo("registering");
        assertThat(active.get(0).getCurrentPlayers()).isEqualTo(1);
    }

    @Test
    void completedTournamentIsEvictedAfterRetention() {
        final Tournament tournament = registered(1, 2);
        service.start(tournament.getId(), 1);
        finish(launched.get(0), 2L);
        assertThat(tournament.getStatus()).isEqualTo(TournamentStatus.COMPLETED);

        assertThat(service.details(tournament.getId())).containsKey("players");

        capturedEviction().run();

        assertThat(service.find(tournament.getId())).isEmpty();
        assertConflict(() -> service.details(tournament.getId()), TournamentErrorCode.NOT_FOUND);
    }

    @Test
    void cancelledTournamentIsEvictedImmediatelyWhenSchedulerIsDown() {
        doThrow(new RejectedExecutionException("shut down")).when(scheduler)
                .schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        final Tournament tournament = registered(1, 2);

        service.leave(tournament.getId(), 1);

        assertThat(service.find(tournament.getId())).isEmpty();
    }

    @Test
    void creatorCancelsRunningTournament() {
        final Tournament tournament = registered(1, 2, 3, 4);
        service.start(tournament.getId(), 1);

        assertConflict(() -> service.cancelByCreator(tournament.getId(), 2), TournamentErrorCode.CANCEL_NOT_CREATOR);

        service.cancelByCreator(tournament.getId(), 1);

        assertThat(tournament.getStatus()).isEqualTo(TournamentStatus.CANCELLED);
        verify(connections).broadcast(eq(List.of(1L, 2L, 3L, 4L)), eq("tournament:cancelled"),
                argThat(data -> "cancelled_by_creator".equals(((Map<?, ?>) data).get("reason"))));
        assertConflict(() -> service.cancelByCreator(tournament.getId(), 1), TournamentErrorCode.ALREADY_FINISHED);

        // 取消后打完的对局不再推进
        finish(launched.get(0), 1L);
        finish(launched.get(1), 2L);
        assertThat(launched).hasSize(2);
        verify(connections, times(0)).broadcast(anyList(), eq("tournament:match-completed"), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void bracketShowsRoundsAndRequesterMatches() {
        final Tournament tournament = registered(1, 2, 3);
        service.start(tournament.getId(), 1);

        final Map<String, Object> bracket = service.bracket(tournament.getId(), 3);

        final TournamentSummaryDto summary = (TournamentSummaryDto) bracket.get("tournament");
        assertThat(summary.getCurrentRound()).isEqualTo(1);
        assertThat(summary.getTotalRounds()).isEqualTo(2);

        final List<Map<String, Object>> rounds = (List<Map<String, Object>>) bracket.get("rounds");
        assertThat(rounds).hasSize(1);
        assertThat(rounds.get(0).get("roundName")).isEqualTo("Semi-Finals");
        final List<Map<String, Object>> matches = (List<Map<String, Object>>) rounds.get(0).get("matches");
        assertThat(matches).extracting(m -> m.get("status")).containsExactly("bye", "in_progress");
        assertThat(matches.get(0).get("player2")).isNull();
        assertThat(matches.get(1).get("gameId")).isEqualTo(launched.get(0).gameId());
        assertThat(matches.get(1).get("canSpectate")).isEqualTo(true);

        final List<Map<String, Object>> mine = (List<Map<String, Object>>) bracket.get("myMatches");
        assertThat(mine).hasSize(1);
        assertThat(mine.get(0).get("opponentId")).isEqualTo(2L);
        assertThat(mine.get(0).get("opponentName")).isEqualTo("Player 2");

        final List<Map<String, Object>> players = (List<Map<String, Object>>) bracket.get("players");
        assertThat(players).extracting(p -> p.get("seed")).containsExactly(1, 2, 3);
    }

    @Test
    @SuppressWarnings("unchecked")
    void matchEndingInsideCreateSessionCompletesTournamentOnce() {
        doAnswer(inv -> {
            final PlayerSlot p1 = inv.getArgument(0);
            final PlayerSlot p2 = inv.getArgument(1);
            final Consumer<GameResult> callback = inv.getArgument(3);
            callback.accept(new GameResult(100, GameOrigin.TOURNAMENT, p1.getUserId(), p2.getUserId(), null,
                    0, 0, GamePhase.CANCELLED, "internal_error", NOW, NOW));
            return sessionPool.get(0);
        }).when(sessionManager).createSession(any(PlayerSlot.class), any(PlayerSlot.class),
                eq(GameOrigin.TOURNAMENT), any());
        final Tournament tournament = registered(1, 2);

        service.start(tournament.getId(), 1);

        assertThat(tournament.getStatus()).isEqualTo(TournamentStatus.COMPLETED);
        assertThat(tournament.getWinnerId()).isEqualTo(1L);
        assertThat(tournament.getRounds()).hasSize(1);
        verify(resultRecorder, times(1)).recordTournament(eq(tournament), anyList());
        verify(connections, times(1)).broadcast(anyList(), eq("tournament:completed"), any());
    }
}
