package com.projectgroup5.pongarena.game;

import com.projectgroup5.pongarena.config.GameProperties;
import com.projectgroup5.pongarena.dto.ActiveGameDto;
import com.projectgroup5.pongarena.event.EventBus;
import com.projectgroup5.pongarena.event.UserConnectedEvent;
import com.projectgroup5.pongarena.event.UserDisconnectedEvent;
import com.projectgroup5.pongarena.service.GameConflictException;
import com.projectgroup5.pongarena.service.GameErrorCode;
import com.projectgroup5.pongarena.service.ProfileLookup;
import com.projectgroup5.pongarena.service.ResultRecorder;
import com.projectgroup5.pongarena.websocket.ConnectionRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 对局管理器 - 管理所有活跃对局及其 tick 任务
 * 每个对局一个固定频率任务，共享 gameLoopExecutor 线程池
 */
@Component
public class GameSessionManager implements GameSessionListener {
    private static final Logger logger = LoggerFactory.getLogger(GameSessionManager.class);

    // gameId -> GameSession
    private final Map<Long, GameSession> sessions = new ConcurrentHashMap<>();

    // userId -> gameId（只记录真人玩家，观战不算）
    private final Map<Long, Long> userToSession = new ConcurrentHashMap<>();

    // gameId -> tick 任务
    private final Map<Long, ScheduledFuture<?>> tickTasks = new ConcurrentHashMap<>();

    // gameId -> 结束回调（锦标赛用）
    private final Map<Long, Consumer<GameResult>> resultCallbacks = new ConcurrentHashMap<>();

    private final AtomicLong gameIdSequence = new AtomicLong(1);

    private final GameProperties properties;
    private final ScheduledExecutorService gameLoopExecutor;
    private final ResultRecorder resultRecorder;
    private final GameSessionContext context;
    private final Random seedSource = new Random();

    public GameSessionManager(GameProperties properties,
                              PhysicsEngine physicsEngine,
                              ConnectionRegistry connections,
                              ProfileLookup profiles,
                              ResultRecorder resultRecorder,
                              @Qualifier("gameLoopExecutor") ScheduledExecutorService gameLoopExecutor,
                              Clock clock,
                              EventBus eventBus) {
        this.properties = properties;
        this.gameLoopExecutor = gameLoopExecutor;
        this.resultRecorder = resultRecorder;
        this.context = new GameSessionContext(properties, physicsEngine, connections, profiles, this, clock);

        eventBus.subscribe(UserDisconnectedEvent.class, event -> onUserDisconnected(event.getUserId()));
        eventBus.subscribe(UserConnectedEvent.class, event -> onUserConnected(event.getUserId()));
    }

    // ==================== 创建 / 加入 ====================

    /**
     * 创建对局；player2 为 null 时对局停在 WAITING 等待加入，否则直接进入倒计时
     */
    public synchronized GameSession createSession(PlayerSlot player1, PlayerSlot player2,
                                                  GameOrigin origin, Consumer<GameResult> onResult) {
        ensureAvailable(player1);
        ensureAvailable(player2);

        long gameId = gameIdSequence.getAndIncrement();
        GameSession session = new GameSession(gameId, origin, player1, player2, context,
                new Random(seedSource.nextLong()));
        sessions.put(gameId, session);
        if (onResult != null) {
            resultCallbacks.put(gameId, onResult);
        }
        bindPlayers(session, player1, player2);

        logger.info("Created game {} ({}): {} vs {}", gameId, origin, player1,
                player2 != null ? player2 : "<open>");

        if (player2 != null) {
            start(session);
        }
        return session;
    }

    /**
     * 加入私人房间的空位
     */
    public synchronized GameSession joinOpenSlot(long gameId, long userId) {
        GameSession session = sessions.get(gameId);
        if (session == null || session.getPhase().isTerminal()) {
            throw new GameConflictException(GameErrorCode.GAME_NOT_FOUND);
        }
        if (session.isParticipant(userId)) {
            throw new GameConflictException(GameErrorCode.CANNOT_JOIN_OWN_GAME);
        }
        if (session.getPhase() != GamePhase.WAITING || !session.hasOpenSlot()) {
            throw new GameConflictException(GameErrorCode.GAME_FULL);
        }
        PlayerSlot joiner = PlayerSlot.human(userId);
        ensureAvailable(joiner);

        stopSpectating(userId);
        session.fillOpenSlot(joiner);
        userToSession.put(userId, gameId);
        logger.info("User {} joined game {}", userId, gameId);

        start(session);
        return session;
    }

    private void ensureAvailable(PlayerSlot slot) {
        if (slot != null && !slot.isAi() && userToSession.containsKey(slot.getUserId())) {
            throw new GameConflictException(GameErrorCode.ALREADY_IN_SESSION);
        }
    }

    private void bindPlayers(GameSession session, PlayerSlot... slots) {
        for (PlayerSlot slot : slots) {
            if (slot != null && !slot.isAi()) {
                stopSpectating(slot.getUserId());
                userToSession.put(slot.getUserId(), session.getId());
            }
        }
    }

    private void start(GameSession session) {
        session.beginCountdown();
        long period = properties.tickPeriodMicros();
        try {
            ScheduledFuture<?> task = gameLoopExecutor.scheduleAtFixedRate(
                    () -> runTick(session), period, period, TimeUnit.MICROSECONDS);
            if (task != null) {
                tickTasks.put(session.getId(), task);
                if (session.getPhase().isTerminal()) {
                    // 第一帧之前就已结束
                    tickTasks.remove(session.getId());
                    task.cancel(false);
                }
            }
        } catch (RejectedExecutionException e) {
            logger.error("Could not schedule tick for game {}", session.getId(), e);
            session.abort("internal_error");
        }
    }

    /** tick 包装：异常只取消当前对局 */
    private void runTick(GameSession session) {
        try {
            session.tick();
        } catch (RuntimeException e) {
            logger.error("Error processing game {}, cancelling it", session.getId(), e);
            session.abort("internal_error");
        }
    }

    // ==================== 指令 ====================

    public void submitMove(long userId, long gameId, PaddleDirection direction) {
        GameSession session = sessions.get(gameId);
        if (session == null) {
            throw new GameConflictException(GameErrorCode.GAME_NOT_FOUND);
        }
        if (!session.isParticipant(userId)) {
            throw new GameConflictException(GameErrorCode.NOT_A_PLAYER);
        }
        if (!session.getPhase().acceptsInput()) {
            throw new GameConflictException(GameErrorCode.GAME_NOT_ACTIVE);
        }
        session.submit(SessionCommand.move(userId, direction));
    }

    /**
     * 主动离开当前对局或停止观战，返回对局 id；映射立即解除，重复离开会得到 NOT_IN_GAME
     */
    public synchronized long leave(long userId) {
        Long gameId = userToSession.remove(userId);
        if (gameId == null) {
            Long watched = stopSpectating(userId);
            if (watched == null) {
                throw new GameConflictException(GameErrorCode.NOT_IN_GAME);
            }
            logger.info("User {} stopped spectating game {}", userId, watched);
            return watched;
        }
        GameSession session = sessions.get(gameId);
        if (session == null || session.getPhase().isTerminal()) {
            return gameId;
        }
        if (session.getPhase() == GamePhase.WAITING) {
            session.cancelWhileWaiting("host_left");
        } else {
            session.submit(SessionCommand.leave(userId));
        }
        return gameId;
    }

    public synchronized GameSession spectate(long userId, long gameId) {
        GameSession session = sessions.get(gameId);
        if (session == null) {
            throw new GameConflictException(GameErrorCode.GAME_NOT_FOUND);
        }
        if (session.getPhase().isTerminal() || session.getPhase() == GamePhase.WAITING) {
            throw new GameConflictException(GameErrorCode.GAME_NOT_ACTIVE);
        }
        if (session.isParticipant(userId) || userToSession.containsKey(userId)) {
            throw new GameConflictException(GameErrorCode.ALREADY_IN_SESSION);
        }
        // 同一时间只观战一局
        stopSpectating(userId);
        session.addSpectator(userId);
        logger.info("User {} is spectating game {}", userId, gameId);
        return session;
    }

    /** 返回被移除观战的对局 id，没有则为 null */
    private Long stopSpectating(long userId) {
        Long watched = null;
        for (GameSession session : sessions.values()) {
            if (session.removeSpectator(userId)) {
                watched = session.getId();
            }
        }
        return watched;
    }

    // ==================== 连接事件 ====================

    private synchronized void onUserDisconnected(long userId) {
        stopSpectating(userId);

        Long gameId = userToSession.get(userId);
        if (gameId == null) {
            return;
        }
        GameSession session = sessions.get(gameId);
        if (session == null || session.getPhase().isTerminal()) {
            return;
        }
        if (session.getPhase() == GamePhase.WAITING) {
            userToSession.remove(userId);
            session.cancelWhileWaiting("host_disconnected");
        } else {
            session.submit(SessionCommand.disconnect(userId));
        }
    }

    private void onUserConnected(long userId) {
        Long gameId = userToSession.get(userId);
        if (gameId == null) {
            return;
        }
        GameSession session = sessions.get(gameId);
        if (session != null && !session.getPhase().isTerminal()) {
            session.submit(SessionCommand.reconnect(userId));
        }
    }

    // ==================== 结束 / 清理 ====================

    /**
     * 对局终态回调：停止 tick，解除玩家映射，写结果，通知回调，延迟移除
     */
    @Override
    public void onSessionEnded(GameSession session) {
        long gameId = session.getId();
        ScheduledFuture<?> task = tickTasks.remove(gameId);
        if (task != null) {
            task.cancel(false);
        }
        for (Long userId : session.humanPlayerIds()) {
            userToSession.remove(userId, gameId);
        }

        GameResult result = session.toResult();
        if (result.phase() == GamePhase.FINISHED || result.hasWinner()) {
            resultRecorder.recordMatch(result);
        }

        Consumer<GameResult> callback = resultCallbacks.remove(gameId);
        if (callback != null) {
            try {
                callback.accept(result);
            } catch (RuntimeException e) {
                logger.error("Result callback failed for game {}", gameId, e);
            }
        }

        scheduleRemoval(gameId);
    }

    private void scheduleRemoval(long gameId) {
        try {
            gameLoopExecutor.schedule(() -> removeSession(gameId),
                    properties.cleanupDelaySeconds(), TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            // 线程池已关闭，直接移除
            removeSession(gameId);
        }
    }

    void removeSession(long gameId) {
        if (sessions.remove(gameId) != null) {
            logger.info("Removed game {}", gameId);
        }
    }

    @PreDestroy
    public void shutdown() {
        tickTasks.values().forEach(task -> task.cancel(false));
        tickTasks.clear();
        logger.info("Stopped {} game loops", sessions.size());
    }

    // ==================== 查询 ====================

    public Optional<GameSession> getSession(long gameId) {
        return Optional.ofNullable(sessions.get(gameId));
    }

    public Optional<Long> findSessionOf(long userId) {
        return Optional.ofNullable(userToSession.get(userId));
    }

    public boolean isInSession(long userId) {
        return userToSession.containsKey(userId);
    }

    public Collection<GameSession> getActiveSessions() {
        return sessions.values();
    }

    /**
     * 可观战的对局：已开始且未结束
     */
    public List<ActiveGameDto> listActive() {
        return sessions.values().stream()
                .filter(session -> !session.getPhase().isTerminal() && session.getPhase() != GamePhase.WAITING)
                .sorted(Comparator.comparingLong(GameSession::getId))
                .map(GameSession::summary)
                .collect(Collectors.toList());
    }
}
