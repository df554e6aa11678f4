package com.projectgroup5.pongarena.service;

import com.projectgroup5.pongarena.event.EventBus;
import com.projectgroup5.pongarena.event.UserDisconnectedEvent;
import com.projectgroup5.pongarena.game.AiDifficulty;
import com.projectgroup5.pongarena.game.GameOrigin;
import com.projectgroup5.pongarena.game.GameSession;
import com.projectgroup5.pongarena.game.GameSessionManager;
import com.projectgroup5.pongarena.game.PlayerSlot;
import com.projectgroup5.pongarena.websocket.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 匹配队列 + 私人房间 / AI 对局的创建入口
 * 队列按入队顺序（先到先配），配对和建局在同一个临界区内完成
 */
@Service
public class MatchmakingService {
    private static final Logger logger = LoggerFactory.getLogger(MatchmakingService.class);

    // 队列项
    public static class QueueEntry {
        public final long userId;
        public final Instant enqueuedAt;
        public final long sequence;       // 同一时刻入队时的先后

        QueueEntry(long userId, Instant enqueuedAt, long sequence) {
            this.userId = userId;
            this.enqueuedAt = enqueuedAt;
            this.sequence = sequence;
        }
    }

    /**
     * 入队结果：要么配对成功拿到对局，要么在队列中排在 position
     */
    public static class EnqueueResult {
        private final GameSession session;
        private final int position;

        private EnqueueResult(GameSession session, int position) {
            this.session = session;
            this.position = position;
        }

        public static EnqueueResult matched(GameSession session) {
            return new EnqueueResult(session, 0);
        }

        public static EnqueueResult queued(int position) {
            return new EnqueueResult(null, position);
        }

        public boolean isMatched() {
            return session != null;
        }

        public GameSession getSession() {
            return session;
        }

        public int getPosition() {
            return position;
        }
    }

    // guarded by this
    private final Deque<QueueEntry> queue = new ArrayDeque<>();
    private long sequence = 0;

    private final GameSessionManager sessionManager;
    private final ConnectionRegistry connections;
    private final ProfileLookup profiles;
    private final Clock clock;

    public MatchmakingService(GameSessionManager sessionManager,
                              ConnectionRegistry connections,
                              ProfileLookup profiles,
                              Clock clock,
                              EventBus eventBus) {
        this.sessionManager = sessionManager;
        this.connections = connections;
        this.profiles = profiles;
        this.clock = clock;

        eventBus.subscribe(UserDisconnectedEvent.class, event -> {
            if (cancel(event.getUserId())) {
                logger.info("User {} removed from matchmaking queue on disconnect", event.getUserId());
            }
        });
    }

    // ==================== 匹配队列 ====================

    /**
     * 入队；队列里有人时取最早的一位与新来者建局（先到者为 player1）
     */
    public synchronized EnqueueResult enqueue(long userId) {
        if (isQueued(userId)) {
            throw new GameConflictException(GameErrorCode.ALREADY_QUEUED);
        }
        if (sessionManager.isInSession(userId)) {
            throw new GameConflictException(GameErrorCode.ALREADY_IN_SESSION);
        }

        QueueEntry opponent;
        while ((opponent = queue.pollFirst()) != null) {
            if (sessionManager.isInSession(opponent.userId)) {
                // 排队期间已经进入别的对局，丢弃
                logger.info("Dropping stale queue entry for user {}", opponent.userId);
                continue;
            }
            GameSession session;
            try {
                session = sessionManager.createSession(
                        PlayerSlot.human(opponent.userId), PlayerSlot.human(userId), GameOrigin.MATCHMAKING, null);
            } catch (RuntimeException e) {
                // 建局失败时对手保持队首位置
                queue.addFirst(opponent);
                throw e;
            }
            logger.info("Matched user {} with user {} in game {}", opponent.userId, userId, session.getId());
            return EnqueueResult.matched(session);
        }

        queue.addLast(new QueueEntry(userId, clock.instant(), sequence++));
        logger.info("User {} queued for matchmaking, position {}", userId, queue.size());
        return EnqueueResult.queued(queue.size());
    }

    /**
     * 退出队列，返回是否确实在队列中
     */
    public synchronized boolean cancel(long userId) {
        return queue.removeIf(entry -> entry.userId == userId);
    }

    public synchronized boolean isQueued(long userId) {
        return queue.stream().anyMatch(entry -> entry.userId == userId);
    }

    public synchronized int queueSize() {
        return queue.size();
    }

    // ==================== 私人房间 / AI ====================

    public GameSession createPrivate(long userId) {
        cancel(userId);
        GameSession session = sessionManager.createSession(PlayerSlot.human(userId), null, GameOrigin.PRIVATE, null);
        logger.info("User {} created private game {}", userId, session.getId());
        return session;
    }

    public GameSession createAi(long userId, String difficulty) {
        AiDifficulty level = AiDifficulty.fromValue(difficulty);
        cancel(userId);
        GameSession session = sessionManager.createSession(
                PlayerSlot.human(userId), PlayerSlot.ai(level), GameOrigin.AI, null);
        logger.info("User {} started AI game {} ({})", userId, session.getId(), level.getValue());
        return session;
    }

    public GameSession joinPrivate(long userId, long gameId) {
        GameSession session = sessionManager.joinOpenSlot(gameId, userId);
        cancel(userId);
        return session;
    }

    /**
     * 创建私人房间并邀请目标用户加入
     */
    public GameSession invite(long inviterId, long targetUserId) {
        if (inviterId == targetUserId) {
            throw new GameConflictException(GameErrorCode.CANNOT_INVITE_SELF);
        }
        if (!connections.isConnected(targetUserId)) {
            throw new GameConflictException(GameErrorCode.TARGET_OFFLINE);
        }
        GameSession session = createPrivate(inviterId);

        Map<String, Object> invitation = new LinkedHashMap<>();
        invitation.put("from", inviterId);
        invitation.put("inviterName", profiles.findProfile(inviterId).displayName());
        invitation.put("gameId", session.getId());
        connections.unicast(targetUserId, "game-invitation", invitation);

        logger.info("User {} invited user {} to game {}", inviterId, targetUserId, session.getId());
        return session;
    }
}
