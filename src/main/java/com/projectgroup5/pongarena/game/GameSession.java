package com.projectgroup5.pongarena.game;

import com.projectgroup5.pongarena.config.GameProperties;
import com.projectgroup5.pongarena.dto.ActiveGameDto;
import com.projectgroup5.pongarena.dto.GameUpdateDto;
import com.projectgroup5.pongarena.dto.PlayerInfoDto;
import com.projectgroup5.pongarena.service.PlayerProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 单个对局的完整状态（服务器权威）
 *
 * 数据流:
 * Client move → EventRouter → GameSessionManager → inbox →
 * tick（AI → 挡板 → 球 → 判分）→ game-update 快照 → ConnectionRegistry → Clients
 *
 * 除收件箱和观战列表外，所有状态只由 tick 线程修改
 */
public class GameSession {
    private static final Logger logger = LoggerFactory.getLogger(GameSession.class);

    static final String AI_DISPLAY_NAME = "AI Opponent";

    private final long id;
    private final GameOrigin origin;
    private final GameSessionContext context;
    private final GameProperties properties;
    private final Random random;
    private final Instant createdAt;

    private volatile PlayerSlot player1;
    private volatile PlayerSlot player2;      // WAITING 阶段为 null

    private final Ball ball = new Ball(PhysicsEngine.CENTER_X, PhysicsEngine.CENTER_Y);
    private final Paddle leftPaddle = new Paddle(PhysicsEngine.CENTER_Y - Paddle.HEIGHT / 2);
    private final Paddle rightPaddle = new Paddle(PhysicsEngine.CENTER_Y - Paddle.HEIGHT / 2);
    private AiController leftAi;
    private AiController rightAi;

    private volatile int player1Score = 0;
    private volatile int player2Score = 0;

    private volatile GamePhase phase = GamePhase.WAITING;
    private volatile Long winnerId;
    private volatile String endReason;
    private volatile Instant startedAt;
    private volatile Instant endedAt;

    // 指令收件箱：处理器只追加，tick 消费
    private final Queue<SessionCommand> inbox = new ConcurrentLinkedQueue<>();
    private final Set<Long> spectators = ConcurrentHashMap.newKeySet();
    private final Set<Long> disconnected = new HashSet<>();

    private int countdownTicksLeft;
    private int lastCountdownValue;
    private int pausedTicks;
    private long currentFrameNumber = 0;
    private boolean reported = false;

    public GameSession(long id, GameOrigin origin, PlayerSlot player1, PlayerSlot player2,
                       GameSessionContext context, Random random) {
        this.id = id;
        this.origin = origin;
        this.context = context;
        this.properties = context.properties();
        this.random = random;
        this.createdAt = context.clock().instant();
        this.player1 = player1;
        this.player2 = player2;
        this.leftAi = createAi(player1, true);
        this.rightAi = createAi(player2, false);
    }

    private AiController createAi(PlayerSlot slot, boolean leftSide) {
        if (slot == null || !slot.isAi()) {
            return null;
        }
        return new AiController(slot.getDifficulty(), leftSide, new Random(random.nextLong()));
    }

    // ==================== 生命周期（由 GameSessionManager 调用） ====================

    public boolean hasOpenSlot() {
        return player2 == null;
    }

    /**
     * 填入第二个席位，调用方负责加锁
     */
    public void fillOpenSlot(PlayerSlot slot) {
        if (phase != GamePhase.WAITING || player2 != null) {
            throw new IllegalStateException("Game " + id + " has no open slot");
        }
        this.player2 = slot;
        this.rightAi = createAi(slot, false);
    }

    /**
     * 两个席位就绪，进入倒计时，之后由 tick 驱动
     */
    public void beginCountdown() {
        if (phase != GamePhase.WAITING || player2 == null) {
            throw new IllegalStateException("Game " + id + " cannot start from " + phase);
        }
        phase = GamePhase.COUNTDOWN;
        countdownTicksLeft = properties.countdownTicks();
        lastCountdownValue = properties.countdownSeconds();

        Map<String, Object> starting = new LinkedHashMap<>();
        starting.put("gameId", id);
        starting.put("player1", playerInfo(player1));
        starting.put("player2", playerInfo(player2));
        starting.put("countdown", properties.countdownSeconds());
        context.connections().broadcast(audience(), "game-starting", starting);
        broadcastUpdate(lastCountdownValue);

        logger.info("Game {} countdown started: {} vs {}", id, player1, player2);
    }

    /**
     * WAITING 阶段的取消（房主离开 / 掉线），此时还没有 tick
     */
    public void cancelWhileWaiting(String reason) {
        if (phase != GamePhase.WAITING) {
            throw new IllegalStateException("Game " + id + " is not waiting");
        }
        end(GamePhase.CANCELLED, null, reason);
    }

    /**
     * tick 内部出错时由调度包装调用，只影响本局
     */
    public void abort(String reason) {
        if (phase.isTerminal()) {
            return;
        }
        end(GamePhase.CANCELLED, null, reason);
    }

    public void submit(SessionCommand command) {
        inbox.offer(command);
    }

    // ==================== 主循环 ====================

    /**
     * 一个固定步长的 tick，只能由本局的调度任务调用
     */
    public void tick() {
        if (phase.isTerminal()) {
            return;
        }
        drainInbox();

        switch (phase) {
            case COUNTDOWN:
                tickCountdown();
                break;
            case PLAYING:
                tickPlaying();
                break;
            case PAUSED:
                tickPaused();
                break;
            default:
                break;
        }
    }

    private void drainInbox() {
        SessionCommand command;
        while (!phase.isTerminal() && (command = inbox.poll()) != null) {
            apply(command);
        }
    }

    private void apply(SessionCommand command) {
        long userId = command.getUserId();
        Paddle paddle = paddleOf(userId);
        if (paddle == null) {
            logger.debug("Game {} ignoring {} from non-player", id, command);
            return;
        }

        switch (command.getType()) {
            case MOVE:
                if (phase.acceptsInput()) {
                    paddle.direction = command.getDirection();
                }
                break;
            case LEAVE:
                logger.info("Player {} left game {} during {}", userId, id, phase);
                forfeit(userId, "opponent_left");
                break;
            case DISCONNECT:
                handleDisconnect(userId);
                break;
            case RECONNECT:
                handleReconnect(userId);
                break;
            default:
                break;
        }
    }

    private void handleDisconnect(long userId) {
        if (phase == GamePhase.COUNTDOWN) {
            logger.info("Player {} disconnected during countdown of game {}", userId, id);
            forfeit(userId, "opponent_disconnected");
            return;
        }
        disconnected.add(userId);
        paddleOf(userId).direction = PaddleDirection.NONE;
        if (phase == GamePhase.PLAYING) {
            pause();
        }
    }

    private void handleReconnect(long userId) {
        if (!disconnected.remove(userId)) {
            return;
        }
        logger.info("Player {} reconnected to game {}", userId, id);
        context.connections().unicast(userId, "game:reconnected", snapshot(null));
        if (phase == GamePhase.PAUSED && disconnected.isEmpty()) {
            phase = GamePhase.PLAYING;
            logger.info("Game {} resumed", id);
            broadcastUpdate(null);
        }
    }

    private void tickCountdown() {
        countdownTicksLeft--;
        if (countdownTicksLeft <= 0) {
            startPlaying();
            return;
        }
        int value = (countdownTicksLeft + properties.tickRate() - 1) / properties.tickRate();
        if (value != lastCountdownValue) {
            lastCountdownValue = value;
            broadcastUpdate(value);
        }
    }

    private void startPlaying() {
        phase = GamePhase.PLAYING;
        startedAt = context.clock().instant();
        context.physics().serveBall(ball, random);

        // 倒计时结束时不在线的真人玩家按掉线处理
        for (PlayerSlot slot : List.of(player1, player2)) {
            if (!slot.isAi() && !context.connections().isConnected(slot.getUserId())) {
                disconnected.add(slot.getUserId());
            }
        }
        logger.info("Game {} started", id);
        if (!disconnected.isEmpty()) {
            pause();
        } else {
            broadcastUpdate(null);
        }
    }

    private void tickPlaying() {
        double dt = properties.deltaSeconds();
        PhysicsEngine physics = context.physics();

        // 1) AI 决策
        if (leftAi != null) {
            leftPaddle.direction = leftAi.decide(ball, leftPaddle, dt);
        }
        if (rightAi != null) {
            rightPaddle.direction = rightAi.decide(ball, rightPaddle, dt);
        }

        // 2) 挡板移动
        physics.movePaddle(leftPaddle, dt);
        physics.movePaddle(rightPaddle, dt);

        // 3) 球的运动与碰撞
        PhysicsEngine.Outcome outcome = physics.updateBall(ball, leftPaddle, rightPaddle, dt);

        // 4) 判分，得分后重新发球
        if (outcome != PhysicsEngine.Outcome.NONE) {
            if (outcome == PhysicsEngine.Outcome.PLAYER1_SCORED) {
                player1Score++;
            } else {
                player2Score++;
            }
            logger.debug("Game {} score {}-{}", id, player1Score, player2Score);
            physics.serveBall(ball, random);

            if (player1Score >= properties.winScore() || player2Score >= properties.winScore()) {
                broadcastUpdate(null);
                long winner = player1Score > player2Score ? player1.getUserId() : player2.getUserId();
                end(GamePhase.FINISHED, winner, "score_reached");
                return;
            }
        }

        // 5) 广播快照
        broadcastUpdate(null);
        currentFrameNumber++;
    }

    private void tickPaused() {
        pausedTicks++;
        if (pausedTicks < properties.reconnectGraceTicks()) {
            return;
        }
        Long remaining = null;
        for (PlayerSlot slot : List.of(player1, player2)) {
            if (!disconnected.contains(slot.getUserId())) {
                remaining = slot.getUserId();
                break;
            }
        }
        logger.info("Game {} reconnect grace expired, disconnected={}", id, disconnected);
        end(GamePhase.CANCELLED, remaining, "reconnect_timeout");
    }

    private void pause() {
        phase = GamePhase.PAUSED;
        pausedTicks = 0;
        leftPaddle.direction = PaddleDirection.NONE;
        rightPaddle.direction = PaddleDirection.NONE;

        Map<String, Object> notice = new LinkedHashMap<>();
        notice.put("gameId", id);
        notice.put("reconnectTimeoutMs", properties.reconnectGraceSeconds() * 1000L);
        List<Long> online = new ArrayList<>(audience());
        online.removeAll(disconnected);
        context.connections().broadcast(online, "game:opponent-disconnected", notice);
        broadcastUpdate(null);

        logger.info("Game {} paused, waiting for {}", id, disconnected);
    }

    private void forfeit(long leaverId, String reason) {
        PlayerSlot opponent = player1.isHuman(leaverId) ? player2 : player1;
        end(GamePhase.CANCELLED, opponent.getUserId(), reason);
    }

    private void end(GamePhase terminal, Long winner, String reason) {
        phase = terminal;
        winnerId = winner;
        endReason = reason;
        endedAt = context.clock().instant();

        if (terminal == GamePhase.FINISHED) {
            Map<String, Object> finalScore = new LinkedHashMap<>();
            finalScore.put("player1", player1Score);
            finalScore.put("player2", player2Score);
            Map<String, Object> ended = new LinkedHashMap<>();
            ended.put("gameId", id);
            ended.put("winnerId", winner);
            ended.put("finalScore", finalScore);
            context.connections().broadcast(audience(), "game-ended", ended);
        } else {
            Map<String, Object> cancelled = new LinkedHashMap<>();
            cancelled.put("gameId", id);
            cancelled.put("reason", reason);
            cancelled.put("winnerId", winner);
            context.connections().broadcast(audience(), "game-cancelled", cancelled);
        }
        logger.info("Game {} {} ({}), winner={}, score={}-{}",
                id, terminal.wireName(), reason, winner, player1Score, player2Score);

        if (!reported) {
            reported = true;
            context.listener().onSessionEnded(this);
        }
    }

    // ==================== 快照 / 广播 ====================

    public GameUpdateDto snapshot(Integer countdownValue) {
        GameUpdateDto dto = new GameUpdateDto();
        dto.setGameId(id);
        dto.setPaddleLeft(leftPaddle.y);
        dto.setPaddleRight(rightPaddle.y);
        dto.setBallX(ball.x);
        dto.setBallY(ball.y);
        dto.setPlayer1Score(player1Score);
        dto.setPlayer2Score(player2Score);
        dto.setStatus(phase.wireName());
        dto.setCountdownValue(countdownValue);
        return dto;
    }

    private void broadcastUpdate(Integer countdownValue) {
        context.connections().broadcast(audience(), "game-update", snapshot(countdownValue));
    }

    /** 真人玩家 + 观战者 */
    private Set<Long> audience() {
        Set<Long> targets = new HashSet<>(spectators);
        for (PlayerSlot slot : new PlayerSlot[]{player1, player2}) {
            if (slot != null && !slot.isAi()) {
                targets.add(slot.getUserId());
            }
        }
        return targets;
    }

    private PlayerInfoDto playerInfo(PlayerSlot slot) {
        if (slot.isAi()) {
            return new PlayerInfoDto(PlayerSlot.AI_PLAYER_ID, AI_DISPLAY_NAME, null, true);
        }
        PlayerProfile profile = context.profiles().findProfile(slot.getUserId());
        return new PlayerInfoDto(slot.getUserId(), profile.displayName(), profile.avatar(), false);
    }

    private Paddle paddleOf(long userId) {
        if (player1.isHuman(userId)) {
            return leftPaddle;
        }
        if (player2 != null && player2.isHuman(userId)) {
            return rightPaddle;
        }
        return null;
    }

    // ==================== 查询 ====================

    public boolean isParticipant(long userId) {
        return player1.isHuman(userId) || (player2 != null && player2.isHuman(userId));
    }

    public List<Long> humanPlayerIds() {
        List<Long> ids = new ArrayList<>(2);
        for (PlayerSlot slot : new PlayerSlot[]{player1, player2}) {
            if (slot != null && !slot.isAi()) {
                ids.add(slot.getUserId());
            }
        }
        return ids;
    }

    public void addSpectator(long userId) {
        spectators.add(userId);
    }

    public boolean removeSpectator(long userId) {
        return spectators.remove(userId);
    }

    /** 对局列表项，比分读的是 tick 线程最近写入的值 */
    public ActiveGameDto summary() {
        ActiveGameDto dto = new ActiveGameDto();
        dto.setGameId(id);
        dto.setPlayer1(playerInfo(player1));
        dto.setPlayer2(player2 != null ? playerInfo(player2) : null);
        dto.setPlayer1Score(player1Score);
        dto.setPlayer2Score(player2Score);
        dto.setOrigin(origin.name().toLowerCase());
        dto.setStatus(phase.wireName());
        dto.setSpectators(spectators.size());
        return dto;
    }

    public GameResult toResult() {
        return new GameResult(
                id,
                origin,
                player1.getUserId(),
                player2 != null ? player2.getUserId() : PlayerSlot.AI_PLAYER_ID,
                winnerId,
                player1Score,
                player2Score,
                phase,
                endReason,
                startedAt,
                endedAt
        );
    }

    public long getId() {
        return id;
    }

    public GameOrigin getOrigin() {
        return origin;
    }

    public PlayerSlot getPlayer1() {
        return player1;
    }

    public PlayerSlot getPlayer2() {
        return player2;
    }

    public GamePhase getPhase() {
        return phase;
    }

    public Long getWinnerId() {
        return winnerId;
    }

    public String getEndReason() {
        return endReason;
    }

    public int getPlayer1Score() {
        return player1Score;
    }

    public int getPlayer2Score() {
        return player2Score;
    }

    public Ball getBall() {
        return ball;
    }

    public Paddle getLeftPaddle() {
        return leftPaddle;
    }

    public Paddle getRightPaddle() {
        return rightPaddle;
    }

    public Set<Long> getSpectators() {
        return spectators;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public long getCurrentFrameNumber() {
        return currentFrameNumber;
    }
}
