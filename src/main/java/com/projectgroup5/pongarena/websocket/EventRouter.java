package com.projectgroup5.pongarena.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectgroup5.pongarena.game.AiDifficulty;
import com.projectgroup5.pongarena.game.GameSession;
import com.projectgroup5.pongarena.game.GameSessionManager;
import com.projectgroup5.pongarena.game.PaddleDirection;
import com.projectgroup5.pongarena.service.GameConflictException;
import com.projectgroup5.pongarena.service.MatchmakingService;
import com.projectgroup5.pongarena.service.TournamentConflictException;
import com.projectgroup5.pongarena.service.TournamentService;
import com.projectgroup5.pongarena.tournament.Tournament;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 入站事件分发 - 唯一的入口
 * 先按固定规则校验 data，通过后交给对应组件；校验失败的消息不会到达业务逻辑
 */
@Component
public class EventRouter {
    private static final Logger logger = LoggerFactory.getLogger(EventRouter.class);

    static final String INVALID_PAYLOAD = "Invalid payload";

    @FunctionalInterface
    interface EventHandler {
        void handle(long userId, JsonNode data);
    }

    private final Map<ClientEvent, EventHandler> handlers = new EnumMap<>(ClientEvent.class);

    private final ObjectMapper objectMapper;
    private final ConnectionRegistry connections;
    private final MatchmakingService matchmakingService;
    private final GameSessionManager sessionManager;
    private final TournamentService tournamentService;

    public EventRouter(ObjectMapper objectMapper,
                       ConnectionRegistry connections,
                       MatchmakingService matchmakingService,
                       GameSessionManager sessionManager,
                       TournamentService tournamentService) {
        this.objectMapper = objectMapper;
        this.connections = connections;
        this.matchmakingService = matchmakingService;
        this.sessionManager = sessionManager;
        this.tournamentService = tournamentService;

        handlers.put(ClientEvent.JOIN_MATCHMAKING, this::handleJoinMatchmaking);
        handlers.put(ClientEvent.LEAVE_MATCHMAKING, this::handleLeaveMatchmaking);
        handlers.put(ClientEvent.CREATE_PRIVATE, this::handleCreatePrivate);
        handlers.put(ClientEvent.JOIN_PRIVATE, this::handleJoinPrivate);
        handlers.put(ClientEvent.CREATE_AI, this::handleCreateAi);
        handlers.put(ClientEvent.MOVE, this::handleMove);
        handlers.put(ClientEvent.LEAVE_GAME, this::handleLeaveGame);
        handlers.put(ClientEvent.SEND_INVITATION, this::handleSendInvitation);
        handlers.put(ClientEvent.SPECTATE, this::handleSpectate);
        handlers.put(ClientEvent.GET_ACTIVE_GAMES, this::handleGetActiveGames);
        handlers.put(ClientEvent.CREATE_TOURNAMENT, this::handleCreateTournament);
        handlers.put(ClientEvent.JOIN_TOURNAMENT, this::handleJoinTournament);
        handlers.put(ClientEvent.LEAVE_TOURNAMENT, this::handleLeaveTournament);
        handlers.put(ClientEvent.START_TOURNAMENT, this::handleStartTournament);
        handlers.put(ClientEvent.CANCEL_TOURNAMENT, this::handleCancelTournament);
        handlers.put(ClientEvent.GET_TOURNAMENT, this::handleGetTournament);
        handlers.put(ClientEvent.GET_BRACKET, this::handleGetBracket);
        handlers.put(ClientEvent.LIST_ACTIVE_TOURNAMENTS, this::handleListActiveTournaments);
    }

    // ==================== 分发 ====================

    public void route(long userId, String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            logger.warn("Unparseable frame from user {}: {}", userId, e.getOriginalMessage());
            replyError(userId, "error", INVALID_PAYLOAD);
            return;
        }
        if (root == null || !root.isObject() || !root.path("event").isTextual()) {
            logger.warn("Frame without event name from user {}", userId);
            replyError(userId, "error", INVALID_PAYLOAD);
            return;
        }

        String name = root.get("event").textValue();
        Optional<ClientEvent> known = ClientEvent.fromWireName(name);
        if (known.isEmpty()) {
            logger.warn("Unknown event '{}' from user {}", name, userId);
            replyError(userId, "error", "Unknown event: " + name);
            return;
        }
        ClientEvent event = known.get();
        JsonNode data = root.get("data");

        try {
            event.getSchema().validate(data);
        } catch (PayloadValidationException e) {
            logger.warn("Invalid {} payload from user {}: {}", name, userId, e.getMessage());
            replyError(userId, event.errorEvent(), INVALID_PAYLOAD);
            return;
        }

        try {
            handlers.get(event).handle(userId, data);
        } catch (GameConflictException e) {
            logger.info("{} rejected for user {}: {}", name, userId, e.getCode());
            replyError(userId, event.errorEvent(), e.getMessage());
        } catch (TournamentConflictException e) {
            logger.info("{} rejected for user {}: {}", name, userId, e.getCode());
            replyError(userId, event.errorEvent(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Error handling {} from user {}", name, userId, e);
            replyError(userId, event.errorEvent(), "Internal error");
        }
    }

    private void replyError(long userId, String event, String message) {
        connections.unicast(userId, event, Map.of("message", message));
    }

    // ==================== 对局 ====================

    private void handleJoinMatchmaking(long userId, JsonNode data) {
        MatchmakingService.EnqueueResult result = matchmakingService.enqueue(userId);
        if (!result.isMatched()) {
            connections.unicast(userId, "game:queued", Map.of("position", result.getPosition()));
            return;
        }
        GameSession session = result.getSession();
        connections.unicast(session.getPlayer1().getUserId(), "game:joined",
                Map.of("gameId", session.getId(), "playerNumber", 1));
        connections.unicast(session.getPlayer2().getUserId(), "game:joined",
                Map.of("gameId", session.getId(), "playerNumber", 2));
    }

    private void handleLeaveMatchmaking(long userId, JsonNode data) {
        boolean removed = matchmakingService.cancel(userId);
        connections.unicast(userId, "game:matchmaking-cancelled", Map.of("removed", removed));
    }

    private void handleCreatePrivate(long userId, JsonNode data) {
        GameSession session = matchmakingService.createPrivate(userId);
        connections.unicast(userId, "game:created", Map.of("gameId", session.getId()));
    }

    private void handleJoinPrivate(long userId, JsonNode data) {
        GameSession session = matchmakingService.joinPrivate(userId, data.get("gameId").longValue());
        connections.unicast(userId, "game:joined", Map.of("gameId", session.getId(), "playerNumber", 2));
    }

    private void handleCreateAi(long userId, JsonNode data) {
        String difficulty = data != null && data.hasNonNull("difficulty") ? data.get("difficulty").textValue() : null;
        GameSession session = matchmakingService.createAi(userId, difficulty);
        connections.unicast(userId, "game:ai-created", Map.of(
                "gameId", session.getId(),
                "difficulty", session.getPlayer2().getDifficulty().getValue()));
    }

    private void handleMove(long userId, JsonNode data) {
        PaddleDirection direction = PaddleDirection.fromCode(data.get("direction").intValue())
                .orElseThrow(() -> new PayloadValidationException("direction out of range"));
        sessionManager.submitMove(userId, data.get("gameId").longValue(), direction);
    }

    private void handleLeaveGame(long userId, JsonNode data) {
        long gameId = sessionManager.leave(userId);
        connections.unicast(userId, "game:left", Map.of("gameId", gameId));
    }

    private void handleSendInvitation(long userId, JsonNode data) {
        GameSession session = matchmakingService.invite(userId, data.get("targetUserId").longValue());
        connections.unicast(userId, "game:invitation-sent", Map.of("gameId", session.getId()));
    }

    private void handleSpectate(long userId, JsonNode data) {
        GameSession session = sessionManager.spectate(userId, data.get("gameId").longValue());
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("gameId", session.getId());
        reply.put("state", session.snapshot(null));
        connections.unicast(userId, "game:spectating", reply);
    }

    private void handleGetActiveGames(long userId, JsonNode data) {
        connections.unicast(userId, "game:active-games", Map.of("games", sessionManager.listActive()));
    }

    // ==================== 锦标赛 ====================

    private void handleCreateTournament(long userId, JsonNode data) {
        String bracketType = data.hasNonNull("bracketType") ? data.get("bracketType").textValue() : null;
        long maxPlayers = data.get("maxPlayers").longValue();
        int size = maxPlayers > Integer.MAX_VALUE || maxPlayers < 0 ? -1 : (int) maxPlayers;
        // 创建结果通过 tournament:created 广播给所有在线用户（含创建者）
        tournamentService.create(userId, data.get("name").textValue(), size, bracketType);
    }

    private void handleJoinTournament(long userId, JsonNode data) {
        Tournament tournament = tournamentService.join(data.get("tournamentId").longValue(), userId);
        connections.unicast(userId, "tournament:joined",
                Map.of("tournament", tournamentService.summarize(tournament)));
    }

    private void handleLeaveTournament(long userId, JsonNode data) {
        long tournamentId = data.get("tournamentId").longValue();
        tournamentService.leave(tournamentId, userId);
        connections.unicast(userId, "tournament:left", Map.of("tournamentId", tournamentId));
    }

    private void handleStartTournament(long userId, JsonNode data) {
        tournamentService.start(data.get("tournamentId").longValue(), userId);
    }

    private void handleCancelTournament(long userId, JsonNode data) {
        // tournament:cancelled 广播给所有参赛者（含创建者）
        tournamentService.cancelByCreator(data.get("tournamentId").longValue(), userId);
    }

    private void handleGetTournament(long userId, JsonNode data) {
        connections.unicast(userId, "tournament:data", tournamentService.details(data.get("tournamentId").longValue()));
    }

    private void handleGetBracket(long userId, JsonNode data) {
        connections.unicast(userId, "tournament:bracket",
                Map.of("bracket", tournamentService.bracket(data.get("tournamentId").longValue(), userId)));
    }

    private void handleListActiveTournaments(long userId, JsonNode data) {
        connections.unicast(userId, "tournament:active-list",
                Map.of("tournaments", tournamentService.listActive()));
    }
}
