package com.projectgroup5.pongarena.websocket;

import com.projectgroup5.pongarena.event.EventBus;
import com.projectgroup5.pongarena.event.UserConnectedEvent;
import com.projectgroup5.pongarena.event.UserDisconnectedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;

/**
 * WebSocket 核心处理器
 * - 连接建立：注册到 ConnectionRegistry，发布 UserConnectedEvent
 * - 消息：交给 EventRouter
 * - 连接关闭：仍是当前连接时发布 UserDisconnectedEvent
 */
@Component
public class GameWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(GameWebSocketHandler.class);

    private final ConnectionRegistry connectionRegistry;
    private final EventRouter eventRouter;
    private final EventBus eventBus;

    public GameWebSocketHandler(ConnectionRegistry connectionRegistry,
                                EventRouter eventRouter,
                                EventBus eventBus) {
        this.connectionRegistry = connectionRegistry;
        this.eventRouter = eventRouter;
        this.eventBus = eventBus;
    }

    // ==================== 连接建立 / 关闭 ====================

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Long userId = userIdOf(session);
        if (userId == null) {
            logger.warn("WebSocket {} has no authenticated user, closing", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Unauthenticated"));
            return;
        }
        connectionRegistry.register(userId, session);
        connectionRegistry.unicast(userId, "connected", Map.of("userId", userId));
        eventBus.publish(new UserConnectedEvent(userId));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        Long userId = userIdOf(session);
        logger.info("WebSocket disconnected: {}, user: {}, status: {}", session.getId(), userId, status);
        if (userId != null && connectionRegistry.unregister(userId, session.getId())) {
            eventBus.publish(new UserDisconnectedEvent(userId));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        logger.warn("Transport error on WebSocket {}", session.getId(), exception);
    }

    // ==================== 消息分发 ====================

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        Long userId = userIdOf(session);
        if (userId == null) {
            return;
        }
        eventRouter.route(userId, message.getPayload());
    }

    private Long userIdOf(WebSocketSession session) {
        Object value = session.getAttributes().get(AuthHandshakeInterceptor.USER_ID_ATTRIBUTE);
        return value instanceof Long ? (Long) value : null;
    }
}
