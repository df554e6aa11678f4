package com.projectgroup5.pongarena.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 连接注册表 - userId 到当前连接的映射，每个用户最多一个实时连接
 * 所有出站消息都经过这里，格式为 {"event": ..., "data": ...}
 * 发送失败只记日志，不向调用方抛出
 */
@Component
public class ConnectionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    // userId -> Connection
    private final Map<Long, Connection> connections = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ConnectionRegistry(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * 注册新连接；同一用户已有连接时，旧连接收到 session-superseded 后被关闭
     */
    public Connection register(long userId, WebSocketSession session) {
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(
                session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        Connection fresh = new Connection(userId, decorated, clock.instant());
        Connection previous = connections.put(userId, fresh);

        if (previous != null && !previous.getSessionId().equals(fresh.getSessionId())) {
            logger.info("User {} connected again, closing previous session {}", userId, previous.getSessionId());
            send(previous, frame("session-superseded",
                    Map.of("message", "Signed in from another connection")));
            try {
                previous.close(CloseStatus.POLICY_VIOLATION.withReason("Session superseded"));
            } catch (IOException e) {
                logger.warn("Failed to close superseded session {}", previous.getSessionId(), e);
            }
        }
        logger.info("User {} connected (session {})", userId, fresh.getSessionId());
        return fresh;
    }

    /**
     * 只有当 sessionId 仍是该用户的当前连接时才移除；返回是否真的有用户离线
     */
    public boolean unregister(long userId, String sessionId) {
        Connection current = connections.get(userId);
        if (current == null || !current.getSessionId().equals(sessionId)) {
            return false;
        }
        boolean removed = connections.remove(userId, current);
        if (removed) {
            logger.info("User {} disconnected (session {})", userId, sessionId);
        }
        return removed;
    }

    // ==================== 发送 ====================

    public void unicast(long userId, String event, Object data) {
        Connection connection = connections.get(userId);
        if (connection == null) {
            logger.debug("Drop {} for offline user {}", event, userId);
            return;
        }
        TextMessage message = frame(event, data);
        if (message != null) {
            send(connection, message);
        }
    }

    /** 同一帧只序列化一次 */
    public void broadcast(Collection<Long> userIds, String event, Object data) {
        if (userIds.isEmpty()) {
            return;
        }
        TextMessage message = frame(event, data);
        if (message == null) {
            return;
        }
        for (Long userId : userIds) {
            Connection connection = connections.get(userId);
            if (connection != null) {
                send(connection, message);
            }
        }
    }

    public void broadcastAll(String event, Object data) {
        broadcast(connections.keySet(), event, data);
    }

    public boolean isConnected(long userId) {
        Connection connection = connections.get(userId);
        return connection != null && connection.isOpen();
    }

    public Set<Long> connectedUsers() {
        return connections.values().stream()
                .filter(Connection::isOpen)
                .map(Connection::getUserId)
                .collect(Collectors.toSet());
    }

    private TextMessage frame(String event, Object data) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("event", event);
        frame.put("data", data);
        try {
            return new TextMessage(objectMapper.writeValueAsString(frame));
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize {} frame", event, e);
            return null;
        }
    }

    private void send(Connection connection, TextMessage message) {
        if (message == null || !connection.isOpen()) {
            return;
        }
        try {
            connection.send(message);
        } catch (IOException | SessionLimitExceededException e) {
            logger.warn("Failed to send message to user {}", connection.getUserId(), e);
        }
    }
}
