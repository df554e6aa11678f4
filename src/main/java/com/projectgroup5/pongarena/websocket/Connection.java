package com.projectgroup5.pongarena.websocket;

import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Instant;

/**
 * 一个用户当前的实时连接
 * session 已包装为 ConcurrentWebSocketSessionDecorator，多线程发送安全且保持顺序
 */
public class Connection {
    private final long userId;
    private final WebSocketSession session;
    private final Instant connectedAt;

    public Connection(long userId, WebSocketSession session, Instant connectedAt) {
        this.userId = userId;
        this.session = session;
        this.connectedAt = connectedAt;
    }

    public boolean isOpen() {
        return session.isOpen();
    }

    public void send(TextMessage message) throws IOException {
        session.sendMessage(message);
    }

    public void close(CloseStatus status) throws IOException {
        session.close(status);
    }

    public long getUserId() {
        return userId;
    }

    public String getSessionId() {
        return session.getId();
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }
}
