package com.projectgroup5.pongarena.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 握手鉴权：token 由账号服务签发并写入 auth_tokens 表，这里只负责校验
 */
@Service
public class AuthService implements CredentialVerifier {
    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    // key: token -> session（用户 + 过期时间），避免重连时反复查库
    private final Map<String, SessionInfo> tokenToSession = new ConcurrentHashMap<>();

    public AuthService(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public Optional<Long> resolveUserId(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Instant now = clock.instant();

        SessionInfo cached = tokenToSession.get(token);
        if (cached != null) {
            if (cached.getExpiresAt().isAfter(now)) {
                return Optional.of(cached.getUserId());
            }
            // 过期：清除缓存
            tokenToSession.remove(token);
            return Optional.empty();
        }

        Optional<SessionInfo> stored = findToken(token);
        if (stored.isEmpty() || !stored.get().getExpiresAt().isAfter(now)) {
            return Optional.empty();
        }
        tokenToSession.put(token, stored.get());
        return Optional.of(stored.get().getUserId());
    }

    private Optional<SessionInfo> findToken(String token) {
        String sql = "SELECT user_id, expires_at FROM auth_tokens WHERE token = ?";
        try {
            List<SessionInfo> rows = jdbcTemplate.query(sql,
                    (rs, rowNum) -> new SessionInfo(
                            rs.getLong("user_id"),
                            Instant.ofEpochMilli(rs.getLong("expires_at"))),
                    token);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            logger.error("Token lookup failed", e);
            return Optional.empty();
        }
    }

    // 简单的 session 信息
    private static class SessionInfo {
        private final long userId;
        private final Instant expiresAt;

        SessionInfo(long userId, Instant expiresAt) {
            this.userId = userId;
            this.expiresAt = expiresAt;
        }

        public long getUserId() {
            return userId;
        }

        public Instant getExpiresAt() {
            return expiresAt;
        }
    }
}
