package com.projectgroup5.pongarena.dao;

import com.projectgroup5.pongarena.service.PlayerProfile;
import com.projectgroup5.pongarena.service.ProfileLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 从 users 表读取展示名和头像；查不到或数据库异常时退回 "Player <id>"
 */
@Repository
public class JdbcProfileLookup implements ProfileLookup {
    private static final Logger logger = LoggerFactory.getLogger(JdbcProfileLookup.class);

    private final JdbcTemplate jdbcTemplate;

    public JdbcProfileLookup(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public PlayerProfile findProfile(long userId) {
        String sql = "SELECT id, username, avatar FROM users WHERE id = ?";
        try {
            List<PlayerProfile> rows = jdbcTemplate.query(sql,
                    (rs, rowNum) -> new PlayerProfile(
                            rs.getLong("id"),
                            rs.getString("username"),
                            rs.getString("avatar")),
                    userId);
            return rows.isEmpty() ? PlayerProfile.fallback(userId) : rows.get(0);
        } catch (DataAccessException e) {
            logger.warn("Profile lookup failed for user {}, using fallback", userId, e);
            return PlayerProfile.fallback(userId);
        }
    }
}
