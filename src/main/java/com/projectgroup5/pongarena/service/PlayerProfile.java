package com.projectgroup5.pongarena.service;

/** 玩家展示信息 */
public record PlayerProfile(long userId, String displayName, String avatar) {

    public static PlayerProfile fallback(long userId) {
        return new PlayerProfile(userId, "Player " + userId, null);
    }
}
