package com.projectgroup5.pongarena.service;

/**
 * 查询玩家展示名 / 头像；查不到时返回 {@link PlayerProfile#fallback(long)}，不抛异常
 */
public interface ProfileLookup {

    PlayerProfile findProfile(long userId);
}
