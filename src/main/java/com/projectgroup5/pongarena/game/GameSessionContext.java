package com.projectgroup5.pongarena.game;

import com.projectgroup5.pongarena.config.GameProperties;
import com.projectgroup5.pongarena.service.ProfileLookup;
import com.projectgroup5.pongarena.websocket.ConnectionRegistry;

import java.time.Clock;

/**
 * 所有对局共享的协作对象
 */
public record GameSessionContext(
        GameProperties properties,
        PhysicsEngine physics,
        ConnectionRegistry connections,
        ProfileLookup profiles,
        GameSessionListener listener,
        Clock clock) {
}
