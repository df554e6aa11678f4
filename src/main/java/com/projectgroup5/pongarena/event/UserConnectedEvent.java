package com.projectgroup5.pongarena.event;

/** 用户建立了新的连接（首次连接或重连） */
public class UserConnectedEvent {
    private final long userId;

    public UserConnectedEvent(long userId) {
        this.userId = userId;
    }

    public long getUserId() {
        return userId;
    }

    @Override
    public String toString() {
        return "UserConnectedEvent{userId=" + userId + "}";
    }
}
