package com.projectgroup5.pongarena.event;

/**
 * 用户的连接断开，各组件按隐式离开处理
 * 同一用户重连导致旧连接被关闭时不会发布
 */
public class UserDisconnectedEvent {
    private final long userId;

    public UserDisconnectedEvent(long userId) {
        this.userId = userId;
    }

    public long getUserId() {
        return userId;
    }

    @Override
    public String toString() {
        return "UserDisconnectedEvent{userId=" + userId + "}";
    }
}
