package com.projectgroup5.pongarena.game;

/**
 * 投递到对局收件箱的指令，只在 tick 开始时被消费
 */
public final class SessionCommand {

    public enum Type {
        MOVE,
        LEAVE,
        DISCONNECT,
        RECONNECT
    }

    private final Type type;
    private final long userId;
    private final PaddleDirection direction;

    private SessionCommand(Type type, long userId, PaddleDirection direction) {
        this.type = type;
        this.userId = userId;
        this.direction = direction;
    }

    public static SessionCommand move(long userId, PaddleDirection direction) {
        return new SessionCommand(Type.MOVE, userId, direction);
    }

    public static SessionCommand leave(long userId) {
        return new SessionCommand(Type.LEAVE, userId, null);
    }

    public static SessionCommand disconnect(long userId) {
        return new SessionCommand(Type.DISCONNECT, userId, null);
    }

    public static SessionCommand reconnect(long userId) {
        return new SessionCommand(Type.RECONNECT, userId, null);
    }

    public Type getType() {
        return type;
    }

    public long getUserId() {
        return userId;
    }

    public PaddleDirection getDirection() {
        return direction;
    }

    @Override
    public String toString() {
        return type + "(user " + userId + (direction != null ? ", " + direction : "") + ")";
    }
}
