package com.projectgroup5.pongarena.websocket;

import java.util.Optional;

/**
 * 客户端 → 服务器事件及其 data 校验规则
 */
public enum ClientEvent {
    // ---------- 对局 ----------
    JOIN_MATCHMAKING("game:join-matchmaking", PayloadSchema.empty()),
    LEAVE_MATCHMAKING("game:leave-matchmaking", PayloadSchema.empty()),
    CREATE_PRIVATE("game:create-private", PayloadSchema.empty()),
    JOIN_PRIVATE("game:join-private", PayloadSchema.empty().requireInteger("gameId")),
    CREATE_AI("game:create-ai", PayloadSchema.empty().optionalText("difficulty")),
    MOVE("game:move", PayloadSchema.empty().requireInteger("gameId").requireDirection("direction")),
    LEAVE_GAME("game:leave", PayloadSchema.empty()),
    SEND_INVITATION("game:send-invitation", PayloadSchema.empty().requireInteger("targetUserId")),
    SPECTATE("game:spectate", PayloadSchema.empty().requireInteger("gameId")),
    GET_ACTIVE_GAMES("game:get-active", PayloadSchema.empty()),

    // ---------- 锦标赛 ----------
    CREATE_TOURNAMENT("tournament:create", PayloadSchema.empty()
            .requireText("name")
            .requireInteger("maxPlayers")
            .optionalText("bracketType")),
    JOIN_TOURNAMENT("tournament:join", PayloadSchema.empty().requireInteger("tournamentId")),
    LEAVE_TOURNAMENT("tournament:leave", PayloadSchema.empty().requireInteger("tournamentId")),
    START_TOURNAMENT("tournament:start", PayloadSchema.empty().requireInteger("tournamentId")),
    CANCEL_TOURNAMENT("tournament:cancel", PayloadSchema.empty().requireInteger("tournamentId")),
    GET_TOURNAMENT("tournament:get", PayloadSchema.empty().requireInteger("tournamentId")),
    GET_BRACKET("tournament:get-bracket", PayloadSchema.empty().requireInteger("tournamentId")),
    LIST_ACTIVE_TOURNAMENTS("tournament:list-active", PayloadSchema.empty());

    private static final String TOURNAMENT_PREFIX = "tournament:";

    private final String wireName;
    private final PayloadSchema schema;

    ClientEvent(String wireName, PayloadSchema schema) {
        this.wireName = wireName;
        this.schema = schema;
    }

    public static Optional<ClientEvent> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ClientEvent event : values()) {
            if (event.wireName.equals(name)) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }

    public String getWireName() {
        return wireName;
    }

    public PayloadSchema getSchema() {
        return schema;
    }

    /** 出错时回复的事件名：game:error 或 tournament:error */
    public String errorEvent() {
        return wireName.startsWith(TOURNAMENT_PREFIX) ? "tournament:error" : "game:error";
    }
}
