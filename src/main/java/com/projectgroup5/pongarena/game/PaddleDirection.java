package com.projectgroup5.pongarena.game;

import java.util.Optional;

/**
 * 挡板移动方向（客户端协议：0=停止 1=上 2=下）
 */
public enum PaddleDirection {
    NONE(0, 0),
    UP(1, -1),
    DOWN(2, 1);

    private final int code;
    private final int sign;

    PaddleDirection(int code, int sign) {
        this.code = code;
        this.sign = sign;
    }

    public int getCode() {
        return code;
    }

    /** y 轴方向：向上为负 */
    public int getSign() {
        return sign;
    }

    public static Optional<PaddleDirection> fromCode(int code) {
        for (PaddleDirection direction : values()) {
            if (direction.code == code) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }
}
