package com.projectgroup5.pongarena.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.projectgroup5.pongarena.game.PaddleDirection;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * 入站事件 data 字段的固定校验规则
 * 没有规则的事件忽略 data；只有可选字段时 data 可以缺省；其余情况 data 必须是 JSON 对象
 */
public final class PayloadSchema {

    private final List<Consumer<JsonNode>> rules = new ArrayList<>();
    private boolean hasRequired = false;

    private PayloadSchema() {
    }

    public static PayloadSchema empty() {
        return new PayloadSchema();
    }

    /** 整数（不接受小数和字符串） */
    public PayloadSchema requireInteger(String field) {
        hasRequired = true;
        rules.add(data -> {
            JsonNode node = data.get(field);
            if (node == null || !node.isIntegralNumber() || !node.canConvertToLong()) {
                throw new PayloadValidationException(field + " must be an integer");
            }
        });
        return this;
    }

    /** 方向码，只能是 0 / 1 / 2 */
    public PayloadSchema requireDirection(String field) {
        hasRequired = true;
        rules.add(data -> {
            JsonNode node = data.get(field);
            if (node == null || !node.isIntegralNumber() || !node.canConvertToInt()
                    || PaddleDirection.fromCode(node.intValue()).isEmpty()) {
                throw new PayloadValidationException(field + " must be 0, 1 or 2");
            }
        });
        return this;
    }

    /** 非空字符串 */
    public PayloadSchema requireText(String field) {
        hasRequired = true;
        rules.add(data -> {
            JsonNode node = data.get(field);
            if (node == null || !node.isTextual() || node.textValue().isBlank()) {
                throw new PayloadValidationException(field + " must be a non-blank string");
            }
        });
        return this;
    }

    /** 可缺省，出现时必须是字符串 */
    public PayloadSchema optionalText(String field) {
        rules.add(data -> {
            JsonNode node = data.get(field);
            if (node != null && !node.isNull() && !node.isTextual()) {
                throw new PayloadValidationException(field + " must be a string");
            }
        });
        return this;
    }

    public void validate(JsonNode data) {
        if (rules.isEmpty()) {
            return;
        }
        if ((data == null || data.isNull()) && !hasRequired) {
            return;
        }
        if (data == null || !data.isObject()) {
            throw new PayloadValidationException("data must be an object");
        }
        rules.forEach(rule -> rule.accept(data));
    }
}
