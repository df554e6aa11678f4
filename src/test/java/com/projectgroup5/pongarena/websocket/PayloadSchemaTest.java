package com.projectgroup5.pongarena.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadSchemaTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void schemaWithoutRulesIgnoresData() {
        assertThatCode(() -> ClientEvent.LEAVE_GAME.getSchema().validate(objectMapper.readTree("\"anything\"")))
                .doesNotThrowAnyException();
        assertThatCode(() -> ClientEvent.LEAVE_GAME.getSchema().validate(null)).doesNotThrowAnyException();
    }

    @Test
    void requiredFieldsNeedObject() {
        assertThatThrownBy(() -> ClientEvent.SPECTATE.getSchema().validate(null))
                .isInstanceOf(PayloadValidationException.class);
        assertThatThrownBy(() -> ClientEvent.SPECTATE.getSchema().validate(objectMapper.readTree("[1]")))
                .isInstanceOf(PayloadValidationException.class);
    }

    @Test
    void integersMustBeIntegral() {
        assertThatThrownBy(() -> ClientEvent.SPECTATE.getSchema().validate(objectMapper.readTree("{\"gameId\":1.5}")))
                .isInstanceOf(PayloadValidationException.class);
        assertThatCode(() -> ClientEvent.SPECTATE.getSchema().validate(objectMapper.readTree("{\"gameId\":15}")))
                .doesNotThrowAnyException();
    }

    @Test
    void optionalTextAllowsMissingData() {
        assertThatCode(() -> ClientEvent.CREATE_AI.getSchema().validate(null)).doesNotThrowAnyException();
        assertThatThrownBy(() -> ClientEvent.CREATE_AI.getSchema().validate(objectMapper.readTree("{\"difficulty\":3}")))
                .isInstanceOf(PayloadValidationException.class);
    }

    @Test
    void errorEventFollowsNamespace() {
        assertThat(ClientEvent.MOVE.errorEvent()).isEqualTo("game:error");
        assertThat(ClientEvent.START_TOURNAMENT.errorEvent()).isEqualTo("tournament:error");
    }
}
