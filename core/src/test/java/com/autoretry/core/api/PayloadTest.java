package com.autoretry.core.api;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadTest {

    @Test
    void keepsInsertionOrderAndSkipsNulls() {
        Payload p = Payload.builder().put("chat_id", 1).put("reply_markup", null).put("text", "x").build();

        assertThat(p.asMap().keySet()).containsExactly("chat_id", "text");
        assertThat(p.get("text")).isEqualTo("x");
    }

    @Test
    void isImmutable() {
        Map<String, Object> src = new LinkedHashMap<>();
        src.put("a", 1);
        Payload p = Payload.of(src);
        src.put("b", 2);

        assertThat(p.asMap()).containsOnlyKeys("a");
        assertThatThrownBy(() -> p.asMap().put("c", 3)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void emptyPayloadsAreShared() {
        assertThat(Payload.of(Map.of())).isSameAs(Payload.empty());
        assertThat(Payload.builder().build().isEmpty()).isTrue();
    }

    @Test
    void methodNamesAreValues() {
        assertThat(ApiMethod.of(" sendMessage ")).isEqualTo(ApiMethod.SEND_MESSAGE);
        assertThat(ApiMethod.SEND_MESSAGE).hasToString("sendMessage");
        assertThatThrownBy(() -> ApiMethod.of("  ")).isInstanceOf(IllegalArgumentException.class);
    }
}
