package com.autoretry.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private final StructuredLog slog = StructuredLog.get(StructuredLogTest.class);
    private final ObjectMapper om = new ObjectMapper();

    @Test
    void rendersValidJsonLine() throws Exception {
        String line = slog.toJson(Level.INFO, "retry-wait", null,
                "method", "sendMessage", "seconds", 3, "quoted", "a\"b\nc", "chatId", 1_000_000_000_000L, "missing", null);

        JsonNode n = om.readTree(line);
        assertThat(n.path("event").asText()).isEqualTo("retry-wait");
        assertThat(n.path("comp").asText()).isEqualTo("StructuredLogTest");
        assertThat(n.path("lvl").asText()).isEqualTo("INFO");
        assertThat(n.path("seconds").isInt()).isTrue();
        assertThat(n.path("quoted").asText()).isEqualTo("a\"b\nc");
        assertThat(n.path("chatId").asLong()).isEqualTo(1_000_000_000_000L);
        assertThat(n.get("missing").isNull()).isTrue();
    }

    @Test
    void flagsOddKeyValueCount_andAddsError() throws Exception {
        String line = slog.toJson(Level.WARNING, "x", new IllegalStateException("bad"), "lonely");

        JsonNode n = om.readTree(line);
        assertThat(n.path("_kv_mismatch").asBoolean()).isTrue();
        assertThat(n.path("error").asText()).isEqualTo("IllegalStateException");
        assertThat(n.path("message").asText()).isEqualTo("bad");
    }
}
