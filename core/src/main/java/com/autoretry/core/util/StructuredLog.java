package com.autoretry.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 이벤트 로거(java.util.logging 위).
 * 사람이 읽는 로그는 slf4j, 수집/집계용 이벤트는 여기로 남긴다.
 * 예: {"ts":"...","lvl":"INFO","comp":"AutoRetry","event":"retry-wait","method":"sendMessage","seconds":3}
 */
public final class StructuredLog {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE, event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO, event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void warn (String event, Throwable t, Object... kvs) { log(Level.WARNING, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        jul.log(lvl, toJson(lvl, event, t, kvs));
    }

    /** kvs는 "key", value 쌍. 홀수 개면 _kv_mismatch=true */
    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode line = NODES.objectNode()
                .put("ts", Instant.now().toString())
                .put("lvl", lvl.getName())
                .put("comp", comp)
                .put("event", event);
        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                line.set(String.valueOf(kvs[i]), valueNode(kvs[i + 1]));
            }
            if (kvs.length % 2 == 1) line.put("_kv_mismatch", true);
        }
        if (t != null) {
            line.put("error", t.getClass().getSimpleName());
            line.put("message", t.getMessage());
        }
        return line.toString();
    }

    private static JsonNode valueNode(Object v) {
        if (v == null) return NODES.nullNode();
        if (v instanceof Integer i) return NODES.numberNode(i);
        if (v instanceof Long l) return NODES.numberNode(l);
        if (v instanceof Double d) return NODES.numberNode(d);
        if (v instanceof BigDecimal d) return NODES.numberNode(d);
        if (v instanceof BigInteger b) return NODES.numberNode(b);
        if (v instanceof Boolean b) return NODES.booleanNode(b);
        return NODES.textNode(String.valueOf(v));
    }
}
