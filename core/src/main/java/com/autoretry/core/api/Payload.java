package com.autoretry.core.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** 메서드 호출 파라미터(불변, 입력 순서 유지). */
public final class Payload {

    private static final Payload EMPTY = new Payload(Map.of());

    private final Map<String, Object> params;

    private Payload(Map<String, Object> params) {
        this.params = params;
    }

    public static Payload empty() { return EMPTY; }

    public static Payload of(Map<String, ?> params) {
        if (params == null || params.isEmpty()) return EMPTY;
        Builder b = builder();
        params.forEach(b::put);
        return b.build();
    }

    public static Builder builder() { return new Builder(); }

    public Object get(String key) { return params.get(key); }

    public boolean isEmpty() { return params.isEmpty(); }

    /** 직렬화용 읽기 전용 뷰 */
    public Map<String, Object> asMap() { return params; }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Payload other && params.equals(other.params));
    }

    @Override
    public int hashCode() { return params.hashCode(); }

    @Override
    public String toString() { return "Payload" + params.keySet(); }

    public static final class Builder {
        private final Map<String, Object> params = new LinkedHashMap<>();

        private Builder() {}

        /** null 값은 무시(Bot API는 생략된 파라미터를 기본값으로 처리) */
        public Builder put(String key, Object value) {
            Objects.requireNonNull(key, "key");
            if (value != null) params.put(key, value);
            return this;
        }

        public Payload build() {
            if (params.isEmpty()) return EMPTY;
            return new Payload(Collections.unmodifiableMap(new LinkedHashMap<>(params)));
        }
    }
}
