package com.autoretry.core.api;

import java.util.Objects;

/** 원격 Bot API 메서드 이름(값 객체). toString()은 메서드 이름 그대로. */
public final class ApiMethod {

    public static final ApiMethod GET_ME = new ApiMethod("getMe");
    public static final ApiMethod SEND_MESSAGE = new ApiMethod("sendMessage");
    public static final ApiMethod SEND_PHOTO = new ApiMethod("sendPhoto");
    public static final ApiMethod DELETE_MESSAGE = new ApiMethod("deleteMessage");

    private final String name;

    private ApiMethod(String name) {
        this.name = name;
    }

    public static ApiMethod of(String name) {
        Objects.requireNonNull(name, "name");
        String n = name.trim();
        if (n.isEmpty()) throw new IllegalArgumentException("method name must not be blank");
        return new ApiMethod(n);
    }

    public String getName() { return name; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ApiMethod other)) return false;
        return name.equals(other.name);
    }

    @Override
    public int hashCode() { return name.hashCode(); }

    @Override
    public String toString() { return name; }
}
