package com.autoretry.core.api;

import java.util.Objects;

/** 로컬(클라이언트 측) 실패. API 오류가 아니므로 재시도 대상이 아니다. */
public class ApiClientException extends RuntimeException {

    public enum Type {
        /** 요청이 최종적으로 실패(재시도 한도 초과 포함) */
        REQUEST_FAILED,
        /** 연결/타임아웃 등 전송 계층 오류 */
        TRANSPORT_ERROR,
        /** 요청 본문을 만들 수 없음 */
        INVALID_REQUEST,
        /** 응답을 해석할 수 없음 */
        INVALID_RESPONSE
    }

    private final Type type;

    public ApiClientException(Type type, String message) {
        this(type, message, null);
    }

    public ApiClientException(Type type, String message, Throwable cause) {
        super(message, cause);
        this.type = Objects.requireNonNull(type, "type");
    }

    public Type getType() { return type; }
}
