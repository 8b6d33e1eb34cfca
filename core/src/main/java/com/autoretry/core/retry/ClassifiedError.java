package com.autoretry.core.retry;

import com.autoretry.core.api.ApiException;

/**
 * 분류된 실패.
 *
 * @param kind              분류
 * @param cause             래퍼를 벗긴 원래 예외
 * @param apiError          API 오류면 그 예외, 아니면 null
 * @param retryAfterSeconds RATE_LIMITED일 때만 의미 있음
 */
public record ClassifiedError(ErrorKind kind, Throwable cause, ApiException apiError, int retryAfterSeconds) {

    public boolean isApiError() { return apiError != null; }

    /** 5xx 여부(분류가 RATE_LIMITED여도 코드 기준으로 판단) */
    public boolean isServerCode() { return apiError != null && apiError.isServerError(); }
}
