package com.autoretry.core.api;

/** 재시도 예산을 모두 소진했을 때. cause는 마지막 API 오류. */
public class RetryLimitExceededException extends ApiClientException {

    private final ApiMethod method;
    private final int attempts;

    public RetryLimitExceededException(ApiMethod method, int attempts, ApiException lastError) {
        super(Type.REQUEST_FAILED, "Retry limit exceeded for '" + method + "' after " + attempts + " attempts", lastError);
        this.method = method;
        this.attempts = attempts;
    }

    public ApiMethod getMethod() { return method; }

    /** 실제 호출 횟수(최초 호출 포함) */
    public int getAttempts() { return attempts; }

    public ApiException getLastError() { return (ApiException) getCause(); }
}
