package com.autoretry.core.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * AutoRetry 정책(생성 후 불변, 모든 호출이 읽기 전용으로 공유).
 *
 * <ul>
 *   <li>maxDelay: retry_after가 이 값을 넘으면 재시도하지 않고 오류를 그대로 던진다. 없으면 무제한</li>
 *   <li>maxRetryAttempts: 재시도 횟수(최초 호출 제외). 기본 3</li>
 *   <li>rethrowServerErrors: true면 5xx는 재시도 없이 바로 던진다. 기본 false</li>
 *   <li>loggingEnabled: 재시도 진단 로그. 기본 false</li>
 *   <li>initialDelaySeconds / maxBackoffSeconds: 5xx 지수 백오프 시작값(3초)과 상한(1시간)</li>
 * </ul>
 */
public final class RetryOptions {

    public static final int DEFAULT_MAX_RETRY_ATTEMPTS = 3;
    public static final int DEFAULT_INITIAL_DELAY_SECONDS = 3;
    public static final int DEFAULT_MAX_BACKOFF_SECONDS = 3600;

    private static final RetryOptions DEFAULTS = builder().build();

    private final Duration maxDelay;
    private final int maxRetryAttempts;
    private final boolean rethrowServerErrors;
    private final boolean loggingEnabled;
    private final int initialDelaySeconds;
    private final int maxBackoffSeconds;

    private RetryOptions(Builder b) {
        this.maxDelay = b.maxDelay;
        this.maxRetryAttempts = b.maxRetryAttempts;
        this.rethrowServerErrors = b.rethrowServerErrors;
        this.loggingEnabled = b.loggingEnabled;
        this.initialDelaySeconds = b.initialDelaySeconds;
        this.maxBackoffSeconds = b.maxBackoffSeconds;
    }

    public static RetryOptions defaults() { return DEFAULTS; }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .maxDelay(maxDelay)
                .maxRetryAttempts(maxRetryAttempts)
                .rethrowServerErrors(rethrowServerErrors)
                .loggingEnabled(loggingEnabled)
                .initialDelaySeconds(initialDelaySeconds)
                .maxBackoffSeconds(maxBackoffSeconds);
    }

    public Optional<Duration> getMaxDelay() { return Optional.ofNullable(maxDelay); }
    public int getMaxRetryAttempts() { return maxRetryAttempts; }
    public boolean isRethrowServerErrors() { return rethrowServerErrors; }
    public boolean isLoggingEnabled() { return loggingEnabled; }
    public int getInitialDelaySeconds() { return initialDelaySeconds; }
    public int getMaxBackoffSeconds() { return maxBackoffSeconds; }

    /** maxDelay(초, 소수점 버림). 미설정이면 +Infinity */
    public double maxDelaySeconds() {
        return (maxDelay == null) ? Double.POSITIVE_INFINITY : maxDelay.getSeconds();
    }

    /** retry_after가 허용 상한을 넘는가 */
    public boolean exceedsMaxDelay(int retryAfterSeconds) {
        return retryAfterSeconds > maxDelaySeconds();
    }

    @Override
    public String toString() {
        return "RetryOptions{maxDelay=" + maxDelay
                + ", maxRetryAttempts=" + maxRetryAttempts
                + ", rethrowServerErrors=" + rethrowServerErrors
                + ", loggingEnabled=" + loggingEnabled
                + ", backoff=" + initialDelaySeconds + ".." + maxBackoffSeconds + "s}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryOptions r)) return false;
        return maxRetryAttempts == r.maxRetryAttempts
                && rethrowServerErrors == r.rethrowServerErrors
                && loggingEnabled == r.loggingEnabled
                && initialDelaySeconds == r.initialDelaySeconds
                && maxBackoffSeconds == r.maxBackoffSeconds
                && Objects.equals(maxDelay, r.maxDelay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxDelay, maxRetryAttempts, rethrowServerErrors, loggingEnabled,
                initialDelaySeconds, maxBackoffSeconds);
    }

    public static final class Builder {
        private Duration maxDelay;
        private int maxRetryAttempts = DEFAULT_MAX_RETRY_ATTEMPTS;
        private boolean rethrowServerErrors = false;
        private boolean loggingEnabled = false;
        private int initialDelaySeconds = DEFAULT_INITIAL_DELAY_SECONDS;
        private int maxBackoffSeconds = DEFAULT_MAX_BACKOFF_SECONDS;

        private Builder() {}

        /** null이면 무제한 */
        public Builder maxDelay(Duration maxDelay) { this.maxDelay = maxDelay; return this; }
        public Builder maxRetryAttempts(int v) { this.maxRetryAttempts = v; return this; }
        public Builder rethrowServerErrors(boolean v) { this.rethrowServerErrors = v; return this; }
        public Builder loggingEnabled(boolean v) { this.loggingEnabled = v; return this; }
        public Builder initialDelaySeconds(int v) { this.initialDelaySeconds = v; return this; }
        public Builder maxBackoffSeconds(int v) { this.maxBackoffSeconds = v; return this; }

        public RetryOptions build() {
            if (maxDelay != null && maxDelay.isNegative())
                throw new IllegalArgumentException("maxDelay must be >= 0");
            if (maxRetryAttempts < 1)
                throw new IllegalArgumentException("maxRetryAttempts must be >= 1");
            if (initialDelaySeconds < 1)
                throw new IllegalArgumentException("initialDelaySeconds must be >= 1");
            if (maxBackoffSeconds < initialDelaySeconds)
                throw new IllegalArgumentException("maxBackoffSeconds must be >= initialDelaySeconds");
            if (maxBackoffSeconds > DEFAULT_MAX_BACKOFF_SECONDS)
                throw new IllegalArgumentException("maxBackoffSeconds must be <= " + DEFAULT_MAX_BACKOFF_SECONDS);
            return new RetryOptions(this);
        }
    }
}
