package com.autoretry.core.model;

import com.autoretry.core.retry.RetryOptions;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * 클라이언트 설정 (autoretry.yml 매핑 대상). 순수 설정 보관용.
 * 재시도 정책은 {@link #toRetryOptions()}로 불변 객체로 굳혀서 쓴다.
 */
public final class ClientConfig {

    public static final String DEFAULT_BASE_URL = "https://api.telegram.org";

    /** YAML `retry:` 섹션 */
    public static final class RetryCfg {
        /** retry_after 허용 상한(초). null이면 무제한 */
        private Integer maxDelaySeconds;
        private int maxRetryAttempts = RetryOptions.DEFAULT_MAX_RETRY_ATTEMPTS;
        private boolean rethrowServerErrors = false;
        private boolean enableLogs = false;
        /** YAML `retry.backoff:` */
        private int initialDelaySeconds = RetryOptions.DEFAULT_INITIAL_DELAY_SECONDS;
        private int maxBackoffSeconds = RetryOptions.DEFAULT_MAX_BACKOFF_SECONDS;

        public Integer getMaxDelaySeconds() { return maxDelaySeconds; }
        public RetryCfg setMaxDelaySeconds(Integer v) { this.maxDelaySeconds = v; return this; }

        public int getMaxRetryAttempts() { return maxRetryAttempts; }
        public RetryCfg setMaxRetryAttempts(int v) { this.maxRetryAttempts = v; return this; }

        public boolean isRethrowServerErrors() { return rethrowServerErrors; }
        public RetryCfg setRethrowServerErrors(boolean v) { this.rethrowServerErrors = v; return this; }

        public boolean isEnableLogs() { return enableLogs; }
        public RetryCfg setEnableLogs(boolean v) { this.enableLogs = v; return this; }

        public int getInitialDelaySeconds() { return initialDelaySeconds; }
        public RetryCfg setInitialDelaySeconds(int v) { this.initialDelaySeconds = v; return this; }

        public int getMaxBackoffSeconds() { return maxBackoffSeconds; }
        public RetryCfg setMaxBackoffSeconds(int v) { this.maxBackoffSeconds = v; return this; }
    }

    // ---------- api ----------
    private String baseUrl = DEFAULT_BASE_URL;
    private String token;                              // 봇 토큰 (HTTP 전송 시 필수)
    private Duration timeout = Duration.ofSeconds(10); // 요청 타임아웃

    private RetryCfg retry = new RetryCfg();

    public static ClientConfig defaults() { return new ClientConfig(); }

    // ---------- getters ----------
    public String getBaseUrl() { return baseUrl; }
    public String getToken() { return token; }
    public Duration getTimeout() { return timeout; }
    public long getTimeoutMs() { return timeout.toMillis(); }
    public RetryCfg getRetry() { return retry; }

    // ---------- fluent setters ----------
    public ClientConfig setBaseUrl(String baseUrl) {
        this.baseUrl = (baseUrl == null || baseUrl.isBlank()) ? DEFAULT_BASE_URL : stripTrailingSlash(baseUrl.trim());
        return this;
    }
    public ClientConfig setToken(String token) { this.token = token; return this; }
    public ClientConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public ClientConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
    public ClientConfig setRetry(RetryCfg retry) { this.retry = (retry != null ? retry : new RetryCfg()); return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(baseUrl, "baseUrl");
        URI uri = URI.create(baseUrl);
        if (uri.getScheme() == null || uri.getHost() == null)
            throw new IllegalArgumentException("baseUrl must be an absolute http(s) URL: " + baseUrl);
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        Objects.requireNonNull(retry, "retry");
        if (retry.maxDelaySeconds != null && retry.maxDelaySeconds < 0)
            throw new IllegalArgumentException("retry.maxDelaySeconds must be >= 0");
        toRetryOptions(); // 나머지 retry 값은 RetryOptions 규칙으로 검증
    }

    /** 토큰까지 요구(HTTP 전송용) */
    public void validateForHttp() {
        validate();
        if (token == null || token.isBlank()) throw new IllegalArgumentException("token is required");
    }

    public RetryOptions toRetryOptions() {
        return RetryOptions.builder()
                .maxDelay(retry.maxDelaySeconds == null ? null : Duration.ofSeconds(retry.maxDelaySeconds))
                .maxRetryAttempts(retry.maxRetryAttempts)
                .rethrowServerErrors(retry.rethrowServerErrors)
                .loggingEnabled(retry.enableLogs)
                .initialDelaySeconds(retry.initialDelaySeconds)
                .maxBackoffSeconds(retry.maxBackoffSeconds)
                .build();
    }

    private static String stripTrailingSlash(String s) {
        String r = s;
        while (r.endsWith("/")) r = r.substring(0, r.length() - 1);
        return r;
    }
}
