package com.autoretry.core.retry;

/**
 * 호출 1건의 재시도 상태. 그 호출의 재시도 루프 안에서만 변경되고 끝나면 버려진다.
 * 한 호출의 시도는 순차적이라 동기화가 필요 없다.
 */
final class RetryState {

    private final int initialDelay;
    private final int maxBackoff;
    private int remainingAttempts;
    private int nextDelay;
    private int attempts;

    private RetryState(int remainingAttempts, int initialDelay, int maxBackoff) {
        this.remainingAttempts = remainingAttempts;
        this.initialDelay = initialDelay;
        this.maxBackoff = maxBackoff;
        this.nextDelay = initialDelay;
    }

    static RetryState start(RetryOptions options) {
        return new RetryState(options.getMaxRetryAttempts(),
                options.getInitialDelaySeconds(), options.getMaxBackoffSeconds());
    }

    int remainingAttempts() { return remainingAttempts; }

    /** 다음 5xx 백오프 대기(초) */
    int nextDelay() { return nextDelay; }

    /** 지금까지 호출한 횟수 */
    int attempts() { return attempts; }

    void recordAttempt() { attempts++; }

    /** 백오프 대기 후: 두 배, 상한 적용 */
    void escalateDelay() {
        nextDelay = (int) Math.min((long) nextDelay * 2, maxBackoff);
    }

    /** retry_after 대기 후: 초기값으로 */
    void resetDelay() {
        nextDelay = initialDelay;
    }

    /**
     * 실패한 시도 1회를 차감한다.
     * @return 방금 차감으로 예산이 바닥났으면(0 미만) true
     */
    boolean consumeAttempt() {
        return remainingAttempts-- <= 0;
    }
}
