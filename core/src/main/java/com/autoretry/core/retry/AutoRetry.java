package com.autoretry.core.retry;

import com.autoretry.core.api.ApiCaller;
import com.autoretry.core.api.ApiClientException;
import com.autoretry.core.api.ApiException;
import com.autoretry.core.api.ApiMethod;
import com.autoretry.core.api.Payload;
import com.autoretry.core.api.RetryLimitExceededException;
import com.autoretry.core.api.Transformer;
import com.autoretry.core.util.DefaultSleeper;
import com.autoretry.core.util.Sleeper;
import com.autoretry.core.util.StructuredLog;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * 실패한 API 호출을 자동으로 재시도하는 Transformer.
 *
 * <p>분류 규칙(실패 1회마다):
 * <ol>
 *   <li>API 오류가 아니면 그대로 던진다(재시도/차감 없음).</li>
 *   <li>5xx이고 rethrowServerErrors=true면 그대로 던진다.</li>
 *   <li>retry_after가 maxDelay를 넘으면 그대로 던진다.</li>
 *   <li>retry_after가 있으면 그만큼 기다리고 백오프를 초기값(3초)으로 되돌린다.</li>
 *   <li>5xx면 백오프만큼 기다리고 백오프를 두 배로(상한 1시간).</li>
 *   <li>그 밖의 API 오류는 기다리지 않는다.</li>
 * </ol>
 * 던지지 않은 실패마다 시도 1회를 차감하고, 예산(maxRetryAttempts)을 넘기면
 * {@link RetryLimitExceededException}으로 끝낸다. 즉 최대 maxRetryAttempts + 1번 호출한다.
 *
 * <p>대기는 {@link Sleeper}의 future로 이어 붙이므로 스레드를 막지 않는다.
 * 호출마다 독립된 {@link RetryState}를 쓰고 정책은 읽기 전용이라 한 인스턴스를 여러 호출이 동시에 써도 된다.
 *
 * <pre>{@code
 * ApiPipeline pipeline = new ApiPipeline(new HttpApiCaller(config));
 * pipeline.use(new AutoRetry(RetryOptions.builder()
 *         .maxRetryAttempts(5)
 *         .rethrowServerErrors(true)
 *         .loggingEnabled(true)
 *         .build()));
 * }</pre>
 */
public final class AutoRetry implements Transformer {

    private static final Logger LOG = LoggerFactory.getLogger(AutoRetry.class);
    private static final StructuredLog SLOG = StructuredLog.get(AutoRetry.class);

    private final RetryOptions options;
    private final Sleeper sleeper;

    public AutoRetry() {
        this(RetryOptions.defaults());
    }

    public AutoRetry(RetryOptions options) {
        this(options, DefaultSleeper.INSTANCE);
    }

    public AutoRetry(RetryOptions options, Sleeper sleeper) {
        this.options = Objects.requireNonNull(options, "options");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public RetryOptions getOptions() { return options; }

    @Override
    public CompletableFuture<JsonNode> transform(ApiCaller call, ApiMethod method, Payload payload) {
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(method, "method");
        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        new Loop(call, method, payload, result).run();
        return result;
    }

    /**
     * 호출 하나의 재시도 루프.
     * 시도와 대기가 이미 끝난 채로 돌아오면 while로 이어 돌고, 아직 진행 중일 때만 콜백으로 넘긴다.
     * 동기로 실패하는 caller라도 재시도 횟수만큼 스택이 쌓이지 않는다.
     */
    private final class Loop {
        private final ApiCaller call;
        private final ApiMethod method;
        private final Payload payload;
        private final RetryState state = RetryState.start(options);
        private final CompletableFuture<JsonNode> result;
        private ApiException lastError;

        Loop(ApiCaller call, ApiMethod method, Payload payload, CompletableFuture<JsonNode> result) {
            this.call = call;
            this.method = method;
            this.payload = payload;
            this.result = result;
        }

        void run() {
            while (!result.isDone()) {
                CompletableFuture<JsonNode> attempt = invoke();
                if (!attempt.isDone()) {
                    attempt.whenComplete((value, error) -> resumeAfter(settle(value, error)));
                    return;
                }
                CompletableFuture<Void> pause = attempt.handle(this::settle).join();
                if (pause == null) return;
                if (!pause.isDone() || pause.isCompletedExceptionally()) {
                    resumeAfter(pause);
                    return;
                }
                if (!consumeAttempt()) return;
            }
        }

        private CompletableFuture<JsonNode> invoke() {
            state.recordAttempt();
            CompletableFuture<JsonNode> f;
            try {
                f = call.call(method, payload);
            } catch (RuntimeException e) {
                // 동기 예외도 실패한 future와 똑같이 분류
                f = CompletableFuture.failedFuture(e);
            }
            if (f == null) {
                f = CompletableFuture.failedFuture(new ApiClientException(ApiClientException.Type.INVALID_RESPONSE,
                        "Caller returned no result for '" + method + "'"));
            }
            return f;
        }

        private void resumeAfter(CompletableFuture<Void> pause) {
            if (pause == null) return;
            pause.whenComplete((ignored, error) -> {
                if (error != null) {
                    result.completeExceptionally(ErrorClassifier.unwrap(error));
                } else if (consumeAttempt()) {
                    run();
                }
            });
        }

        /** 성공/전파면 result를 끝내고 null, 재시도면 그 전의 대기 future */
        private CompletableFuture<Void> settle(JsonNode value, Throwable error) {
            if (error == null) {
                result.complete(value);
                return null;
            }
            try {
                return recover(error);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                return null;
            }
        }

        private CompletableFuture<Void> recover(Throwable error) {
            ClassifiedError failure = ErrorClassifier.classify(error);
            if (!failure.isApiError()) {
                debugLog("Non API exception occurred (type: {}). Rethrowing...", failure.cause().getClass().getSimpleName());
                result.completeExceptionally(failure.cause());
                return null;
            }

            ApiException api = failure.apiError();
            lastError = api;
            debugLog("[Exception]: {} | {}", api.getCode(), api.getDescription());

            if (failure.isServerCode() && options.isRethrowServerErrors()) {
                debugLog("Internal server error (code: {}) on '{}'. Rethrowing since rethrowServerErrors=true", api.getCode(), method);
                event("retry-rethrow", method, "reason", "server-error", "code", api.getCode());
                result.completeExceptionally(api);
                return null;
            }

            switch (failure.kind()) {
                case RATE_LIMITED -> {
                    int retryAfter = failure.retryAfterSeconds();
                    if (options.exceedsMaxDelay(retryAfter)) {
                        debugLog("retry_after {}s for '{}' exceeds maxDelay {}s. Rethrowing...",
                                retryAfter, method, (long) options.maxDelaySeconds());
                        event("retry-rethrow", method, "reason", "max-delay", "retryAfter", retryAfter);
                        result.completeExceptionally(api);
                        return null;
                    }
                    debugLog("Hit rate limit, will retry '{}' after {} seconds", method, retryAfter);
                    event("retry-wait", method, "reason", "rate-limit", "seconds", retryAfter);
                    return sleeper.sleep(Duration.ofSeconds(retryAfter)).thenRun(state::resetDelay);
                }
                case SERVER_ERROR -> {
                    int delay = state.nextDelay();
                    debugLog("Internal server error, will retry '{}' after {} seconds", method, delay);
                    event("retry-wait", method, "reason", "server-error", "seconds", delay);
                    return sleeper.sleep(Duration.ofSeconds(delay)).thenRun(state::escalateDelay);
                }
                default -> {
                    return CompletableFuture.completedFuture(null);
                }
            }
        }

        /** 대기 뒤 시도 1회 차감. 예산을 다 썼으면 result를 실패로 끝내고 false */
        private boolean consumeAttempt() {
            if (!state.consumeAttempt()) return true;
            if (options.isLoggingEnabled()) {
                LOG.warn("[Auto-Retry] Max retry attempts reached for '{}' ({} calls)", method, state.attempts());
            }
            event("retry-exhausted", method, "attempts", state.attempts(), "code", lastError.getCode());
            result.completeExceptionally(new RetryLimitExceededException(method, state.attempts(), lastError));
            return false;
        }
    }

    private void debugLog(String format, Object... args) {
        if (options.isLoggingEnabled()) {
            LOG.info("[Auto-Retry] " + format, args);
        }
    }

    private void event(String event, ApiMethod method, Object... kvs) {
        if (!options.isLoggingEnabled()) return;
        Object[] all = new Object[kvs.length + 2];
        all[0] = "method";
        all[1] = method.getName();
        System.arraycopy(kvs, 0, all, 2, kvs.length);
        SLOG.info(event, all);
    }
}
