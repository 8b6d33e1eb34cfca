package com.autoretry.example;

import com.autoretry.core.api.ApiException;
import com.autoretry.core.api.ApiMethod;
import com.autoretry.core.api.ApiPipeline;
import com.autoretry.core.api.Payload;
import com.autoretry.core.api.RetryLimitExceededException;
import com.autoretry.core.http.HttpApiCaller;
import com.autoretry.core.model.ClientConfig;
import com.autoretry.core.retry.AutoRetry;
import com.autoretry.core.retry.RetryOptions;
import com.autoretry.core.util.DefaultSleeper;
import com.autoretry.core.util.Sleeper;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

class FakeBotApiServerIntegrationTest {

    private static final String TOKEN = "42:TEST";

    /** retry_after 1초를 100ms로 줄여 기다린다 */
    private static final Sleeper FAST = d -> DefaultSleeper.INSTANCE.sleep(d.dividedBy(10));

    private FakeBotApiServer server;

    @AfterEach
    void tearDown() {
        if (server != null) server.close();
    }

    private ApiPipeline pipeline(String token, RetryOptions options) {
        ClientConfig cfg = ClientConfig.defaults()
                .setBaseUrl(server.baseUrl())
                .setToken(token)
                .setTimeoutMs(5000);
        return new ApiPipeline(new HttpApiCaller(cfg)).use(new AutoRetry(options, FAST));
    }

    @Test
    void floodThroughRateLimit_allMessagesDelivered() throws Exception {
        server = new FakeBotApiServer(TOKEN, 5, 50, 1, 0).start(0);
        ApiPipeline pipeline = pipeline(TOKEN, RetryOptions.builder().maxRetryAttempts(20).build());

        AutoRetryExample.Summary summary = AutoRetryExample.spam(pipeline, "1001", 20);

        assertThat(summary.succeeded()).isEqualTo(20);
        assertThat(summary.failed()).isZero();
        assertThat(server.rateLimitedCount()).isPositive();
        assertThat(server.requestCount()).isEqualTo(20 + server.rateLimitedCount());
    }

    @Test
    void retryAfterAboveMaxDelay_surfacesRateLimitError() throws Exception {
        server = new FakeBotApiServer(TOKEN, 1, 60_000, 30, 0).start(0);
        ApiPipeline pipeline = pipeline(TOKEN, RetryOptions.builder().maxDelay(Duration.ofSeconds(10)).build());

        pipeline.call(ApiMethod.GET_ME, Payload.empty()).join(); // 창의 유일한 허용분
        Throwable t = catchThrowable(() -> pipeline.call(ApiMethod.GET_ME, Payload.empty()).get(5, TimeUnit.SECONDS));

        assertThat(t.getCause()).isInstanceOf(ApiException.class);
        ApiException api = (ApiException) t.getCause();
        assertThat(api.getCode()).isEqualTo(429);
        assertThat(api.getParameters().retryAfter()).isEqualTo(30);
        assertThat(server.requestCount()).isEqualTo(2);
    }

    @Test
    void serverErrors_areRetriedWithBackoff() throws Exception {
        server = new FakeBotApiServer(TOKEN, 100, 1000, 1, 2).start(0);
        ApiPipeline pipeline = pipeline(TOKEN, RetryOptions.builder()
                .initialDelaySeconds(1)
                .maxBackoffSeconds(2)
                .build());

        JsonNode first = pipeline.call(ApiMethod.GET_ME, Payload.empty()).get(5, TimeUnit.SECONDS);
        JsonNode second = pipeline.call(ApiMethod.GET_ME, Payload.empty()).get(5, TimeUnit.SECONDS);

        assertThat(first.path("username").asText()).isEqualTo("fake_bot");
        assertThat(second.path("is_bot").asBoolean()).isTrue();
        assertThat(server.serverErrorCount()).isEqualTo(1);
        assertThat(server.requestCount()).isEqualTo(3);
    }

    @Test
    void wrongToken_exhaustsBudgetWithoutWaiting() throws Exception {
        server = new FakeBotApiServer(TOKEN, 100).start(0);
        ApiPipeline pipeline = pipeline("42:WRONG", RetryOptions.builder().maxRetryAttempts(2).build());

        CompletableFuture<JsonNode> f = pipeline.call(ApiMethod.GET_ME, Payload.empty());
        Throwable t = catchThrowable(() -> f.get(5, TimeUnit.SECONDS));

        assertThat(t.getCause()).isInstanceOf(RetryLimitExceededException.class);
        RetryLimitExceededException ex = (RetryLimitExceededException) t.getCause();
        assertThat(ex.getMethod()).isEqualTo(ApiMethod.GET_ME);
        assertThat(ex.getLastError().getCode()).isEqualTo(401);
        assertThat(server.requestCount()).isEqualTo(3);
    }
}
