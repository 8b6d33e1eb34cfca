package com.autoretry.example;

import com.autoretry.core.api.ApiMethod;
import com.autoretry.core.api.ApiPipeline;
import com.autoretry.core.api.Payload;
import com.autoretry.core.http.HttpApiCaller;
import com.autoretry.core.model.ClientConfig;
import com.autoretry.core.retry.AutoRetry;
import com.autoretry.core.retry.ErrorClassifier;
import com.autoretry.core.util.YamlConfigLoader;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 데모: 150개의 sendMessage를 한꺼번에 보내 레이트 리밋에 걸리게 하고, AutoRetry가 전부 살려내는지 본다.
 * BOT_TOKEN, CHAT_ID 환경변수가 있으면 실제 Bot API로, 없으면 로컬 FakeBotApiServer로 보낸다.
 */
public final class AutoRetryExample {

    private static final Logger LOG = LoggerFactory.getLogger(AutoRetryExample.class);
    private static final String FAKE_TOKEN = "123456:FAKE";

    private AutoRetryExample() {}

    public record Summary(int succeeded, int failed) {}

    public static void main(String[] args) throws Exception {
        LogSetup.init(Path.of(System.getProperty("ar.out.dir", "out")).resolve("logs"));

        int count = (args.length > 0) ? Integer.parseInt(args[0]) : 150;
        ClientConfig cfg;
        if (Files.exists(Path.of(YamlConfigLoader.DEFAULT_FILE))) {
            cfg = YamlConfigLoader.loadDefault();
        } else {
            cfg = ClientConfig.defaults();
            cfg.getRetry().setEnableLogs(true);
        }

        String token = System.getenv("BOT_TOKEN");
        String chatId = System.getenv("CHAT_ID");
        FakeBotApiServer fake = null;
        try {
            if (token == null || chatId == null) {
                fake = new FakeBotApiServer(FAKE_TOKEN, 30).start(0);
                cfg.setBaseUrl(fake.baseUrl()).setToken(FAKE_TOKEN);
                chatId = "42";
            } else {
                cfg.setToken(token);
            }

            ApiPipeline pipeline = new ApiPipeline(new HttpApiCaller(cfg))
                    .use(new AutoRetry(cfg.toRetryOptions()));

            Summary s = spam(pipeline, chatId, count);
            LOG.info("Done: succeeded={}, failed={}", s.succeeded(), s.failed());
            if (fake != null) {
                LOG.info("Fake server saw {} requests ({} rate limited)", fake.requestCount(), fake.rateLimitedCount());
            }
        } finally {
            if (fake != null) fake.close();
        }
    }

    /** count개의 메시지를 동시에 보내고 모두 끝날 때까지 기다린다 */
    public static Summary spam(ApiPipeline pipeline, String chatId, int count) {
        AtomicInteger ok = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        List<CompletableFuture<JsonNode>> calls = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Payload p = Payload.builder().put("chat_id", chatId).put("text", "Hello " + i).build();
            final int n = i;
            calls.add(pipeline.call(ApiMethod.SEND_MESSAGE, p).whenComplete((r, e) -> {
                if (e == null) {
                    ok.incrementAndGet();
                } else {
                    failed.incrementAndGet();
                    LOG.warn("Message #{} failed: {}", n, ErrorClassifier.unwrap(e).toString());
                }
            }));
        }
        CompletableFuture.allOf(calls.toArray(new CompletableFuture<?>[0]))
                .exceptionally(e -> null)
                .join();
        return new Summary(ok.get(), failed.get());
    }
}
