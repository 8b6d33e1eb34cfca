package com.autoretry.example;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 로컬 가짜 Bot API 서버(데모/통합 테스트용).
 * - /bot{token}/{method} 에 Bot API 봉투로 응답
 * - 창(window)당 burst 건까지만 허용, 나머지는 429 + retry_after
 * - serverErrorEvery > 0 이면 n번째 요청마다 500
 */
public final class FakeBotApiServer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FakeBotApiServer.class);

    private final String token;
    private final int burst;
    private final long windowMillis;
    private final int retryAfterSeconds;
    private final int serverErrorEvery;
    private final ObjectMapper om = new ObjectMapper();

    private final AtomicInteger requests = new AtomicInteger();
    private final AtomicInteger rateLimited = new AtomicInteger();
    private final AtomicInteger serverErrors = new AtomicInteger();
    private final AtomicLong messageIds = new AtomicLong();

    private long windowStart;
    private int inWindow;

    private HttpServer server;
    private ExecutorService executor;

    /** 초당 burst건, retry_after=1 */
    public FakeBotApiServer(String token, int burstPerSecond) {
        this(token, burstPerSecond, 1000, 1, 0);
    }

    public FakeBotApiServer(String token, int burst, long windowMillis, int retryAfterSeconds, int serverErrorEvery) {
        if (burst < 1) throw new IllegalArgumentException("burst must be >= 1");
        if (windowMillis < 1) throw new IllegalArgumentException("windowMillis must be >= 1");
        this.token = token;
        this.burst = burst;
        this.windowMillis = windowMillis;
        this.retryAfterSeconds = retryAfterSeconds;
        this.serverErrorEvery = serverErrorEvery;
    }

    /** port=0 이면 임의 포트 */
    public synchronized FakeBotApiServer start(int port) throws IOException {
        if (server != null) throw new IllegalStateException("already started");
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 0);
        server.createContext("/", this::handle);
        executor = Executors.newFixedThreadPool(8);
        server.setExecutor(executor);
        server.start();
        LOG.info("Fake Bot API on {} (burst={}/{}ms, retry_after={}s)", baseUrl(), burst, windowMillis, retryAfterSeconds);
        return this;
    }

    public int port() { return server.getAddress().getPort(); }

    public String baseUrl() { return "http://127.0.0.1:" + port(); }

    public int requestCount() { return requests.get(); }
    public int rateLimitedCount() { return rateLimited.get(); }
    public int serverErrorCount() { return serverErrors.get(); }

    @Override
    public synchronized void close() {
        if (server == null) return;
        server.stop(0);
        executor.shutdownNow();
        server = null;
    }

    private void handle(HttpExchange ex) throws IOException {
        try {
            int n = requests.incrementAndGet();
            String path = ex.getRequestURI().getPath();       // /bot<token>/<method>
            String prefix = "/bot" + token + "/";
            if (!path.startsWith(prefix)) {
                error(ex, 401, "Unauthorized", null);
                return;
            }
            String method = path.substring(prefix.length());

            if (!admit()) {
                rateLimited.incrementAndGet();
                error(ex, 429, "Too Many Requests: retry after " + retryAfterSeconds, retryAfterSeconds);
                return;
            }
            if (serverErrorEvery > 0 && n % serverErrorEvery == 0) {
                serverErrors.incrementAndGet();
                error(ex, 500, "Internal Server Error", null);
                return;
            }

            JsonNode body = readBody(ex);
            switch (method) {
                case "getMe" -> ok(ex, om.createObjectNode()
                        .put("id", 1L).put("is_bot", true).put("username", "fake_bot"));
                case "sendMessage" -> {
                    if (!body.hasNonNull("chat_id") || !body.hasNonNull("text")) {
                        error(ex, 400, "Bad Request: chat_id and text are required", null);
                        return;
                    }
                    ObjectNode msg = om.createObjectNode().put("message_id", messageIds.incrementAndGet());
                    msg.putObject("chat").set("id", body.get("chat_id"));
                    msg.set("text", body.get("text"));
                    ok(ex, msg);
                }
                default -> error(ex, 404, "Not Found: method not found", null);
            }
        } finally {
            ex.close();
        }
    }

    private synchronized boolean admit() {
        long now = System.currentTimeMillis();
        if (now - windowStart >= windowMillis) {
            windowStart = now;
            inWindow = 0;
        }
        return ++inWindow <= burst;
    }

    private JsonNode readBody(HttpExchange ex) throws IOException {
        try (InputStream in = ex.getRequestBody()) {
            byte[] bytes = in.readAllBytes();
            if (bytes.length == 0) return om.createObjectNode();
            return om.readTree(bytes);
        }
    }

    private void ok(HttpExchange ex, JsonNode result) throws IOException {
        ObjectNode env = om.createObjectNode().put("ok", true);
        env.set("result", result);
        send(ex, 200, env);
    }

    private void error(HttpExchange ex, int code, String description, Integer retryAfter) throws IOException {
        ObjectNode env = om.createObjectNode()
                .put("ok", false)
                .put("error_code", code)
                .put("description", description);
        if (retryAfter != null) env.putObject("parameters").put("retry_after", retryAfter);
        send(ex, code, env);
    }

    private void send(HttpExchange ex, int status, JsonNode env) throws IOException {
        byte[] b = om.writeValueAsString(env).getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        ex.sendResponseHeaders(status, b.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(b);
        }
    }
}
