package com.autoretry.core.http;

import com.autoretry.core.api.ApiCaller;
import com.autoretry.core.api.ApiClientException;
import com.autoretry.core.api.ApiMethod;
import com.autoretry.core.api.Payload;
import com.autoretry.core.model.ClientConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/** Bot API HTTP 전송: POST {baseUrl}/bot{token}/{method}, 본문은 payload JSON. */
public class HttpApiCaller implements ApiCaller {

    private static final Logger LOG = LoggerFactory.getLogger(HttpApiCaller.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        CompletableFuture<HttpResponse<String>> send(HttpRequest req);
    }

    private final ClientConfig config;
    private final HttpSender sender;
    private final ObjectMapper om;
    private final ApiResponseParser parser;

    public HttpApiCaller(ClientConfig config) {
        this(config, defaultSender(config));
    }

    /** 송신 훅 주입(테스트용) */
    public HttpApiCaller(ClientConfig config, HttpSender sender) {
        this.config = Objects.requireNonNull(config, "config");
        config.validateForHttp();
        this.sender = Objects.requireNonNull(sender, "sender");
        this.om = new ObjectMapper();
        this.parser = new ApiResponseParser(om);
    }

    private static HttpSender defaultSender(ClientConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(config.getTimeout())
                .build();
        return req -> client.sendAsync(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    @Override
    public CompletableFuture<JsonNode> call(ApiMethod method, Payload payload) {
        Objects.requireNonNull(method, "method");
        Payload p = (payload == null) ? Payload.empty() : payload;

        String body;
        try {
            body = om.writeValueAsString(p.asMap());
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new ApiClientException(ApiClientException.Type.INVALID_REQUEST,
                    "Cannot serialize payload for '" + method + "'", e));
        }

        HttpRequest req = HttpRequest.newBuilder(endpoint(method))
                .timeout(config.getTimeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();

        long start = System.nanoTime();
        return sender.send(req).handle((resp, error) -> {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            if (error != null) {
                Throwable cause = (error instanceof CompletionException && error.getCause() != null) ? error.getCause() : error;
                LOG.debug("HTTP {} failed after {}ms: {}", maskedEndpoint(method), elapsedMs, cause.toString());
                throw new ApiClientException(ApiClientException.Type.TRANSPORT_ERROR,
                        "Request to '" + method + "' failed: " + cause, cause);
            }
            LOG.debug("HTTP {} -> {} ({}ms)", maskedEndpoint(method), resp.statusCode(), elapsedMs);
            return parser.parse(method, resp.statusCode(), resp.body());
        });
    }

    URI endpoint(ApiMethod method) {
        return URI.create(config.getBaseUrl() + "/bot" + config.getToken() + "/" + method.getName());
    }

    /** 로그에 토큰이 남지 않도록 */
    String maskedEndpoint(ApiMethod method) {
        return config.getBaseUrl() + "/bot***/" + method.getName();
    }
}
