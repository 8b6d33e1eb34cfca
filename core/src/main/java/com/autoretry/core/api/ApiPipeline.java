package com.autoretry.core.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * 송신 호출 파이프라인: transport 앞에 Transformer들을 설치한다.
 * 먼저 use()한 Transformer가 가장 바깥쪽(호출자 쪽)에서 동작한다.
 */
public final class ApiPipeline {

    private final ApiCaller transport;
    private final List<Transformer> transformers = new ArrayList<>();
    private volatile ApiCaller composed;

    public ApiPipeline(ApiCaller transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.composed = transport;
    }

    public synchronized ApiPipeline use(Transformer transformer) {
        transformers.add(Objects.requireNonNull(transformer, "transformer"));
        ApiCaller c = transport;
        for (int i = transformers.size() - 1; i >= 0; i--) {
            c = transformers.get(i).apply(c);
        }
        composed = c;
        return this;
    }

    public ApiCaller caller() { return composed; }

    public CompletableFuture<JsonNode> call(ApiMethod method, Payload payload) {
        Objects.requireNonNull(method, "method");
        return composed.call(method, payload == null ? Payload.empty() : payload);
    }

    public synchronized List<Transformer> getTransformers() { return List.copyOf(transformers); }
}
