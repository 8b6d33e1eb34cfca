package com.autoretry.core.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/** 송신 파이프라인 미들웨어. 다음 단계 caller를 받아 같은 시그니처로 감싼다. */
@FunctionalInterface
public interface Transformer {

    CompletableFuture<JsonNode> transform(ApiCaller call, ApiMethod method, Payload payload);

    /** next를 감싼 caller 반환 */
    default ApiCaller apply(ApiCaller next) {
        Objects.requireNonNull(next, "next");
        return (method, payload) -> transform(next, method, payload);
    }
}
