package com.autoretry.core.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * 원격 API 메서드를 한 번 호출한다.
 * 실패는 {@link ApiException}(API가 보고한 오류) 또는 그 밖의 예외로 완료된 future로 전달한다.
 */
@FunctionalInterface
public interface ApiCaller {
    CompletableFuture<JsonNode> call(ApiMethod method, Payload payload);
}
