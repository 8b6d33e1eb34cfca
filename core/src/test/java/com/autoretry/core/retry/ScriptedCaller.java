package com.autoretry.core.retry;

import com.autoretry.core.api.ApiCaller;
import com.autoretry.core.api.ApiMethod;
import com.autoretry.core.api.Payload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 테스트용 caller: 미리 넣어둔 실패를 순서대로 돌려주고, 다 쓰면 fallback(기본: 성공 "ok")을 반복.
 */
class ScriptedCaller implements ApiCaller {
    private final Deque<RuntimeException> failures = new ArrayDeque<>();
    private RuntimeException always;
    final AtomicInteger calls = new AtomicInteger();

    ScriptedCaller failWith(RuntimeException e) {
        failures.add(e);
        return this;
    }

    ScriptedCaller failTimes(int n, RuntimeException e) {
        for (int i = 0; i < n; i++) failures.add(e);
        return this;
    }

    /** 매번 실패 */
    ScriptedCaller alwaysFail(RuntimeException e) {
        this.always = e;
        return this;
    }

    @Override
    public synchronized CompletableFuture<JsonNode> call(ApiMethod method, Payload payload) {
        calls.incrementAndGet();
        RuntimeException next = failures.poll();
        if (next == null) next = always;
        if (next != null) return CompletableFuture.failedFuture(next);
        return CompletableFuture.completedFuture(TextNode.valueOf("ok"));
    }
}
