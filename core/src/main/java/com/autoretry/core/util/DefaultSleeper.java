package com.autoretry.core.util;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/** CompletableFuture.delayedExecutor 기반. 대기 중 어떤 스레드도 점유하지 않는다. */
public final class DefaultSleeper implements Sleeper {

    public static final DefaultSleeper INSTANCE = new DefaultSleeper();

    @Override
    public CompletableFuture<Void> sleep(Duration d) {
        long ms = (d == null) ? 0 : Math.max(0, d.toMillis());
        if (ms == 0) return CompletableFuture.completedFuture(null);
        Executor delayed = CompletableFuture.delayedExecutor(ms, TimeUnit.MILLISECONDS);
        return CompletableFuture.runAsync(() -> {}, delayed);
    }
}
