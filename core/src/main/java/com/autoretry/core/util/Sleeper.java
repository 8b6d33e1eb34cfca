package com.autoretry.core.util;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/** 비차단 대기. 반환된 future가 d 이후 완료된다(호출 스레드를 막지 않음). */
@FunctionalInterface
public interface Sleeper {
    CompletableFuture<Void> sleep(Duration d);
}
