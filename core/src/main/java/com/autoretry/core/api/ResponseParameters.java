package com.autoretry.core.api;

/**
 * 오류 응답의 parameters 객체.
 *
 * @param retryAfter      재시도 전 최소 대기(초). 없으면 null
 * @param migrateToChatId 그룹이 슈퍼그룹으로 옮겨진 경우의 새 chat id. 없으면 null
 */
public record ResponseParameters(Integer retryAfter, Long migrateToChatId) {

    public static final ResponseParameters NONE = new ResponseParameters(null, null);

    public static ResponseParameters retryAfter(int seconds) {
        return new ResponseParameters(seconds, null);
    }

    public boolean hasRetryAfter() { return retryAfter != null; }
}
