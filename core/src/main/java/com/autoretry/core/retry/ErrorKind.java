package com.autoretry.core.retry;

/** 실패 분류. 재시도 방식이 여기서 갈린다. */
public enum ErrorKind {
    /** API 오류가 아님(전송 계층, 로컬 예외 등). 재시도 없이 그대로 던진다. */
    NOT_RETRYABLE,
    /** retry_after 지시가 있음. 그만큼 기다린 뒤 재시도(상한 초과 시 던짐). */
    RATE_LIMITED,
    /** 5xx. 지수 백오프 후 재시도(설정에 따라 바로 던짐). */
    SERVER_ERROR,
    /** 그 밖의 API 오류. 대기 없이 재시도. */
    OTHER_API_ERROR
}
