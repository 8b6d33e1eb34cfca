package com.autoretry.core.retry;

import com.autoretry.core.api.ApiException;
import com.autoretry.core.api.ResponseParameters;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** 잡힌 실패를 ErrorKind로 분류한다. retry_after가 코드보다 우선한다. */
public final class ErrorClassifier {

    private ErrorClassifier() {}

    public static ClassifiedError classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (!(cause instanceof ApiException api)) {
            return new ClassifiedError(ErrorKind.NOT_RETRYABLE, cause, null, 0);
        }
        ResponseParameters params = api.getParameters();
        if (params.hasRetryAfter()) {
            return new ClassifiedError(ErrorKind.RATE_LIMITED, api, api, params.retryAfter());
        }
        if (api.isServerError()) {
            return new ClassifiedError(ErrorKind.SERVER_ERROR, api, api, 0);
        }
        return new ClassifiedError(ErrorKind.OTHER_API_ERROR, api, api, 0);
    }

    /** CompletionException/ExecutionException 래퍼 제거 */
    public static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
