package com.autoretry.core.api;

/** 원격 API가 직접 보고한 오류({"ok":false,...}). */
public class ApiException extends RuntimeException {

    private final int code;
    private final String description;
    private final ResponseParameters parameters;

    public ApiException(int code, String description) {
        this(code, description, ResponseParameters.NONE);
    }

    public ApiException(int code, String description, ResponseParameters parameters) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
        this.parameters = (parameters == null) ? ResponseParameters.NONE : parameters;
    }

    public int getCode() { return code; }
    public String getDescription() { return description; }
    public ResponseParameters getParameters() { return parameters; }

    /** 5xx 계열(서버 내부 오류) */
    public boolean isServerError() { return code >= 500; }

    public boolean isRateLimited() { return code == 429; }
}
