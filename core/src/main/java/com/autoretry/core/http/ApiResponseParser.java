package com.autoretry.core.http;

import com.autoretry.core.api.ApiClientException;
import com.autoretry.core.api.ApiException;
import com.autoretry.core.api.ApiMethod;
import com.autoretry.core.api.ResponseParameters;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;

/**
 * Bot API 응답 봉투 해석.
 * <pre>
 * {"ok":true,"result":{...}}
 * {"ok":false,"error_code":429,"description":"Too Many Requests: retry after 5","parameters":{"retry_after":5}}
 * </pre>
 */
public final class ApiResponseParser {

    private final ObjectMapper om;

    public ApiResponseParser() {
        this(new ObjectMapper());
    }

    public ApiResponseParser(ObjectMapper om) {
        this.om = Objects.requireNonNull(om, "om");
    }

    /**
     * @return ok=true면 result 노드(없으면 JSON null)
     * @throws ApiException       ok=false 봉투, 또는 JSON이 아닌 5xx 응답
     * @throws ApiClientException 그 밖에 해석할 수 없는 응답
     */
    public JsonNode parse(ApiMethod method, int statusCode, String body) {
        JsonNode root;
        try {
            root = om.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            return notAnEnvelope(method, statusCode, e);
        }
        if (root == null || !root.isObject() || !root.has("ok")) {
            return notAnEnvelope(method, statusCode, null);
        }

        if (root.path("ok").asBoolean(false)) {
            JsonNode result = root.get("result");
            return result == null ? NullNode.getInstance() : result;
        }

        int code = root.path("error_code").asInt(statusCode);
        String description = root.path("description").asText("Unknown error");
        throw new ApiException(code, description, parameters(root.path("parameters")));
    }

    private static ResponseParameters parameters(JsonNode p) {
        if (!p.isObject()) return ResponseParameters.NONE;
        JsonNode ra = p.get("retry_after");
        JsonNode mig = p.get("migrate_to_chat_id");
        Integer retryAfter = (ra != null && ra.canConvertToInt()) ? ra.asInt() : null;
        Long migrate = (mig != null && mig.canConvertToLong()) ? mig.asLong() : null;
        if (retryAfter == null && migrate == null) return ResponseParameters.NONE;
        return new ResponseParameters(retryAfter, migrate);
    }

    // 프록시/게이트웨이가 만든 HTML 502 등은 서버 오류로 취급
    private static JsonNode notAnEnvelope(ApiMethod method, int statusCode, Throwable cause) {
        if (statusCode >= 500) {
            throw new ApiException(statusCode, "HTTP " + statusCode);
        }
        throw new ApiClientException(ApiClientException.Type.INVALID_RESPONSE,
                "Unexpected response for '" + method + "' (HTTP " + statusCode + ")", cause);
    }
}
