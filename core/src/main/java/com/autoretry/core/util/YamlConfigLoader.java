package com.autoretry.core.util;

import com.autoretry.core.model.ClientConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * autoretry.yml을 읽어 ClientConfig로 변환.
 *
 * 예상 YAML 키:
 * api:
 *   baseUrl: "https://api.telegram.org"
 *   token: "123:ABC"
 *   timeoutMs: 10000
 * retry:
 *   maxDelaySeconds: 60        # 생략하면 무제한
 *   maxRetryAttempts: 3
 *   rethrowServerErrors: false
 *   enableLogs: true
 *   backoff:
 *     initialDelaySeconds: 3
 *     maxDelaySeconds: 3600
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "autoretry.yml";

    private YamlConfigLoader() {}

    public static ClientConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static ClientConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static ClientConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        ClientConfig cfg = ClientConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) api.*
        Map<?, ?> api = getMap(map, "api");
        if (api != null) {
            setString(api, "baseUrl", cfg::setBaseUrl);
            setString(api, "token", cfg::setToken);
            Object t = api.get("timeoutMs");
            if (t != null) cfg.setTimeoutMs(toLong(t, "api.timeoutMs"));
        }

        // 2) retry.*
        Map<?, ?> retry = getMap(map, "retry");
        if (retry != null) {
            ClientConfig.RetryCfg r = cfg.getRetry();
            Object md = retry.get("maxDelaySeconds");
            if (md != null) r.setMaxDelaySeconds(toInt(md, "retry.maxDelaySeconds"));
            setInt(retry, "retry.maxRetryAttempts", r::setMaxRetryAttempts);
            setBoolean(retry, "rethrowServerErrors", r::setRethrowServerErrors);
            setBoolean(retry, "enableLogs", r::setEnableLogs);

            // 3) retry.backoff.*
            Map<?, ?> backoff = getMap(retry, "backoff");
            if (backoff != null) {
                setInt(backoff, "retry.backoff.initialDelaySeconds", r::setInitialDelaySeconds);
                setInt(backoff, "retry.backoff.maxDelaySeconds", r::setMaxBackoffSeconds);
            }
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
    }

    /** path는 "retry.backoff.maxDelaySeconds"처럼 전체 키. 마지막 토막으로 map을 조회 */
    private static void setInt(Map<?, ?> map, String path, IntConsumer setter) {
        Object v = map.get(path.substring(path.lastIndexOf('.') + 1));
        if (v != null) setter.accept(toInt(v, path));
    }

    private static int toInt(Object v, String key) {
        try {
            return Math.toIntExact(toLong(v, key));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(key + " out of int range: " + v, e);
        }
    }

    /** 정수만 허용. 소수, long 범위 밖(BigInteger)은 잘라내지 않고 거부 */
    private static long toLong(Object v, String key) {
        if (v instanceof Integer || v instanceof Long) return ((Number) v).longValue();
        try {
            return new BigDecimal(String.valueOf(v).trim()).longValueExact();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + v, e);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(key + " must be a whole number in long range: " + v, e);
        }
    }
}
