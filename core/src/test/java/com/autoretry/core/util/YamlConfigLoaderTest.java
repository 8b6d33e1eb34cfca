package com.autoretry.core.util;

import com.autoretry.core.model.ClientConfig;
import com.autoretry.core.retry.RetryOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    private static InputStream yaml(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void loadsAllSections(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("autoretry.yml");
        Files.writeString(file, String.join("\n",
                "api:",
                "  baseUrl: \"http://localhost:8081/\"",
                "  token: \"123:ABC\"",
                "  timeoutMs: 5000",
                "retry:",
                "  maxDelaySeconds: 60",
                "  maxRetryAttempts: 5",
                "  rethrowServerErrors: true",
                "  enableLogs: \"true\"",
                "  backoff:",
                "    initialDelaySeconds: 2",
                "    maxDelaySeconds: 120",
                ""));

        ClientConfig cfg = YamlConfigLoader.load(file);

        assertThat(cfg.getBaseUrl()).isEqualTo("http://localhost:8081");
        assertThat(cfg.getToken()).isEqualTo("123:ABC");
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(5));

        RetryOptions o = cfg.toRetryOptions();
        assertThat(o.getMaxDelay()).contains(Duration.ofSeconds(60));
        assertThat(o.getMaxRetryAttempts()).isEqualTo(5);
        assertThat(o.isRethrowServerErrors()).isTrue();
        assertThat(o.isLoggingEnabled()).isTrue();
        assertThat(o.getInitialDelaySeconds()).isEqualTo(2);
        assertThat(o.getMaxBackoffSeconds()).isEqualTo(120);
    }

    @Test
    void emptyDocument_keepsDefaults() {
        ClientConfig cfg = YamlConfigLoader.load(yaml(""));

        assertThat(cfg.getBaseUrl()).isEqualTo(ClientConfig.DEFAULT_BASE_URL);
        assertThat(cfg.toRetryOptions()).isEqualTo(RetryOptions.defaults());
    }

    @Test
    void missingMaxDelay_meansUnbounded() {
        ClientConfig cfg = YamlConfigLoader.load(yaml("retry:\n  maxRetryAttempts: 1\n"));

        assertThat(cfg.toRetryOptions().getMaxDelay()).isEmpty();
        assertThat(cfg.toRetryOptions().getMaxRetryAttempts()).isEqualTo(1);
    }

    @Test
    void invalidValuesAreRejected() {
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("retry:\n  maxRetryAttempts: 0\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxRetryAttempts");
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("retry:\n  maxDelaySeconds: soon\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retry.maxDelaySeconds");
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("retry:\n  maxDelaySeconds: -1\n")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void integersOutsideIntRange_areRejectedNotTruncated() {
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("retry:\n  maxRetryAttempts: 4294967299\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retry.maxRetryAttempts")
                .hasMessageContaining("out of int range");
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("retry:\n  maxDelaySeconds: 4294967297\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retry.maxDelaySeconds");
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("retry:\n  backoff:\n    maxDelaySeconds: 99999999999999999999\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retry.backoff.maxDelaySeconds");
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("retry:\n  maxRetryAttempts: 2.5\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("whole number");
    }

    @Test
    void missingFile_isIOException(@TempDir Path dir) {
        assertThatThrownBy(() -> YamlConfigLoader.load(dir.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }
}
