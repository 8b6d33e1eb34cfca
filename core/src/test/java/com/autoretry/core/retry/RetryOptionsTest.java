package com.autoretry.core.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryOptionsTest {

    @Test
    void defaults() {
        RetryOptions o = RetryOptions.defaults();

        assertThat(o.getMaxDelay()).isEmpty();
        assertThat(o.getMaxRetryAttempts()).isEqualTo(3);
        assertThat(o.isRethrowServerErrors()).isFalse();
        assertThat(o.isLoggingEnabled()).isFalse();
        assertThat(o.getInitialDelaySeconds()).isEqualTo(3);
        assertThat(o.getMaxBackoffSeconds()).isEqualTo(3600);
        assertThat(o.maxDelaySeconds()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(o.exceedsMaxDelay(Integer.MAX_VALUE)).isFalse();
    }

    @Test
    void maxDelayIsComparedInWholeSeconds() {
        RetryOptions o = RetryOptions.builder().maxDelay(Duration.ofMillis(10_900)).build();

        assertThat(o.maxDelaySeconds()).isEqualTo(10.0);
        assertThat(o.exceedsMaxDelay(10)).isFalse();
        assertThat(o.exceedsMaxDelay(11)).isTrue();
    }

    @Test
    void toBuilderCopiesEverything() {
        RetryOptions o = RetryOptions.builder()
                .maxDelay(Duration.ofMinutes(1))
                .maxRetryAttempts(7)
                .rethrowServerErrors(true)
                .loggingEnabled(true)
                .initialDelaySeconds(2)
                .maxBackoffSeconds(100)
                .build();

        assertThat(o.toBuilder().build()).isEqualTo(o);
        assertThat(o.toBuilder().maxRetryAttempts(1).build()).isNotEqualTo(o);
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> RetryOptions.builder().maxRetryAttempts(0).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxRetryAttempts");
        assertThatThrownBy(() -> RetryOptions.builder().maxDelay(Duration.ofSeconds(-1)).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxDelay");
        assertThatThrownBy(() -> RetryOptions.builder().initialDelaySeconds(0).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("initialDelaySeconds");
        assertThatThrownBy(() -> RetryOptions.builder().initialDelaySeconds(10).maxBackoffSeconds(5).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxBackoffSeconds");
        assertThatThrownBy(() -> RetryOptions.builder().maxBackoffSeconds(7200).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxBackoffSeconds");
    }
}
