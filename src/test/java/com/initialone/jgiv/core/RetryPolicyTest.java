package com.initialone.jgiv.core;

import com.initialone.jgiv.errors.ConfigException;
import com.initialone.jgiv.errors.SummarizationException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.immediate();

    @Test
    void returnsFirstSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String out = policy.call("abc", () -> {
            if (calls.incrementAndGet() < 3) throw new IOException("timeout");
            return "ok";
        });

        assertThat(out).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void givesUpAfterThreeAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.call("deadbeef", () -> {
            calls.incrementAndGet();
            throw new IOException("HTTP 503");
        }))
                .isInstanceOfSatisfying(SummarizationException.class, e -> {
                    assertThat(e.subject()).isEqualTo("deadbeef");
                    assertThat(e.attempts()).isEqualTo(3);
                    assertThat(e.getCause()).hasMessage("HTTP 503");
                })
                .hasMessageContaining("deadbeef");
        assertThat(calls).hasValue(3);
    }

    @Test
    void configErrorsAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.call("abc", () -> {
            calls.incrementAndGet();
            throw new ConfigException("API key missing");
        })).isInstanceOf(ConfigException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void backoffActuallyWaits() {
        RetryPolicy slow = new RetryPolicy(2, 50, 2.0, 0);
        long start = System.nanoTime();

        assertThatThrownBy(() -> slow.call("x", () -> {
            throw new IOException("down");
        })).isInstanceOf(SummarizationException.class);

        assertThat((System.nanoTime() - start) / 1_000_000).isGreaterThanOrEqualTo(50);
    }
}
