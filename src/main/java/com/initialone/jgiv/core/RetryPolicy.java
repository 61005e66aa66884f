package com.initialone.jgiv.core;

import com.initialone.jgiv.errors.GivException;
import com.initialone.jgiv.errors.SummarizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry with exponential backoff and jitter for summarization calls.
 * Exhaustion raises {@link SummarizationException}. A {@link GivException}
 * thrown by the operation is not retried.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public static final int DEFAULT_ATTEMPTS = 3;

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final double multiplier;
    private final long jitterMs;

    public RetryPolicy(int maxAttempts, long initialBackoffMs, double multiplier, long jitterMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
        this.multiplier = Math.max(1.0, multiplier);
        this.jitterMs = Math.max(0, jitterMs);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_ATTEMPTS, 800, 2.0, 250);
    }

    /** Same attempt count, no sleeping. */
    public static RetryPolicy immediate() {
        return new RetryPolicy(DEFAULT_ATTEMPTS, 0, 1.0, 0);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public <T> T call(String subject, Callable<T> op) {
        long backoff = initialBackoffMs;
        Exception last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return op.call();
            } catch (GivException e) {
                // configuration and template problems do not go away on retry
                throw e;
            } catch (Exception e) {
                last = e;
                if (attempt == maxAttempts) break;
                long sleep = backoff + (jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs + 1) : 0);
                log.warn("{} attempt {}/{} failed: {}; retrying in {}ms", subject, attempt, maxAttempts, e.toString(), sleep);
                if (!sleep(sleep)) {
                    throw new SummarizationException(subject, attempt, e);
                }
                backoff = (long) Math.min(30_000, backoff * multiplier);
            }
        }
        throw new SummarizationException(subject, maxAttempts, last);
    }

    private static boolean sleep(long ms) {
        if (ms <= 0) return true;
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
