package com.stockpipe.collect;

import com.stockpipe.core.PipelineException;
import com.stockpipe.core.TransientFetchException;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff. Only {@link TransientFetchException} is retried;
 * anything else propagates from the first attempt.
 * <p>
 * With 3 attempts and a 2000 ms base the waits are 2000 ms then 4000 ms.
 */
public final class RetryPolicy {
    private final int maxAttempts;
    private final long baseDelayMs;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long baseDelayMs, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Wait applied after failed attempt {@code attempt} (1-based).
     */
    public long backoffMs(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        return baseDelayMs * (1L << exponent);
    }

    public <T> T execute(String label, Supplier<T> call) {
        TransientFetchException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (TransientFetchException e) {
                last = e;
                if (attempt >= maxAttempts) {
                    break;
                }
                long delay = backoffMs(attempt);
                System.err.println(String.format(
                        Locale.US,
                        "WARN: retry %s attempt=%d/%d category=%s delay_ms=%d cause=%s",
                        label, attempt, maxAttempts, e.category(), delay, e.getMessage()
                ));
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new PipelineException("retry interrupted: " + label, ie);
                }
            }
        }
        throw new TransientFetchException(
                last.category(),
                "retries_exhausted attempts=" + maxAttempts + " " + label + ": " + last.getMessage(),
                last
        );
    }
}
