package com.stockpipe.collect;

import com.stockpipe.core.PipelineException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongSupplier;

/**
 * Allows at most {@code maxCalls} permits in any trailing window. A caller over the limit
 * blocks until the oldest call leaves the window; it never fails for lack of capacity.
 */
public final class SlidingWindowRateLimiter {
    private final int maxCalls;
    private final long windowMs;
    private final LongSupplier clockMs;
    private final Sleeper sleeper;
    private final Deque<Long> calls = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxCalls, long windowMs) {
        this(maxCalls, windowMs, System::currentTimeMillis, Sleeper.THREAD);
    }

    public SlidingWindowRateLimiter(int maxCalls, long windowMs, LongSupplier clockMs, Sleeper sleeper) {
        if (maxCalls < 1 || windowMs < 1) {
            throw new IllegalArgumentException("maxCalls and windowMs must be positive");
        }
        this.maxCalls = maxCalls;
        this.windowMs = windowMs;
        this.clockMs = clockMs;
        this.sleeper = sleeper;
    }

    /**
     * @return milliseconds spent waiting for capacity
     */
    public synchronized long acquire() {
        long waited = 0L;
        while (true) {
            long now = clockMs.getAsLong();
            while (!calls.isEmpty() && calls.peekFirst() <= now - windowMs) {
                calls.pollFirst();
            }
            if (calls.size() < maxCalls) {
                calls.addLast(now);
                return waited;
            }
            long wait = Math.max(1L, calls.peekFirst() + windowMs - now);
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PipelineException("rate limiter interrupted", e);
            }
            waited += wait;
        }
    }

    public synchronized int inWindow() {
        long now = clockMs.getAsLong();
        int count = 0;
        for (Long ts : calls) {
            if (ts > now - windowMs) {
                count++;
            }
        }
        return count;
    }
}
