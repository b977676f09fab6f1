package com.stockpipe.collect;

/**
 * Blocking wait used for retry backoff and rate-limit pauses.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
