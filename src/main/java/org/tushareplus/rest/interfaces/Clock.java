package org.tushareplus.rest.interfaces;

/**
 * Monotonic time source and sleeper used by rate limiting, retries and probing.
 * Replaceable in tests so that sliding-window waits are observable without real sleeping.
 */
public interface Clock {

    long nowNanos();

    void sleepNanos(long nanos) throws InterruptedException;

}
