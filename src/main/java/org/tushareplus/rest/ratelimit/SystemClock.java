package org.tushareplus.rest.ratelimit;

import org.tushareplus.rest.interfaces.Clock;

import java.util.concurrent.TimeUnit;

/**
 * Real system clock - uses System.nanoTime() and Thread sleeping.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }

    @Override
    public void sleepNanos(long nanos) throws InterruptedException {
        if (nanos > 0) {
            TimeUnit.NANOSECONDS.sleep(nanos);
        }
    }
}
