package org.tushareplus.rest.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tushareplus.rest.exception.FetchCancelledException;
import org.tushareplus.rest.interfaces.Clock;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Blocking sliding-window (log) admission control, one independent window per endpoint.
 * <p>
 * Keeps the timestamp of every admitted call. A call is admitted immediately while fewer than
 * {@code ratePerMinute} calls fall inside the trailing window; otherwise the caller sleeps until the oldest
 * call leaves the window. Within any trailing window the admitted calls of one endpoint never exceed its rate.
 * </p>
 * <p>
 * Thread-safety: each endpoint's history has its own lock, held across prune, check, wait and record, so
 * concurrent workers of one endpoint queue behind each other while other endpoints proceed independently.
 * </p>
 */
public class SlidingWindowRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private final Clock clock;
    private final long windowNanos;
    private final Map<String, CallHistory> histories = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(Clock clock) {
        this(clock, DEFAULT_WINDOW);
    }

    public SlidingWindowRateLimiter(Clock clock, Duration window) {
        if (window.isZero() || window.isNegative()) throw new IllegalArgumentException("window <= 0");
        this.clock = clock;
        this.windowNanos = window.toNanos();
    }

    /**
     * Blocks until one more call to {@code endpoint} is permitted, then records it.
     *
     * @param endpoint      Endpoint key; windows of different endpoints are independent.
     * @param ratePerMinute Calls allowed per window; 0 means unrestricted and returns at once.
     * @throws FetchCancelledException if the thread is interrupted while waiting
     */
    public void admit(String endpoint, int ratePerMinute) {
        if (ratePerMinute <= 0) {
            return;
        }
        CallHistory history = historyOf(endpoint);
        lock(endpoint, history);
        try {
            long now = clock.nowNanos();
            history.prune(now);
            while (history.size() >= ratePerMinute) {
                long waitNanos = windowNanos - (now - history.oldest());
                if (waitNanos > 0) {
                    if (logger.isDebugEnabled()) {
                        logger.debug("Waiting {} ms to respect the rate limit of {} ({} calls per window)",
                                TimeUnit.NANOSECONDS.toMillis(waitNanos), endpoint, ratePerMinute);
                    }
                    sleep(endpoint, waitNanos);
                }
                now = clock.nowNanos();
                history.prune(now);
            }
            history.record(now);
        } finally {
            history.lock.unlock();
        }
    }

    /**
     * Records a call that bypassed admission, e.g. a calibration request issued while probing limits,
     * so that later admissions account for it.
     */
    public void record(String endpoint) {
        CallHistory history = historyOf(endpoint);
        history.lock.lock();
        try {
            history.record(clock.nowNanos());
        } finally {
            history.lock.unlock();
        }
    }

    /**
     * Returns the number of calls currently inside the endpoint's window.
     */
    public int historySize(String endpoint) {
        CallHistory history = histories.get(endpoint);
        if (history == null) {
            return 0;
        }
        history.lock.lock();
        try {
            history.prune(clock.nowNanos());
            return history.size();
        } finally {
            history.lock.unlock();
        }
    }

    private CallHistory historyOf(String endpoint) {
        return histories.computeIfAbsent(endpoint, k -> new CallHistory());
    }

    private void lock(String endpoint, CallHistory history) {
        try {
            history.lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchCancelledException(endpoint, "Interrupted while waiting for rate limit admission", e);
        }
    }

    private void sleep(String endpoint, long nanos) {
        try {
            clock.sleepNanos(nanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchCancelledException(endpoint, "Interrupted while waiting for rate limit admission", e);
        }
    }

    /**
     * Timestamps of admitted calls of one endpoint, oldest first. Guarded by {@link #lock}.
     */
    private final class CallHistory {
        private final ReentrantLock lock = new ReentrantLock();
        private final ArrayDeque<Long> events = new ArrayDeque<>();

        void prune(long now) {
            while (!events.isEmpty() && now - events.peekFirst() >= windowNanos) {
                events.removeFirst();
            }
        }

        void record(long now) {
            events.addLast(now);
        }

        int size() {
            return events.size();
        }

        long oldest() {
            return events.peekFirst();
        }
    }
}
