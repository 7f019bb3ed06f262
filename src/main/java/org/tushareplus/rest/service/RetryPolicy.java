package org.tushareplus.rest.service;

import org.tushareplus.rest.exception.ApplicationException;
import org.tushareplus.rest.exception.ClientException;
import org.tushareplus.rest.exception.TransportException;

import java.time.Duration;
import java.util.Set;

/**
 * Decides whether a failed page request is attempted again.
 * <p>
 * Transport failures are always transient. Application failures are transient only for the status codes in
 * {@link #RETRYABLE_CODES}; parameter or permission errors fail at once.
 * </p>
 */
public class RetryPolicy {

    /** System error, requests too frequent, internal server error, service unavailable. */
    public static final Set<Integer> RETRYABLE_CODES = Set.of(-1, 40203, 500, 503);

    private final int maxRetries;
    private final Duration retryDelay;

    public RetryPolicy(int maxRetries, Duration retryDelay) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries < 0");
        this.maxRetries = maxRetries;
        this.retryDelay = retryDelay;
    }

    public boolean isRetryable(ClientException failure) {
        if (failure instanceof TransportException) {
            return true;
        }
        if (failure instanceof ApplicationException) {
            return RETRYABLE_CODES.contains(((ApplicationException) failure).getCode());
        }
        return false;
    }

    /**
     * @param failure the failure of the attempt that just ended
     * @param attempt zero-based number of that attempt
     */
    public boolean shouldRetry(ClientException failure, int attempt) {
        return attempt < maxRetries && isRetryable(failure);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }
}
