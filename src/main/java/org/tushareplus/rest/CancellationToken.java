package org.tushareplus.rest;

import org.tushareplus.rest.exception.FetchCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag threaded through a fetch.
 * <p>
 * Once cancelled, no further page or batch is submitted and no further retry is attempted; requests already
 * in flight are allowed to finish.
 * </p>
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile String reason = "cancelled";

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel(String why) {
        if (cancelled.compareAndSet(false, true)) {
            this.reason = why;
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }

    /**
     * @throws FetchCancelledException if the token has been cancelled
     */
    public void throwIfCancelled(String endpoint) {
        if (cancelled.get()) {
            throw new FetchCancelledException(endpoint, "Fetch of " + endpoint + " cancelled: " + reason);
        }
    }
}
