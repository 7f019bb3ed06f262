package org.tushareplus.rest.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tushareplus.model.Page;
import org.tushareplus.model.PageResult;
import org.tushareplus.model.TransportResponse;
import org.tushareplus.rest.CancellationToken;
import org.tushareplus.rest.exception.ApplicationException;
import org.tushareplus.rest.exception.ClientException;
import org.tushareplus.rest.exception.FetchCancelledException;
import org.tushareplus.rest.exception.RequestFailedException;
import org.tushareplus.rest.exception.TransportException;
import org.tushareplus.rest.interfaces.Clock;
import org.tushareplus.rest.interfaces.Transport;
import org.tushareplus.rest.limits.EndpointLimitsCache;
import org.tushareplus.rest.ratelimit.SlidingWindowRateLimiter;

import java.util.Collections;

/**
 * Issues one page request through the {@link Transport}, with rate-limit admission and bounded retries.
 *
 * <p>Each attempt:</p>
 * <ol>
 *   <li>checks the cancellation token</li>
 *   <li>waits for admission when rate limiting is enabled and the endpoint's limits are already cached
 *       (limits still being probed are not throttled, the probe is the one spending the budget)</li>
 *   <li>sends the request; a zero status code returns the page</li>
 *   <li>on failure asks the {@link RetryPolicy}, sleeps the retry delay and tries again, or gives up with
 *       {@link RequestFailedException}</li>
 * </ol>
 */
public class RequestExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RequestExecutor.class);

    private final Transport transport;
    private final String credential;
    private final RetryPolicy retryPolicy;
    private final SlidingWindowRateLimiter rateLimiter;
    private final EndpointLimitsCache limitsCache;
    private final boolean enableRateLimit;
    private final Clock clock;

    public RequestExecutor(Transport transport, String credential, RetryPolicy retryPolicy,
                           SlidingWindowRateLimiter rateLimiter, EndpointLimitsCache limitsCache,
                           boolean enableRateLimit, Clock clock) {
        this.transport = transport;
        this.credential = credential;
        this.retryPolicy = retryPolicy;
        this.rateLimiter = rateLimiter;
        this.limitsCache = limitsCache;
        this.enableRateLimit = enableRateLimit;
        this.clock = clock;
    }

    /**
     * Executes a page request.
     *
     * @param page  Request descriptor
     * @param token Cancellation token of the enclosing fetch
     * @return the page payload
     * @throws RequestFailedException  if the request failed permanently
     * @throws FetchCancelledException if the fetch was cancelled between attempts
     */
    public PageResult execute(Page page, CancellationToken token) {
        String endpoint = page.getEndpoint();
        int attempt = 0;
        while (true) {
            token.throwIfCancelled(endpoint);
            admit(endpoint);

            ClientException failure;
            try {
                TransportResponse response = transport.send(endpoint, credential, page.getParams(), page.getFields());
                if (response.isSuccess()) {
                    return response.getData() != null
                            ? response.getData()
                            : new PageResult(Collections.emptyList(), Collections.emptyList(), null);
                }
                failure = new ApplicationException(endpoint, response.getCode(), response.getMessage());
            } catch (TransportException e) {
                failure = e;
            } catch (ClientException e) {
                throw e;
            } catch (RuntimeException e) {
                failure = TransportException.buildTransportException(endpoint, e);
            }

            if (!retryPolicy.shouldRetry(failure, attempt)) {
                throw new RequestFailedException(endpoint, attempt + 1, failure);
            }
            logger.warn("{} request failed, retrying in {} s (attempt {}/{}): {}", endpoint,
                    retryPolicy.getRetryDelay().toSeconds(), attempt + 1, retryPolicy.getMaxRetries(),
                    failure.getMessage());
            pause(endpoint);
            attempt++;
        }
    }

    /**
     * Convenience overload for callers without a cancellation scope.
     */
    public PageResult execute(Page page) {
        return execute(page, CancellationToken.create());
    }

    private void admit(String endpoint) {
        if (!enableRateLimit) {
            return;
        }
        limitsCache.get(endpoint).ifPresent(limits -> rateLimiter.admit(endpoint, limits.getRatePerMinute()));
    }

    private void pause(String endpoint) {
        try {
            clock.sleepNanos(retryPolicy.getRetryDelay().toNanos());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchCancelledException(endpoint, "Interrupted while waiting to retry " + endpoint, e);
        }
    }
}
