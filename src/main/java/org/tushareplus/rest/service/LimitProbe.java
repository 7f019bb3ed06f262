package org.tushareplus.rest.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tushareplus.model.ApiProfile;
import org.tushareplus.model.EndpointLimits;
import org.tushareplus.model.Page;
import org.tushareplus.model.PageResult;
import org.tushareplus.model.TransportResponse;
import org.tushareplus.rest.exception.ApplicationException;
import org.tushareplus.rest.exception.ClientException;
import org.tushareplus.rest.exception.ProbeFailedException;
import org.tushareplus.rest.exception.TransportException;
import org.tushareplus.rest.interfaces.Clock;
import org.tushareplus.rest.interfaces.LimitStore;
import org.tushareplus.rest.interfaces.Transport;
import org.tushareplus.rest.ratelimit.SlidingWindowRateLimiter;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Discovers an endpoint's per-request cap and per-minute rate by calibration requests.
 *
 * <p><b>Per-request cap:</b> one request without {@code limit}. An explicit {@code has_more = false} means the
 * endpoint returned everything (cap 0); {@code has_more = true} means the row count is the cap. Without the
 * flag, the row count counts as the cap only if it is a positive multiple of 1000, since some server versions
 * omit the flag. Any failure yields {@link EndpointLimits#DEFAULT_PER_REQUEST_CAP}.</p>
 *
 * <p><b>Rate:</b> small ({@code limit=100}) requests back to back until the server rejects one with a
 * rate-limit message or the calibration window elapses; the number of successes is the rate. Any other error
 * fails the probe. Calibration calls are recorded in the rate limiter so that real requests issued right after
 * probing still respect the window.</p>
 *
 * <p>Requests are sent straight through the {@link Transport}, without retries or admission control.</p>
 */
public class LimitProbe {

    private static final Logger logger = LoggerFactory.getLogger(LimitProbe.class);

    static final int RATE_PROBE_PAGE_SIZE = 100;
    static final int HEURISTIC_CAP_UNIT = 1000;

    private final Transport transport;
    private final String credential;
    private final LimitStore limitStore;
    private final SlidingWindowRateLimiter rateLimiter;
    private final ApiProfile profile;
    private final Clock clock;
    private final long windowNanos;

    public LimitProbe(Transport transport, String credential, LimitStore limitStore,
                      SlidingWindowRateLimiter rateLimiter, ApiProfile profile, Clock clock) {
        this(transport, credential, limitStore, rateLimiter, profile, clock, SlidingWindowRateLimiter.DEFAULT_WINDOW);
    }

    public LimitProbe(Transport transport, String credential, LimitStore limitStore,
                      SlidingWindowRateLimiter rateLimiter, ApiProfile profile, Clock clock, Duration window) {
        this.transport = transport;
        this.credential = credential;
        this.limitStore = limitStore;
        this.rateLimiter = rateLimiter;
        this.profile = profile;
        this.clock = clock;
        this.windowNanos = window.toNanos();
    }

    /**
     * Probes cap and rate and persists the result.
     *
     * @throws ProbeFailedException if rate detection hits an error other than a rate-limit rejection
     */
    public EndpointLimits probeLimits(String endpoint, Map<String, Object> requiredParams) {
        return probeLimits(endpoint, requiredParams, true);
    }

    /**
     * Probes the cap and, if requested, the rate; stores {@code ratePerMinute = 0} when the rate is skipped.
     */
    public EndpointLimits probeLimits(String endpoint, Map<String, Object> requiredParams, boolean includeRate) {
        logger.info("Detecting limits of {}...", endpoint);
        int cap = probeRequestCap(endpoint, requiredParams);
        int rate = includeRate ? probeRateLimit(endpoint, requiredParams) : 0;

        EndpointLimits limits = EndpointLimits.of(endpoint, cap, rate);
        try {
            limitStore.put(limits);
        } catch (UncheckedIOException e) {
            logger.error("Failed to persist limits of {}, keeping them for this process only", endpoint, e);
        }
        logger.info("Limits of {} detected: {} rows per request, {} requests per minute", endpoint, cap, rate);
        return limits;
    }

    /**
     * @return the detected cap, 0 for uncapped, or the default cap when the probe request fails
     */
    public int probeRequestCap(String endpoint, Map<String, Object> requiredParams) {
        Map<String, Object> params = copyWithout(requiredParams, Page.LIMIT);
        try {
            logger.info("Detecting per-request cap of {}...", endpoint);
            TransportResponse response = transport.send(endpoint, credential, params, Collections.emptyList());
            if (!response.isSuccess()) {
                throw new ApplicationException(endpoint, response.getCode(), response.getMessage());
            }
            PageResult data = response.getData();
            int count = data == null ? 0 : data.size();
            Boolean hasMore = data == null ? null : data.getHasMore();

            if (hasMore != null) {
                if (!hasMore) {
                    logger.info("{} probably has no per-request cap, returned {} rows", endpoint, count);
                    return 0;
                }
                logger.info("Per-request cap of {} is {} rows", endpoint, count);
                return count;
            }
            if (count > 0 && count % HEURISTIC_CAP_UNIT == 0) {
                logger.info("Per-request cap of {} is {} rows", endpoint, count);
                return count;
            }
            logger.info("{} probably has no per-request cap, returned {} rows", endpoint, count);
            return 0;
        } catch (RuntimeException e) {
            logger.warn("Detecting per-request cap of {} failed, using default {}: {}",
                    endpoint, EndpointLimits.DEFAULT_PER_REQUEST_CAP, e.getMessage());
            return EndpointLimits.DEFAULT_PER_REQUEST_CAP;
        }
    }

    /**
     * @return number of requests that succeeded within one window before a rate-limit rejection, at least 1
     * @throws ProbeFailedException on any error other than a rate-limit rejection
     */
    public int probeRateLimit(String endpoint, Map<String, Object> requiredParams) {
        Map<String, Object> params = copyWithout(requiredParams, Page.LIMIT);
        params.put(Page.LIMIT, RATE_PROBE_PAGE_SIZE);

        logger.info("Detecting rate limit of {}...", endpoint);
        int count = 0;
        long start = clock.nowNanos();
        while (clock.nowNanos() - start < windowNanos) {
            TransportResponse response;
            try {
                response = transport.send(endpoint, credential, params, Collections.emptyList());
            } catch (TransportException e) {
                if (profile.isRateLimitRejection(e.getMessage())) {
                    break;
                }
                throw ProbeFailedException.buildProbeFailedException(endpoint, e);
            } catch (ClientException e) {
                throw e;
            } catch (RuntimeException e) {
                throw ProbeFailedException.buildProbeFailedException(endpoint, e);
            }
            if (!response.isSuccess()) {
                if (profile.isRateLimitRejection(response.getMessage())) {
                    break;
                }
                throw ProbeFailedException.buildProbeFailedException(endpoint,
                        new ApplicationException(endpoint, response.getCode(), response.getMessage()));
            }
            count++;
            rateLimiter.record(endpoint);
        }

        if (count > 0) {
            logger.info("{} calibration requests sent to {}, the rate window may need to reset", count, endpoint);
        }
        return Math.max(1, count);
    }

    private static Map<String, Object> copyWithout(Map<String, Object> source, String key) {
        Map<String, Object> copy = source == null ? new LinkedHashMap<>() : new LinkedHashMap<>(source);
        copy.remove(key);
        return copy;
    }
}
