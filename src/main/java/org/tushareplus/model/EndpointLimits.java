package org.tushareplus.model;

import lombok.Data;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Learned transfer and rate limits of one remote endpoint.
 * <p>
 * {@code perRequestCap == 0} means the endpoint has no known per-request cap and is fetched in one call;
 * {@code ratePerMinute == 0} means no rate restriction is enforced.
 * </p>
 */
@Data
public class EndpointLimits {

    /** Conservative cap used when probing the per-request cap fails. */
    public static final int DEFAULT_PER_REQUEST_CAP = 5000;

    private final String endpointName;
    private final int perRequestCap;
    private final int ratePerMinute;
    /** Second precision, matching what the limits table can hold. */
    private final LocalDateTime lastUpdated;

    public EndpointLimits(String endpointName, int perRequestCap, int ratePerMinute, LocalDateTime lastUpdated) {
        if (endpointName == null || endpointName.isEmpty()) {
            throw new IllegalArgumentException("endpointName is empty");
        }
        if (perRequestCap < 0) {
            throw new IllegalArgumentException("perRequestCap < 0: " + perRequestCap);
        }
        if (ratePerMinute < 0) {
            throw new IllegalArgumentException("ratePerMinute < 0: " + ratePerMinute);
        }
        this.endpointName = endpointName;
        this.perRequestCap = perRequestCap;
        this.ratePerMinute = ratePerMinute;
        this.lastUpdated = lastUpdated == null ? null : lastUpdated.truncatedTo(ChronoUnit.SECONDS);
    }

    public static EndpointLimits of(String endpointName, int perRequestCap, int ratePerMinute) {
        return new EndpointLimits(endpointName, perRequestCap, ratePerMinute, LocalDateTime.now());
    }

    public boolean isUncapped() {
        return perRequestCap == 0;
    }

    public boolean isRateUnrestricted() {
        return ratePerMinute == 0;
    }

    /**
     * Returns a copy with the rate pinned to "unrestricted", used when rate limiting is disabled.
     */
    public EndpointLimits withoutRateLimit() {
        if (ratePerMinute == 0) {
            return this;
        }
        return new EndpointLimits(endpointName, perRequestCap, 0, lastUpdated);
    }
}
