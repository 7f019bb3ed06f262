package org.tushareplus.rest.interfaces;

import org.tushareplus.model.EndpointLimits;

/**
 * Resolves the limits of an endpoint before pagination starts.
 * <p>
 * Implementations may answer from memory, from the durable {@link LimitStore}, or by probing the endpoint
 * on first use.
 * </p>
 */
public interface LimitsResolver {

    /**
     * @param endpointName Endpoint name, e.g. {@code daily}.
     * @return the endpoint's limits; never null
     */
    EndpointLimits resolve(String endpointName);

}
