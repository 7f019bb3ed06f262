package org.tushareplus.rest.interfaces;

import org.tushareplus.model.EndpointLimits;

import java.util.Optional;

/**
 * Durable table of learned endpoint limits, keyed by endpoint name.
 * Holds at most one record per endpoint; {@link #put} is an upsert.
 */
public interface LimitStore {

    Optional<EndpointLimits> get(String endpointName);

    void put(EndpointLimits limits);

    /**
     * Removes the endpoint's record; a missing record is not an error.
     */
    void delete(String endpointName);

}
