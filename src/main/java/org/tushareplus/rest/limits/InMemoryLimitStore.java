package org.tushareplus.rest.limits;

import org.tushareplus.model.EndpointLimits;
import org.tushareplus.rest.interfaces.LimitStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable {@link LimitStore}: learned limits live as long as the process.
 */
public class InMemoryLimitStore implements LimitStore {

    private final Map<String, EndpointLimits> records = new ConcurrentHashMap<>();

    @Override
    public Optional<EndpointLimits> get(String endpointName) {
        return Optional.ofNullable(records.get(endpointName));
    }

    @Override
    public void put(EndpointLimits limits) {
        records.put(limits.getEndpointName(), limits);
    }

    @Override
    public void delete(String endpointName) {
        records.remove(endpointName);
    }
}
