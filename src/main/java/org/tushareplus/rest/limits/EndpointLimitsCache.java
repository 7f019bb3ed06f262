package org.tushareplus.rest.limits;

import org.tushareplus.model.EndpointLimits;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-lifetime cache of resolved endpoint limits.
 * <p>
 * Read by every page worker, written only when an endpoint is resolved for the first time or cleared,
 * hence a read/write lock rather than a single mutex.
 * </p>
 */
public class EndpointLimitsCache {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, EndpointLimits> entries = new HashMap<>();

    public Optional<EndpointLimits> get(String endpoint) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(endpoint));
        } finally {
            lock.readLock().unlock();
        }
    }

    public void put(EndpointLimits limits) {
        lock.writeLock().lock();
        try {
            entries.put(limits.getEndpointName(), limits);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return true if an entry was removed
     */
    public boolean evict(String endpoint) {
        lock.writeLock().lock();
        try {
            return entries.remove(endpoint) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
