package org.tushareplus.rest.config;

import java.util.HashMap;
import java.util.Map;

/**
 * In-memory configuration, for programmatic setup and tests.
 */
public class MapConfiguration implements ClientConfiguration {

    private final Map<String, String> values;

    public MapConfiguration() {
        this(new HashMap<>());
    }

    public MapConfiguration(Map<String, String> values) {
        this.values = new HashMap<>(values);
    }

    /**
     * Sets a value under the {@value ClientConfiguration#PREFIX} namespace.
     *
     * @return this configuration for chaining
     */
    public MapConfiguration with(String shortKey, Object value) {
        values.put(PREFIX + shortKey, String.valueOf(value));
        return this;
    }

    @Override
    public String get(String key) {
        return values.get(key);
    }
}
