package org.tushareplus.rest.config;

/**
 * Configuration source for client settings.
 *
 * <p>Abstracts where settings come from (system properties, an in-memory map, ...)
 * so that {@link ClientSettings} can be built the same way in production and in tests.</p>
 *
 * <p><b>Configuration keys</b> (all prefixed with {@value #PREFIX}):</p>
 * <ul>
 *   <li>token - credential carried with every request</li>
 *   <li>baseUrl - overrides the profile's service URL</li>
 *   <li>workerPoolSize, maxRetries, retryDelaySeconds</li>
 *   <li>enableRateLimit, defaultMaxPages, orderConcurrentPages</li>
 *   <li>connectionTimeoutSeconds, responseTimeoutSeconds</li>
 *   <li>limitsFile, requiredParamsFile</li>
 * </ul>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ClientConfiguration config = new SystemPropertyConfiguration();
 * ClientSettings settings = ClientSettings.fromConfiguration(config, ApiProfile.TUSHARE);
 * }</pre>
 */
public interface ClientConfiguration {

    String PREFIX = "tushareplus.";

    /**
     * Gets configuration value by key.
     *
     * @param key Configuration key
     * @return Configuration value or null if not found
     */
    String get(String key);

    /**
     * Gets configuration value by key with default fallback.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Configuration value or default value
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Checks if configuration key exists.
     *
     * @param key Configuration key
     * @return true if key exists, false otherwise
     */
    default boolean has(String key) {
        return get(key) != null;
    }

    /**
     * Gets an integer value, failing fast on malformed numbers.
     *
     * @throws IllegalArgumentException if the value is present but not an integer
     */
    default int getInt(String key, int defaultValue) {
        String value = get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key " + key + " is not an integer: " + value, e);
        }
    }

    default boolean getBoolean(String key, boolean defaultValue) {
        String value = get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }
}
