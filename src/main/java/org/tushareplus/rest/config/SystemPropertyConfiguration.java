package org.tushareplus.rest.config;

/**
 * Configuration implementation that reads from Java system properties.
 *
 * <p>Uses {@link System#getProperty(String)} to retrieve configuration values.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * System.setProperty("tushareplus.workerPoolSize", "8");
 *
 * ClientConfiguration config = new SystemPropertyConfiguration();
 * int workers = config.getInt("tushareplus.workerPoolSize", 5);
 * }</pre>
 */
public class SystemPropertyConfiguration implements ClientConfiguration {

    @Override
    public String get(String key) {
        return System.getProperty(key);
    }
}
