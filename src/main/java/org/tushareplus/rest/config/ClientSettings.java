package org.tushareplus.rest.config;

import lombok.Data;
import org.tushareplus.model.ApiProfile;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.tushareplus.rest.config.ClientConfiguration.PREFIX;

/**
 * Settings of a {@link org.tushareplus.rest.DataApiClient}: server profile, credential, pool size, retry
 * and timeout values, and the locations of the limits and required-parameter files.
 */
@Data
public class ClientSettings {

    /** Directory under the user's home holding learned limits. */
    public static final String CONFIG_DIR_NAME = ".tushare_plus";

    private ApiProfile profile = ApiProfile.TUSHARE;
    private String token;
    private int workerPoolSize = 5;
    private int maxRetries = 3;
    private int retryDelaySeconds = 1;
    private boolean enableRateLimit = true;
    /** Pages planned in concurrent mode when neither maxPages nor a total limit is given. */
    private int defaultMaxPages = 1000;
    /** Re-sort concurrently fetched pages by offset instead of keeping completion order. */
    private boolean orderConcurrentPages = false;
    private int connectionTimeoutSeconds = 10;
    private int responseTimeoutSeconds = 60;
    /** CSV file with learned limits; defaults to {@code ~/.tushare_plus/<profile limits file>}. */
    private Path limitsFile;
    /** Optional JSON file with extra required parameters per endpoint. */
    private Path requiredParamsFile;

    public static ClientSettings forProfile(ApiProfile profile, String token) {
        ClientSettings settings = new ClientSettings();
        settings.setProfile(profile);
        settings.setToken(token);
        settings.setEnableRateLimit(profile.isEnableRateLimitByDefault());
        return settings;
    }

    /**
     * Builds settings from a configuration source. The token falls back to the profile's environment variable.
     *
     * @throws IllegalArgumentException if a value is malformed or no token can be found
     */
    public static ClientSettings fromConfiguration(ClientConfiguration config, ApiProfile profile) {
        ApiProfile effectiveProfile = config.has(PREFIX + "baseUrl")
                ? profile.withBaseUrl(config.get(PREFIX + "baseUrl"))
                : profile;

        String token = config.get(PREFIX + "token");
        if (token == null || token.isBlank()) {
            token = System.getenv(profile.getTokenEnvironmentVariable());
        }

        ClientSettings settings = forProfile(effectiveProfile, token);
        settings.setWorkerPoolSize(config.getInt(PREFIX + "workerPoolSize", settings.getWorkerPoolSize()));
        settings.setMaxRetries(config.getInt(PREFIX + "maxRetries", settings.getMaxRetries()));
        settings.setRetryDelaySeconds(config.getInt(PREFIX + "retryDelaySeconds", settings.getRetryDelaySeconds()));
        settings.setEnableRateLimit(config.getBoolean(PREFIX + "enableRateLimit", settings.isEnableRateLimit()));
        settings.setDefaultMaxPages(config.getInt(PREFIX + "defaultMaxPages", settings.getDefaultMaxPages()));
        settings.setOrderConcurrentPages(config.getBoolean(PREFIX + "orderConcurrentPages", settings.isOrderConcurrentPages()));
        settings.setConnectionTimeoutSeconds(config.getInt(PREFIX + "connectionTimeoutSeconds", settings.getConnectionTimeoutSeconds()));
        settings.setResponseTimeoutSeconds(config.getInt(PREFIX + "responseTimeoutSeconds", settings.getResponseTimeoutSeconds()));
        if (config.has(PREFIX + "limitsFile")) {
            settings.setLimitsFile(Paths.get(config.get(PREFIX + "limitsFile")));
        }
        if (config.has(PREFIX + "requiredParamsFile")) {
            settings.setRequiredParamsFile(Paths.get(config.get(PREFIX + "requiredParamsFile")));
        }
        settings.validate();
        return settings;
    }

    /**
     * @throws IllegalArgumentException on a missing token or out-of-range numbers
     */
    public void validate() {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Token must be provided either in the configuration or via the "
                    + profile.getTokenEnvironmentVariable() + " environment variable.");
        }
        if (workerPoolSize < 1) {
            throw new IllegalArgumentException("workerPoolSize must be positive: " + workerPoolSize);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (retryDelaySeconds < 0) {
            throw new IllegalArgumentException("retryDelaySeconds must not be negative: " + retryDelaySeconds);
        }
        if (defaultMaxPages < 1) {
            throw new IllegalArgumentException("defaultMaxPages must be positive: " + defaultMaxPages);
        }
    }

    public Path resolveLimitsFile() {
        if (limitsFile != null) {
            return limitsFile;
        }
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR_NAME, profile.getLimitsFileName());
    }
}
