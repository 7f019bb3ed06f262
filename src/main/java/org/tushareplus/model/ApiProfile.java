package org.tushareplus.model;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Backend profile: where the service lives and which defaults apply to it.
 * <p>
 * Alternate Tushare-compatible backends differ only in base URL, default flags, the file their learned
 * limits are kept in and a few endpoint parameters, so they are described by a profile handed to the same
 * client rather than by a client subclass.
 * </p>
 */
@Data
public class ApiProfile {

    /** Server message fragment signalling that the per-minute budget is used up. */
    public static final String TUSHARE_RATE_LIMIT_MARKER = "每分钟最多访问";

    public static final ApiProfile TUSHARE = new ApiProfile(
            "tushare",
            "http://api.tushare.pro",
            true,
            "tushare_api_limits.csv",
            "TUSHARE_TOKEN",
            List.of(TUSHARE_RATE_LIMIT_MARKER),
            Map.of("index_weight", Map.<String, Object>of("index_code", "000906.SH")));

    public static final ApiProfile DATACUBE = new ApiProfile(
            "datacube",
            "http://datacubeapi.foundersc.com",
            false,
            "datacube_api_limits.csv",
            "DATACUBE_TOKEN",
            List.of(TUSHARE_RATE_LIMIT_MARKER),
            Map.of("index_weight", Map.<String, Object>of("index_code", "000906.SH"),
                    "fund_nav", Map.<String, Object>of("end_date", "20250506")));

    private final String name;
    private final String baseUrl;
    private final boolean enableRateLimitByDefault;
    private final String limitsFileName;
    private final String tokenEnvironmentVariable;
    private final List<String> rateLimitMarkers;
    /** Endpoint name -> parameters the endpoint needs before it can be probed. */
    private final Map<String, Map<String, Object>> requiredParams;

    /**
     * Returns a copy of this profile pointing at another base URL, e.g. a proxy or a test server.
     */
    public ApiProfile withBaseUrl(String url) {
        return new ApiProfile(name, url, enableRateLimitByDefault, limitsFileName, tokenEnvironmentVariable,
                rateLimitMarkers, requiredParams);
    }

    public boolean isRateLimitRejection(String message) {
        if (message == null) {
            return false;
        }
        for (String marker : rateLimitMarkers) {
            if (message.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
