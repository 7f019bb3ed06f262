package org.tushareplus.rest.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tushareplus.model.ApiProfile;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class ClientSettingsTest {

    @Test
    @DisplayName("Defaults of the Tushare profile")
    public void testDefaults() {
        ClientSettings settings = ClientSettings.fromConfiguration(new MapConfiguration().with("token", "abc"), ApiProfile.TUSHARE);

        assertEquals("abc", settings.getToken());
        assertEquals(5, settings.getWorkerPoolSize());
        assertEquals(3, settings.getMaxRetries());
        assertEquals(1, settings.getRetryDelaySeconds());
        assertTrue(settings.isEnableRateLimit());
        assertEquals(1000, settings.getDefaultMaxPages());
        assertFalse(settings.isOrderConcurrentPages());
        assertEquals(10, settings.getConnectionTimeoutSeconds());
        assertEquals(60, settings.getResponseTimeoutSeconds());
        assertEquals("http://api.tushare.pro", settings.getProfile().getBaseUrl());
        assertEquals(Paths.get(System.getProperty("user.home"), ".tushare_plus", "tushare_api_limits.csv"),
                settings.resolveLimitsFile());
    }

    @Test
    @DisplayName("DataCube profile disables rate limiting and uses its own limits file")
    public void testDataCubeProfile() {
        ClientSettings settings = ClientSettings.forProfile(ApiProfile.DATACUBE, "abc");

        assertFalse(settings.isEnableRateLimit());
        assertEquals("http://datacubeapi.foundersc.com", settings.getProfile().getBaseUrl());
        assertTrue(settings.resolveLimitsFile().endsWith("datacube_api_limits.csv"));
        assertEquals("20250506", settings.getProfile().getRequiredParams().get("fund_nav").get("end_date"));
    }

    @Test
    @DisplayName("Every option can be overridden")
    public void testOverrides() {
        MapConfiguration config = new MapConfiguration()
                .with("token", "abc")
                .with("baseUrl", "http://localhost:8080")
                .with("workerPoolSize", 8)
                .with("maxRetries", 0)
                .with("retryDelaySeconds", 2)
                .with("enableRateLimit", false)
                .with("defaultMaxPages", 50)
                .with("orderConcurrentPages", true)
                .with("connectionTimeoutSeconds", 3)
                .with("responseTimeoutSeconds", 30)
                .with("limitsFile", "/tmp/limits.csv")
                .with("requiredParamsFile", "/tmp/params.json");

        ClientSettings settings = ClientSettings.fromConfiguration(config, ApiProfile.TUSHARE);

        assertEquals("http://localhost:8080", settings.getProfile().getBaseUrl());
        assertEquals("tushare", settings.getProfile().getName());
        assertEquals(8, settings.getWorkerPoolSize());
        assertEquals(0, settings.getMaxRetries());
        assertEquals(2, settings.getRetryDelaySeconds());
        assertFalse(settings.isEnableRateLimit());
        assertEquals(50, settings.getDefaultMaxPages());
        assertTrue(settings.isOrderConcurrentPages());
        assertEquals(3, settings.getConnectionTimeoutSeconds());
        assertEquals(30, settings.getResponseTimeoutSeconds());
        assertEquals(Path.of("/tmp/limits.csv"), settings.resolveLimitsFile());
        assertEquals(Path.of("/tmp/params.json"), settings.getRequiredParamsFile());
    }

    @Test
    @DisplayName("Malformed numbers and out-of-range values are rejected")
    public void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> ClientSettings.fromConfiguration(
                new MapConfiguration().with("token", "abc").with("maxRetries", "three"), ApiProfile.TUSHARE));
        assertThrows(IllegalArgumentException.class, () -> ClientSettings.fromConfiguration(
                new MapConfiguration().with("token", "abc").with("workerPoolSize", 0), ApiProfile.TUSHARE));
        assertThrows(IllegalArgumentException.class, () -> ClientSettings.fromConfiguration(
                new MapConfiguration().with("token", "abc").with("defaultMaxPages", -1), ApiProfile.TUSHARE));
    }

    @Test
    @DisplayName("Missing token is rejected")
    public void testMissingToken() {
        ClientSettings settings = ClientSettings.forProfile(ApiProfile.TUSHARE, " ");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, settings::validate);
        assertTrue(e.getMessage().contains("TUSHARE_TOKEN"));
    }

    @Test
    @DisplayName("System properties are read under the tushareplus. prefix")
    public void testSystemProperties() {
        System.setProperty("tushareplus.token", "from-property");
        System.setProperty("tushareplus.workerPoolSize", "2");
        try {
            ClientSettings settings = ClientSettings.fromConfiguration(new SystemPropertyConfiguration(), ApiProfile.TUSHARE);
            assertEquals("from-property", settings.getToken());
            assertEquals(2, settings.getWorkerPoolSize());
        } finally {
            System.clearProperty("tushareplus.token");
            System.clearProperty("tushareplus.workerPoolSize");
        }
    }
}
