package org.tushareplus.rest;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tushareplus.model.ApiProfile;
import org.tushareplus.model.EndpointLimits;
import org.tushareplus.model.FetchOptions;
import org.tushareplus.model.FetchResult;
import org.tushareplus.model.PageResult;
import org.tushareplus.model.TransportResponse;
import org.tushareplus.rest.config.ClientSettings;
import org.tushareplus.rest.exception.ProbeFailedException;
import org.tushareplus.rest.limits.InMemoryLimitStore;
import org.tushareplus.tests.base.ManualClock;
import org.tushareplus.tests.base.ScriptedTransport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class DataApiClientTest {

    private static final String RATE_LIMITED = "抱歉，您每分钟最多访问该接口%d次";

    private ManualClock clock;
    private InMemoryLimitStore store;
    private DataApiClient client;

    @BeforeEach
    public void setUp() {
        clock = new ManualClock();
        store = new InMemoryLimitStore();
    }

    @AfterEach
    public void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    private DataApiClient client(ScriptedTransport transport, ApiProfile profile) {
        ClientSettings settings = ClientSettings.forProfile(profile, "token");
        settings.setRetryDelaySeconds(0);
        client = new DataApiClient(settings, transport, store, clock);
        return client;
    }

    /**
     * Simulated service: a table of {@code total} rows, at most {@code cap} rows per request,
     * rejecting rate calibration requests after {@code rate} successes.
     */
    private static ScriptedTransport service(int total, int cap, int rate) {
        AtomicInteger rateProbes = new AtomicInteger();
        ScriptedTransport table = ScriptedTransport.table(total, cap, true);
        return new ScriptedTransport((endpoint, params) -> {
            boolean calibration = !params.containsKey("offset") && Integer.valueOf(100).equals(params.get("limit"));
            if (calibration && rateProbes.incrementAndGet() > rate) {
                return TransportResponse.failure(40203, String.format(RATE_LIMITED, rate));
            }
            return table.send(endpoint, "token", params, List.of());
        });
    }

    @Test
    @DisplayName("First getLimits probes and persists, later calls are served from memory")
    public void testGetLimitsIsIdempotent() {
        ScriptedTransport transport = service(10, 2, 3);
        DataApiClient client = client(transport, ApiProfile.TUSHARE);

        EndpointLimits first = client.getLimits("daily");
        int callsAfterProbe = transport.callCount();
        EndpointLimits second = client.getLimits("daily");

        assertEquals(2, first.getPerRequestCap());
        assertEquals(3, first.getRatePerMinute());
        assertEquals(first, second);
        assertEquals(5, callsAfterProbe, "One cap probe and four rate calibration calls");
        assertEquals(callsAfterProbe, transport.callCount());
        assertEquals(first, store.get("daily").orElseThrow());
    }

    @Test
    @DisplayName("Stored limits are used without probing")
    public void testStoredLimits() {
        store.put(EndpointLimits.of("daily", 6000, 500));
        ScriptedTransport transport = service(10, 2, 3);

        EndpointLimits limits = client(transport, ApiProfile.TUSHARE).getLimits("daily");

        assertEquals(6000, limits.getPerRequestCap());
        assertEquals(500, limits.getRatePerMinute());
        assertEquals(0, transport.callCount());
    }

    @Test
    @DisplayName("clearLimits forgets memory and store, the next call probes again")
    public void testClearLimits() {
        ScriptedTransport transport = service(10, 2, 3);
        DataApiClient client = client(transport, ApiProfile.TUSHARE);
        client.getLimits("daily");
        int callsAfterProbe = transport.callCount();

        client.clearLimits("daily");
        assertTrue(store.get("daily").isEmpty());

        client.getLimits("daily");
        assertTrue(transport.callCount() > callsAfterProbe);
        assertTrue(store.get("daily").isPresent());
    }

    @Test
    @DisplayName("forceRedetect replaces stored limits")
    public void testForceRedetect() {
        store.put(EndpointLimits.of("daily", 6000, 500));
        ScriptedTransport transport = service(10, 2, 3);

        EndpointLimits limits = client(transport, ApiProfile.TUSHARE).forceRedetect("daily");

        assertEquals(2, limits.getPerRequestCap());
        assertEquals(3, limits.getRatePerMinute());
        assertEquals(limits, store.get("daily").orElseThrow());
    }

    @Test
    @DisplayName("forceRedetect rethrows a failed detection")
    public void testForceRedetectFailure() {
        ScriptedTransport transport = new ScriptedTransport((endpoint, params) -> params.containsKey("limit")
                ? TransportResponse.failure(40101, "token invalid")
                : ScriptedTransport.page(2000, true));
        DataApiClient client = client(transport, ApiProfile.TUSHARE);

        assertThrows(ProbeFailedException.class, () -> client.forceRedetect("daily"));
        assertTrue(store.get("daily").isEmpty());
    }

    @Test
    @DisplayName("Rate limiting disabled: only the cap is probed and stored rates are ignored")
    public void testRateLimitDisabled() {
        ScriptedTransport transport = service(10, 2, 3);
        DataApiClient client = client(transport, ApiProfile.DATACUBE);

        EndpointLimits probed = client.getLimits("daily");
        assertEquals(2, probed.getPerRequestCap());
        assertEquals(0, probed.getRatePerMinute());
        assertEquals(1, transport.callCount());

        store.put(EndpointLimits.of("weekly", 2, 1));
        assertEquals(0, client.getLimits("weekly").getRatePerMinute());
        for (int i = 0; i < 5; i++) {
            client.fetch("weekly", List.of(), new HashMap<>(), FetchOptions.singleRequest());
        }
        assertEquals(Duration.ZERO, clock.slept(), "The rate limiter is never consulted");
    }

    @Test
    @DisplayName("Rate limiting enabled: requests beyond the stored rate wait for the window")
    public void testRateLimitEnforced() {
        store.put(EndpointLimits.of("daily", 2, 2));
        ScriptedTransport transport = service(10, 2, 3);
        DataApiClient client = client(transport, ApiProfile.TUSHARE);
        client.getLimits("daily");

        for (int i = 0; i < 3; i++) {
            client.fetch("daily", List.of(), new HashMap<>(), FetchOptions.singleRequest());
        }

        assertEquals(Duration.ofSeconds(60), clock.slept());
    }

    @Test
    @DisplayName("Sequential fetch: cap 2, 5 rows -> 3 pages in order")
    public void testSequentialFetch() {
        store.put(EndpointLimits.of("daily", 2, 0));
        ScriptedTransport transport = service(5, 2, 3);

        FetchResult result = client(transport, ApiProfile.TUSHARE)
                .fetch("daily", ScriptedTransport.FIELDS, Map.of("ts_code", "000001.SZ"));

        assertEquals(3, transport.callCount());
        assertEquals(5, result.size());
        assertEquals("000004.SZ", result.column("ts_code").get(4));
        assertEquals("20240102", result.toRecords().get(0).get("trade_date"));
    }

    @Test
    @DisplayName("Concurrent fetch returns every row")
    public void testConcurrentFetch() {
        store.put(EndpointLimits.of("daily", 2, 0));
        ScriptedTransport transport = service(9, 2, 3);

        FetchResult result = client(transport, ApiProfile.TUSHARE)
                .fetch("daily", List.of(), new HashMap<>(), FetchOptions.concurrentPages(null));

        assertEquals(9, result.size());
        List<Object> codes = new ArrayList<>(result.column("ts_code"));
        for (int i = 0; i < 9; i++) {
            assertTrue(codes.contains(String.format("%06d.SZ", i)));
        }
    }

    @Test
    @DisplayName("Required parameters are sent with probe requests")
    public void testRequiredParamsUsedForProbing() {
        List<Map<String, Object>> probes = new ArrayList<>();
        ScriptedTransport transport = new ScriptedTransport((endpoint, params) -> {
            probes.add(new HashMap<>(params));
            if (params.containsKey("limit")) {
                return TransportResponse.failure(40203, String.format(RATE_LIMITED, 1));
            }
            return TransportResponse.success(new PageResult(List.of("con_code"), List.of(), false));
        });
        DataApiClient client = client(transport, ApiProfile.TUSHARE);

        assertEquals(ApiProfile.TUSHARE, client.getSettings().getProfile());
        client.getLimits("index_weight");
        assertEquals("000906.SH", probes.get(0).get("index_code"));

        client.registerRequiredParams("index_weight", Map.of("index_code", "000300.SH"));
        assertEquals(Map.of("index_code", "000300.SH"), client.getRequiredParams("index_weight"));
        client.forceRedetect("index_weight");
        assertEquals("000300.SH", probes.get(probes.size() - 1).get("index_code"));
    }

    @Test
    @DisplayName("Missing token is rejected at construction")
    public void testMissingToken() {
        ClientSettings settings = ClientSettings.forProfile(ApiProfile.TUSHARE, null);
        assertThrows(IllegalArgumentException.class,
                () -> new DataApiClient(settings, service(1, 1, 1), store, clock));
    }
}
