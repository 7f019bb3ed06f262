package org.tushareplus.rest.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tushareplus.model.ApiProfile;
import org.tushareplus.model.EndpointLimits;
import org.tushareplus.model.TransportResponse;
import org.tushareplus.rest.exception.ProbeFailedException;
import org.tushareplus.rest.exception.TransportException;
import org.tushareplus.rest.limits.InMemoryLimitStore;
import org.tushareplus.rest.ratelimit.SlidingWindowRateLimiter;
import org.tushareplus.tests.base.ManualClock;
import org.tushareplus.tests.base.ScriptedTransport;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class LimitProbeTest {

    private static final String RATE_LIMITED = "抱歉，您每分钟最多访问该接口3次";

    private ManualClock clock;
    private SlidingWindowRateLimiter rateLimiter;
    private InMemoryLimitStore store;

    @BeforeEach
    public void setUp() {
        clock = new ManualClock();
        rateLimiter = new SlidingWindowRateLimiter(clock);
        store = new InMemoryLimitStore();
    }

    private LimitProbe probe(ScriptedTransport transport) {
        return new LimitProbe(transport, "token", store, rateLimiter, ApiProfile.TUSHARE, clock);
    }

    /** Answers cap probes (no limit) with {@code capResponse} and rate probes with {@code successes} pages. */
    private static ScriptedTransport endpoint(TransportResponse capResponse, int successes) {
        AtomicInteger rateCalls = new AtomicInteger();
        return new ScriptedTransport((endpoint, params) -> {
            if (!params.containsKey("limit")) {
                return capResponse;
            }
            return rateCalls.incrementAndGet() <= successes
                    ? ScriptedTransport.page(100, true)
                    : TransportResponse.failure(40203, RATE_LIMITED);
        });
    }

    @Test
    @DisplayName("Cap: has_more=true means the row count is the cap")
    public void testCapFromHasMore() {
        ScriptedTransport transport = endpoint(ScriptedTransport.page(6000, true), 0);
        assertEquals(6000, probe(transport).probeRequestCap("daily", Map.of("limit", 10, "ts_code", "000001.SZ")));
        assertFalse(transport.getCalls().get(0).containsKey("limit"), "Cap probe must not send a limit");
        assertEquals("000001.SZ", transport.getCalls().get(0).get("ts_code"));
    }

    @Test
    @DisplayName("Cap: has_more=false means no cap")
    public void testNoCap() {
        assertEquals(0, probe(endpoint(ScriptedTransport.page(8000, false), 0)).probeRequestCap("daily", Map.of()));
    }

    @Test
    @DisplayName("Cap without has_more: a multiple of 1000 is taken as the cap, anything else as uncapped")
    public void testCapHeuristic() {
        assertEquals(3000, probe(endpoint(ScriptedTransport.page(3000, null), 0)).probeRequestCap("daily", Map.of()));
        assertEquals(0, probe(endpoint(ScriptedTransport.page(123, null), 0)).probeRequestCap("daily", Map.of()));
        assertEquals(0, probe(endpoint(ScriptedTransport.empty(), 0)).probeRequestCap("daily", Map.of()));
    }

    @Test
    @DisplayName("Cap: any failure falls back to the default cap")
    public void testCapFallback() {
        assertEquals(EndpointLimits.DEFAULT_PER_REQUEST_CAP,
                probe(endpoint(TransportResponse.failure(2002, "no permission"), 0)).probeRequestCap("daily", Map.of()));

        ScriptedTransport broken = new ScriptedTransport((endpoint, params) -> {
            throw new TransportException(endpoint, "Connection refused");
        });
        assertEquals(EndpointLimits.DEFAULT_PER_REQUEST_CAP, probe(broken).probeRequestCap("daily", Map.of()));
    }

    @Test
    @DisplayName("Rate: successes before the rate-limit message, calls recorded in the limiter")
    public void testRateProbe() {
        ScriptedTransport transport = endpoint(ScriptedTransport.page(1, false), 3);

        assertEquals(3, probe(transport).probeRateLimit("daily", Map.of()));
        assertEquals(4, transport.callCount());
        assertEquals(100, transport.getCalls().get(0).get("limit"));
        assertEquals(3, rateLimiter.historySize("daily"));
    }

    @Test
    @DisplayName("Rate: immediate rejection still reports at least 1")
    public void testRateAtLeastOne() {
        assertEquals(1, probe(endpoint(ScriptedTransport.page(1, false), 0)).probeRateLimit("daily", Map.of()));
    }

    @Test
    @DisplayName("Rate: the burst ends when the window elapses")
    public void testRateWindowElapses() {
        ScriptedTransport transport = new ScriptedTransport((endpoint, params) -> {
            clock.advance(Duration.ofSeconds(10));
            return ScriptedTransport.page(100, true);
        });

        assertEquals(6, probe(transport).probeRateLimit("daily", Map.of()));
    }

    @Test
    @DisplayName("Rate: errors other than the rate-limit message fail the probe")
    public void testRateProbeFails() {
        ScriptedTransport transport = new ScriptedTransport((endpoint, params) -> TransportResponse.failure(40101, "token invalid"));

        ProbeFailedException e = assertThrows(ProbeFailedException.class, () -> probe(transport).probeRateLimit("daily", Map.of()));
        assertEquals("daily", e.getEndpoint());
        assertTrue(e.getMessage().contains("token invalid"));
    }

    @Test
    @DisplayName("probeLimits persists cap and rate")
    public void testProbeLimitsPersists() {
        EndpointLimits limits = probe(endpoint(ScriptedTransport.page(6000, true), 2)).probeLimits("daily", Map.of());

        assertEquals(6000, limits.getPerRequestCap());
        assertEquals(2, limits.getRatePerMinute());
        assertEquals(limits, store.get("daily").orElseThrow());
    }

    @Test
    @DisplayName("probeLimits without rate detection sends a single request and stores rate 0")
    public void testProbeLimitsWithoutRate() {
        ScriptedTransport transport = endpoint(ScriptedTransport.page(2000, null), 5);

        EndpointLimits limits = probe(transport).probeLimits("daily", Map.of(), false);

        assertEquals(2000, limits.getPerRequestCap());
        assertEquals(0, limits.getRatePerMinute());
        assertEquals(1, transport.callCount());
        assertEquals(0, store.get("daily").orElseThrow().getRatePerMinute());
    }
}
