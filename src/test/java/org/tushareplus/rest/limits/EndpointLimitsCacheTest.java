package org.tushareplus.rest.limits;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tushareplus.model.EndpointLimits;

import static org.junit.jupiter.api.Assertions.*;

public class EndpointLimitsCacheTest {

    @Test
    @DisplayName("put, get and evict")
    public void testLifecycle() {
        EndpointLimitsCache cache = new EndpointLimitsCache();
        EndpointLimits daily = EndpointLimits.of("daily", 6000, 500);

        assertTrue(cache.get("daily").isEmpty());
        cache.put(daily);
        assertSame(daily, cache.get("daily").orElseThrow());

        assertTrue(cache.evict("daily"));
        assertFalse(cache.evict("daily"));
        assertTrue(cache.get("daily").isEmpty());
    }

    @Test
    @DisplayName("Limits reject negative values and empty names")
    public void testLimitsValidation() {
        assertThrows(IllegalArgumentException.class, () -> EndpointLimits.of("", 1, 1));
        assertThrows(IllegalArgumentException.class, () -> EndpointLimits.of("daily", -1, 1));
        assertThrows(IllegalArgumentException.class, () -> EndpointLimits.of("daily", 1, -1));
    }

    @Test
    @DisplayName("withoutRateLimit keeps the cap and pins the rate to 0")
    public void testWithoutRateLimit() {
        EndpointLimits limits = EndpointLimits.of("daily", 6000, 500).withoutRateLimit();
        assertEquals(6000, limits.getPerRequestCap());
        assertTrue(limits.isRateUnrestricted());
    }
}
