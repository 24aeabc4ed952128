package com.backstop.core.health;

import com.backstop.core.model.HealthBucket;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SystemHealthAggregatorTest {

    private final SystemHealthAggregator aggregator = new SystemHealthAggregator(new HealthProperties());

    private static Map<String, HealthBucket> buckets(int normal, int degraded, int nearFailed, int failed) {
        var map = new LinkedHashMap<String, HealthBucket>();
        for (int i = 0; i < normal; i++) map.put("n" + i, HealthBucket.NORMAL);
        for (int i = 0; i < degraded; i++) map.put("d" + i, HealthBucket.DEGRADED);
        for (int i = 0; i < nearFailed; i++) map.put("e" + i, HealthBucket.NEAR_FAILED);
        for (int i = 0; i < failed; i++) map.put("f" + i, HealthBucket.FAILED);
        return map;
    }

    @Nested
    @DisplayName("aggregate")
    class Aggregate {

        @Test
        @DisplayName("Nothing tracked is NORMAL at 100%")
        void empty() {
            var health = aggregator.aggregate(Map.of());

            assertEquals(SystemTier.NORMAL, health.tier());
            assertEquals(100.0, health.healthPercentage());
            assertFalse(health.canRecover());
        }

        @Test
        @DisplayName("One degraded of ten is exactly the threshold and stays NORMAL")
        void degradedThreshold() {
            assertEquals(SystemTier.NORMAL, aggregator.aggregate(buckets(9, 1, 0, 0)).tier());
            assertEquals(SystemTier.DEGRADED, aggregator.aggregate(buckets(8, 2, 0, 0)).tier());
        }

        @Test
        @DisplayName("Near-failed and failed above 30% is EMERGENCY")
        void emergency() {
            var health = aggregator.aggregate(buckets(6, 0, 2, 2));

            assertEquals(SystemTier.EMERGENCY, health.tier());
            assertEquals(2, health.degraded());
            assertEquals(2, health.failed());
            assertTrue(health.canRecover());
        }

        @Test
        @DisplayName("More than half failed is CRITICAL")
        void critical() {
            var health = aggregator.aggregate(buckets(1, 0, 0, 2));

            assertEquals(SystemTier.CRITICAL, health.tier());
            assertFalse(health.canRecover());
            assertEquals(100.0 / 3, health.healthPercentage(), 0.0001);
        }

        @Test
        @DisplayName("Half failed is not CRITICAL")
        void halfFailed() {
            assertEquals(SystemTier.EMERGENCY, aggregator.aggregate(buckets(2, 0, 0, 2)).tier());
        }
    }

    @Test
    @DisplayName("Thresholds come from configuration")
    void configurableThresholds() {
        var properties = new HealthProperties();
        properties.setDegradedRatio(0.5);

        assertEquals(SystemTier.NORMAL, new SystemHealthAggregator(properties).tierFor(10, 4, 0, 0));
    }

    @Test
    @DisplayName("initialTier follows the number of missing resources")
    void initialTier() {
        assertEquals(SystemTier.NORMAL, aggregator.initialTier(0));
        assertEquals(SystemTier.DEGRADED, aggregator.initialTier(5));
        assertEquals(SystemTier.EMERGENCY, aggregator.initialTier(6));
        assertEquals(SystemTier.EMERGENCY, aggregator.initialTier(15));
        assertEquals(SystemTier.CRITICAL, aggregator.initialTier(16));
    }
}
