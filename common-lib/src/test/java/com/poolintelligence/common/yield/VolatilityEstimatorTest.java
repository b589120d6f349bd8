package com.poolintelligence.common.yield;

import com.poolintelligence.common.model.PricePoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VolatilityEstimatorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    private static List<PricePoint> hourly(double... prices) {
        List<PricePoint> points = new ArrayList<>();
        for (int i = 0; i < prices.length; i++) {
            points.add(PricePoint.of(T0.plusSeconds(3600L * i), prices[i]));
        }
        return points;
    }

    @Nested
    @DisplayName("calcVolatilityAnn()")
    class SeriesTests {

        @Test
        @DisplayName("1–2 points → 0 with PROXY (not measured)")
        void tooFewPoints() {
            VolatilityEstimate one = VolatilityEstimator.calcVolatilityAnn(hourly(100), SamplingInterval.HOURLY);
            VolatilityEstimate two = VolatilityEstimator.calcVolatilityAnn(hourly(100, 101), SamplingInterval.HOURLY);
            assertEquals(0.0, one.volAnn());
            assertEquals(VolatilityMethod.PROXY, one.method());
            assertEquals(0.0, two.volAnn());
            assertEquals(VolatilityMethod.PROXY, two.method());
            assertFalse(two.isMeasured());
        }

        @Test
        @DisplayName("one wild outlier is clamped to 10")
        void outlierClamped() {
            VolatilityEstimate v = VolatilityEstimator.calcVolatilityAnn(
                hourly(100, 100, 1_000_000, 100, 100), SamplingInterval.HOURLY);
            assertEquals(10.0, v.volAnn());
            assertEquals(VolatilityMethod.LOG_RETURNS, v.method());
        }

        @Test
        @DisplayName("flat series is floored at 0.01")
        void flatFloored() {
            VolatilityEstimate v = VolatilityEstimator.calcVolatilityAnn(hourly(50, 50, 50, 50), SamplingInterval.HOURLY);
            assertEquals(0.01, v.volAnn());
            assertTrue(v.isMeasured());
        }

        @Test
        @DisplayName("input order does not matter — points are sorted by time")
        void sortsByTimestamp() {
            List<PricePoint> points = hourly(100, 102, 99, 101, 103);
            List<PricePoint> shuffled = new ArrayList<>(points);
            Collections.reverse(shuffled);
            assertEquals(
                VolatilityEstimator.calcVolatilityAnn(points, SamplingInterval.HOURLY),
                VolatilityEstimator.calcVolatilityAnn(shuffled, SamplingInterval.HOURLY));
        }

        @Test
        @DisplayName("5-minute sampling annualizes with √105120")
        void fiveMinuteAnnualization() {
            List<PricePoint> points = hourly(100, 100.1, 100.05, 100.12);
            double hourlyVol = VolatilityEstimator.calcVolatilityAnn(points, SamplingInterval.HOURLY).volAnn();
            double fiveMinVol = VolatilityEstimator.calcVolatilityAnn(points, SamplingInterval.FIVE_MINUTE).volAnn();
            assertEquals(Math.sqrt(12), fiveMinVol / hourlyVol, 1e-9);
        }

        @Test
        @DisplayName("null series → not measured")
        void nullSeries() {
            assertFalse(VolatilityEstimator.calcVolatilityAnn(null, SamplingInterval.HOURLY).isMeasured());
        }
    }

    @Nested
    @DisplayName("calcVolatilityProxy()")
    class ProxyTests {

        @Test
        @DisplayName("|ln(now/ago)| · √8760")
        void formula() {
            double expected = Math.abs(Math.log(100.5 / 100)) * Math.sqrt(8760);
            assertEquals(expected, VolatilityEstimator.calcVolatilityProxy(100.5, 100).volAnn(), 1e-12);
        }

        @Test
        @DisplayName("clamped to [0.05, 3.0]")
        void clamped() {
            assertEquals(0.05, VolatilityEstimator.calcVolatilityProxy(100, 100).volAnn());
            assertEquals(3.0, VolatilityEstimator.calcVolatilityProxy(110, 100).volAnn());
        }

        @Test
        @DisplayName("non-positive price → 0 / PROXY")
        void nonPositive() {
            VolatilityEstimate v = VolatilityEstimator.calcVolatilityProxy(0, 100);
            assertEquals(0.0, v.volAnn());
            assertEquals(VolatilityMethod.PROXY, v.method());
            assertEquals(0, v.dataPoints());
        }
    }
}
