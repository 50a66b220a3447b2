package com.arielplatform.common.performance;

import com.arielplatform.common.exception.InvalidArgumentException;
import com.arielplatform.common.incentive.IncentiveConfig;
import com.arielplatform.common.incentive.IncentiveSystem;
import com.arielplatform.common.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceTrackerTest {

    private static final double EPS = 1e-9;

    private IncentiveSystem incentives;
    private PerformanceTracker tracker;

    @BeforeEach
    void setUp() {
        incentives = new IncentiveSystem(IncentiveConfig.defaults(),
                         new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
        tracker    = new PerformanceTracker(4, incentives);
    }

    private OptionalDouble recordAll(double... values) {
        OptionalDouble last = OptionalDouble.empty();
        for (double v : values) last = tracker.record(v);
        return last;
    }

    @Test
    @DisplayName("no trend until a full window has been recorded")
    void partialWindow() {
        assertTrue(recordAll(1, 2, 3).isEmpty());
        assertEquals(1.0, incentives.rewardScaling(), EPS);
    }

    @Test
    @DisplayName("rising window → trend +1, rewards scaled down")
    void risingTrend() {
        OptionalDouble trend = recordAll(0, 1, 2, 3);
        assertEquals(1.0, trend.getAsDouble(), EPS);
        assertEquals(0.95, incentives.rewardScaling(), EPS);
        assertEquals(1.05, incentives.penaltyScaling(), EPS);
    }

    @Test
    @DisplayName("falling window → trend -1, rewards scaled up")
    void fallingTrend() {
        assertEquals(-1.0, recordAll(3, 2, 1, 0).getAsDouble(), EPS);
        assertEquals(1.05, incentives.rewardScaling(), EPS);
    }

    @Test
    @DisplayName("only the latest window feeds the trend")
    void latestWindowOnly() {
        recordAll(0, 10, 20, 30);
        OptionalDouble second = recordAll(5, 5, 5, 5);
        assertEquals(0.0, second.getAsDouble(), EPS);
        assertEquals(0.0, tracker.lastTrend().getAsDouble(), EPS);
        assertEquals(8, tracker.history().size());
    }

    @Test
    @DisplayName("mean gradient uses central differences inside, one-sided at the ends")
    void gradient() {
        // gradient of [0, 1, 4, 9] = [1, 2, 4, 5], mean 3
        assertEquals(3.0, PerformanceTracker.meanGradient(List.of(0.0, 1.0, 4.0, 9.0)), EPS);
    }

    @Test
    @DisplayName("invalid window and non-finite samples are rejected")
    void validation() {
        assertThrows(InvalidArgumentException.class, () -> new PerformanceTracker(1, incentives));
        assertThrows(InvalidArgumentException.class, () -> tracker.record(Double.NaN));
    }
}
