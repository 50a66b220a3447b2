package com.arielplatform.common.performance;

import com.arielplatform.common.exception.InvalidArgumentException;
import com.arielplatform.common.incentive.IncentiveSystem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Task-performance history driving incentive homeostasis.
 *
 * <p>Every {@code adaptationWindow}-th sample the trend of the last window is computed
 * as the mean of its discrete gradient (central differences inside, one-sided at the
 * ends) and passed to {@link IncentiveSystem#adaptIncentives(double)}.
 */
public class PerformanceTracker {

    private final int adaptationWindow;
    private final IncentiveSystem incentives;
    private final List<Double> history = new ArrayList<>();

    private Double lastTrend;

    public PerformanceTracker(int adaptationWindow, IncentiveSystem incentives) {
        if (adaptationWindow < 2) {
            throw new InvalidArgumentException("performance", "Adaptation window must be >= 2: " + adaptationWindow);
        }
        this.adaptationWindow = adaptationWindow;
        this.incentives       = incentives;
    }

    /**
     * Appends a sample. Returns the trend when this sample completed a window.
     */
    public OptionalDouble record(double performance) {
        if (Double.isNaN(performance) || Double.isInfinite(performance)) {
            throw new InvalidArgumentException("performance", "Performance must be finite: " + performance);
        }
        history.add(performance);
        if (history.size() % adaptationWindow != 0) {
            return OptionalDouble.empty();
        }
        double trend = meanGradient(history.subList(history.size() - adaptationWindow, history.size()));
        lastTrend = trend;
        incentives.adaptIncentives(trend);
        return OptionalDouble.of(trend);
    }

    static double meanGradient(List<Double> values) {
        int n = values.size();
        double sum = (values.get(1) - values.get(0)) + (values.get(n - 1) - values.get(n - 2));
        for (int i = 1; i < n - 1; i++) {
            sum += (values.get(i + 1) - values.get(i - 1)) / 2.0;
        }
        return sum / n;
    }

    public List<Double> history() {
        return Collections.unmodifiableList(history);
    }

    public OptionalDouble lastTrend() {
        return lastTrend == null ? OptionalDouble.empty() : OptionalDouble.of(lastTrend);
    }

    public int adaptationWindow() {
        return adaptationWindow;
    }
}
