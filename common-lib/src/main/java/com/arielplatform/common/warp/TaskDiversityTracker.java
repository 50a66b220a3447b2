package com.arielplatform.common.warp;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;

/**
 * Sliding window over recent inputs. Diversity is low once the window is full and
 * fewer than {@code threshold x window} of its entries are distinct. Detection only.
 */
public class TaskDiversityTracker {

    private final int windowSize;
    private final double threshold;
    private final Deque<List<Double>> history = new ArrayDeque<>();

    public TaskDiversityTracker(int windowSize, double threshold) {
        this.windowSize = windowSize;
        this.threshold  = threshold;
    }

    public void update(double[] task) {
        history.addLast(Arrays.stream(task).boxed().toList());
        if (history.size() > windowSize) {
            history.removeFirst();
        }
    }

    public boolean isLow() {
        if (history.size() < windowSize) {
            return false;
        }
        return diversity() < threshold;
    }

    /** Distinct entries over window size. */
    public double diversity() {
        return (double) new HashSet<>(history).size() / windowSize;
    }

    public int size() {
        return history.size();
    }
}
