package com.arielplatform.common.warp;

import com.arielplatform.common.exception.InvalidArgumentException;

import java.util.List;

/**
 * Merges per-team outputs into one vector.
 *
 * <p>At light speed every output counts equally. Otherwise outputs are averaged with
 * the phase weights {@code [0.1, 0.2, 0.3, 0.4]} truncated to the number of outputs and
 * normalised by their sum, so two outputs {@code a}, {@code b} combine to
 * {@code (0.1a + 0.2b) / 0.3}. Outputs past the fourth carry no weight.
 */
public final class ResultCombiner {

    static final double[] PHASE_WEIGHTS = {0.1, 0.2, 0.3, 0.4};

    private ResultCombiner() {}

    public static double[] combine(List<double[]> results, boolean lightSpeed) {
        int width = validate(results);
        return lightSpeed ? mean(results, width) : weighted(results, width);
    }

    /**
     * Shared width of all outputs; rejects an empty list or ragged outputs.
     */
    public static int validate(List<double[]> results) {
        if (results.isEmpty()) {
            throw new InvalidArgumentException("warp", "No team outputs to combine");
        }
        int width = results.get(0).length;
        for (double[] r : results) {
            if (r.length != width) {
                throw new InvalidArgumentException("warp",
                    "Team output shapes differ: " + width + " vs " + r.length);
            }
        }
        return width;
    }

    private static double[] mean(List<double[]> results, int width) {
        double[] out = new double[width];
        for (double[] r : results) {
            for (int i = 0; i < width; i++) {
                out[i] += r[i];
            }
        }
        for (int i = 0; i < width; i++) {
            out[i] /= results.size();
        }
        return out;
    }

    private static double[] weighted(List<double[]> results, int width) {
        int slots = Math.min(results.size(), PHASE_WEIGHTS.length);
        double weightSum = 0.0;
        double[] out = new double[width];
        for (int t = 0; t < slots; t++) {
            double w = PHASE_WEIGHTS[t];
            weightSum += w;
            double[] r = results.get(t);
            for (int i = 0; i < width; i++) {
                out[i] += w * r[i];
            }
        }
        for (int i = 0; i < width; i++) {
            out[i] /= weightSum;
        }
        return out;
    }
}
