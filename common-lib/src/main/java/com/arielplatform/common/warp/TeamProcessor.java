package com.arielplatform.common.warp;

/**
 * Pure per-team transformation applied by {@code processWithWarp}.
 */
@FunctionalInterface
public interface TeamProcessor {

    TeamProcessor IDENTITY = input -> input.clone();

    double[] process(double[] input);
}
