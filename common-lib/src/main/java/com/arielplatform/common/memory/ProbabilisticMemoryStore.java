package com.arielplatform.common.memory;

/**
 * Slot-addressed probabilistic memory owned by the host agent. Internals are opaque
 * to the control loop.
 *
 * <p>Every indexed operation fails with
 * {@link com.arielplatform.common.exception.OutOfRangeException} on an index outside
 * {@code [0, size())}.
 */
public interface ProbabilisticMemoryStore {

    int size();

    /** Stores {@code value} on the 0–100 scale; values outside are clamped. */
    void store(int index, double value);

    /** Noisy read on the 0–100 scale. Counts as an access. */
    double retrieve(int index);

    /** Exact normalised value in [0, 1]. Side-effect free, not counted as an access. */
    double peek(int index);

    /** Reorders slots by access frequency. */
    void optimizeLayout();
}
