package com.arielplatform.orchestrator.memory;

import com.arielplatform.common.exception.InvalidArgumentException;
import com.arielplatform.common.exception.OutOfRangeException;
import com.arielplatform.common.memory.ProbabilisticMemoryStore;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Classical simulation of a probabilistic memory: slot values normalised to [0, 1],
 * gaussian read noise and a symmetric entanglement map that pulls paired slots toward
 * their mean.
 *
 * <p>The last {@value #ACCESS_HISTORY} stores and retrievals are kept;
 * {@link #optimizeLayout()} moves the most accessed slots to the lowest indices and
 * remaps the entanglement map with them.
 */
public class ClassicalMemoryBank implements ProbabilisticMemoryStore {

    static final int    ACCESS_HISTORY = 100;
    static final double READ_NOISE     = 0.05;

    enum AccessType { STORE, RETRIEVE }

    private record Access(AccessType type, int index) {}

    private final int size;
    private final Random random;
    private final Deque<Access> accessHistory = new ArrayDeque<>();

    private double[] values;
    private double[][] entanglement;

    public ClassicalMemoryBank(int size, Random random) {
        if (size <= 0) {
            throw new InvalidArgumentException("memory", "Memory size must be positive: " + size);
        }
        this.size         = size;
        this.random       = random;
        this.values       = new double[size];
        this.entanglement = new double[size][size];
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public void store(int index, double value) {
        checkIndex(index);
        values[index] = Math.max(0.0, Math.min(1.0, value / 100.0));
        recordAccess(AccessType.STORE, index);
    }

    @Override
    public double retrieve(int index) {
        checkIndex(index);
        recordAccess(AccessType.RETRIEVE, index);
        double noisy = values[index] + random.nextGaussian() * READ_NOISE;
        return Math.max(0.0, Math.min(1.0, noisy)) * 100.0;
    }

    @Override
    public double peek(int index) {
        checkIndex(index);
        return values[index];
    }

    /**
     * Mixes both slots toward their mean by {@code strength} and records the pair.
     */
    public void entangle(int first, int second, double strength) {
        checkIndex(first);
        checkIndex(second);
        if (strength < 0.0 || strength > 1.0) {
            throw new InvalidArgumentException("memory", "Entanglement strength must be in [0, 1]: " + strength);
        }
        entanglement[first][second] = strength;
        entanglement[second][first] = strength;

        double mean = (values[first] + values[second]) / 2;
        values[first]  = (1 - strength) * values[first]  + strength * mean;
        values[second] = (1 - strength) * values[second] + strength * mean;
    }

    public double entanglement(int first, int second) {
        checkIndex(first);
        checkIndex(second);
        return entanglement[first][second];
    }

    /** Access count per slot over the retained history, every slot present. */
    public Map<Integer, Integer> accessPatterns() {
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (int i = 0; i < size; i++) {
            counts.put(i, 0);
        }
        for (Access a : accessHistory) {
            counts.merge(a.index(), 1, Integer::sum);
        }
        return counts;
    }

    @Override
    public void optimizeLayout() {
        Map<Integer, Integer> counts = accessPatterns();
        // stable: equally accessed slots keep their relative order
        int[] order = IntStream.range(0, size).boxed()
            .sorted(Comparator.comparing((Integer i) -> counts.get(i)).reversed())
            .mapToInt(Integer::intValue)
            .toArray();

        double[] newValues = new double[size];
        double[][] newEntanglement = new double[size][size];
        for (int i = 0; i < size; i++) {
            newValues[i] = values[order[i]];
            for (int j = 0; j < size; j++) {
                newEntanglement[i][j] = entanglement[order[i]][order[j]];
            }
        }
        values       = newValues;
        entanglement = newEntanglement;
    }

    public double[] values() {
        return Arrays.copyOf(values, size);
    }

    private void recordAccess(AccessType type, int index) {
        accessHistory.addLast(new Access(type, index));
        if (accessHistory.size() > ACCESS_HISTORY) {
            accessHistory.removeFirst();
        }
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new OutOfRangeException("memory", index, size);
        }
    }
}
