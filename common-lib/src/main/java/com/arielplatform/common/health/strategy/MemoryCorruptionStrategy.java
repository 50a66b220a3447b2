package com.arielplatform.common.health.strategy;

import com.arielplatform.common.health.HealthMetric;
import com.arielplatform.common.health.RecoveryContext;
import com.arielplatform.common.health.RecoveryOutcome;
import com.arielplatform.common.health.RecoveryStrategy;
import com.arielplatform.common.memory.ProbabilisticMemoryStore;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Always reoptimises the memory layout. Above severity 7 it also performs a lossy
 * scrub-and-restore: slots holding a normalised value above 0.7 are snapshotted,
 * every other slot is zeroed with probability {@code severity / 10}, and the snapshot
 * is written back.
 */
public class MemoryCorruptionStrategy implements RecoveryStrategy {

    public static final String KEY = "memory_corruption";

    private static final double DEEP_SEVERITY      = 7.0;
    private static final double CRITICAL_SLOT_VALUE = 0.7;

    private final Random random;

    public MemoryCorruptionStrategy(Random random) {
        this.random = random;
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public HealthMetric metric() {
        return HealthMetric.MEMORY_INTEGRITY;
    }

    @Override
    public Mono<RecoveryOutcome> apply(double severity, RecoveryContext context) {
        return Mono.fromCallable(() -> {
            ProbabilisticMemoryStore memory = context.memory();
            memory.optimizeLayout();

            if (severity <= DEEP_SEVERITY) {
                return new RecoveryOutcome("Memory layout optimization performed", Math.min(15, severity * 2));
            }

            Map<Integer, Double> backups = new LinkedHashMap<>();
            for (int i = 0; i < memory.size(); i++) {
                if (memory.peek(i) > CRITICAL_SLOT_VALUE) {
                    backups.put(i, memory.retrieve(i));
                }
            }
            double resetProbability = severity / 10;
            for (int i = 0; i < memory.size(); i++) {
                if (!backups.containsKey(i) && random.nextDouble() < resetProbability) {
                    memory.store(i, 0.0);
                }
            }
            backups.forEach(memory::store);

            return new RecoveryOutcome("Deep memory healing performed", Math.min(30, severity * 3));
        });
    }
}
