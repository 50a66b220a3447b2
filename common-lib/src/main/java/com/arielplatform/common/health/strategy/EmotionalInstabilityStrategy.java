package com.arielplatform.common.health.strategy;

import com.arielplatform.common.emotion.Emotion;
import com.arielplatform.common.emotion.EmotionalState;
import com.arielplatform.common.health.HealthMetric;
import com.arielplatform.common.health.RecoveryContext;
import com.arielplatform.common.health.RecoveryOutcome;
import com.arielplatform.common.health.RecoveryStrategy;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Pulls the three emotions furthest from the median back toward it.
 *
 * <p>The median is taken once, before any nudge. Each nudge goes through
 * {@link EmotionalState#updateEmotion(Emotion, double)}, so the usual decay of the
 * other channels applies between nudges and each adjustment reads the intensity as
 * it stands at that moment.
 */
public class EmotionalInstabilityStrategy implements RecoveryStrategy {

    public static final String KEY = "emotional_instability";

    private static final int    REBALANCED_COUNT = 3;
    private static final double MAX_PULL         = 0.5;

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public HealthMetric metric() {
        return HealthMetric.EMOTIONAL_BALANCE;
    }

    @Override
    public Mono<RecoveryOutcome> apply(double severity, RecoveryContext context) {
        return Mono.fromCallable(() -> {
            EmotionalState state = context.emotionalState();
            double median = median(state);

            List<Emotion> extremes = new ArrayList<>(Arrays.asList(Emotion.values()));
            // stable sort: equal deviations stay in enum order
            extremes.sort(Comparator.comparingDouble(
                (Emotion e) -> Math.abs(state.intensity(e) - median)).reversed());
            extremes = extremes.subList(0, REBALANCED_COUNT);

            double pull = Math.min(MAX_PULL, severity / 10);
            for (Emotion e : extremes) {
                double adjustment = (median - state.intensity(e)) * pull;
                state.updateEmotion(e, adjustment);
            }

            List<String> names = extremes.stream().map(Emotion::key).toList();
            return new RecoveryOutcome("Emotional rebalancing performed on " + names,
                Math.min(25, severity * 2.5));
        });
    }

    static double median(EmotionalState state) {
        double[] values = Arrays.stream(Emotion.values())
            .mapToDouble(state::intensity)
            .sorted()
            .toArray();
        int mid = values.length / 2;
        return values.length % 2 == 0 ? (values[mid - 1] + values[mid]) / 2 : values[mid];
    }
}
