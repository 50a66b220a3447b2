package com.arielplatform.common.incentive;

import com.arielplatform.common.exception.InvalidArgumentException;

import java.util.EnumMap;
import java.util.Map;

/**
 * Base weights per category and the bounds of the two scaling factors.
 * Reward weights must be positive and penalty weights negative.
 */
public record IncentiveConfig(
    Map<IncentiveCategory, Double> weights,
    double minScaling,
    double maxScaling
) {

    public static final double DEFAULT_MIN_SCALING = 0.5;
    public static final double DEFAULT_MAX_SCALING = 1.5;

    public IncentiveConfig {
        EnumMap<IncentiveCategory, Double> copy = new EnumMap<>(IncentiveCategory.class);
        for (IncentiveCategory c : IncentiveCategory.values()) {
            double w = weights != null && weights.containsKey(c) ? weights.get(c) : c.defaultWeight();
            boolean signOk = c.kind() == IncentiveKind.REWARD ? w > 0 : w < 0;
            if (!signOk) {
                throw new InvalidArgumentException("incentive",
                    "Weight for " + c.key() + " has the wrong sign: " + w);
            }
            copy.put(c, w);
        }
        if (minScaling <= 0 || minScaling > 1.0 || maxScaling < 1.0) {
            throw new InvalidArgumentException("incentive",
                "Scaling bounds must satisfy 0 < min <= 1 <= max: [" + minScaling + ", " + maxScaling + "]");
        }
        weights = Map.copyOf(copy);
    }

    public static IncentiveConfig defaults() {
        return new IncentiveConfig(Map.of(), DEFAULT_MIN_SCALING, DEFAULT_MAX_SCALING);
    }

    public double weight(IncentiveCategory category) {
        return weights.get(category);
    }
}
