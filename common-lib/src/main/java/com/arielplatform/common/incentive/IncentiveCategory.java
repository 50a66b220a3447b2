package com.arielplatform.common.incentive;

import com.arielplatform.common.emotion.Emotion;
import com.arielplatform.common.exception.InvalidArgumentException;

import java.util.Locale;

/**
 * The eight reward / penalty classes, each with its default base weight and
 * its fixed two-emotion update rule.
 *
 * <h3>Emotion rules</h3>
 * <pre>
 * REWARD   curiosity       surprise x0.5, joy x0.3
 *          efficiency      joy x0.4,      trust x0.2
 *          cooperation     trust x0.5,    joy x0.2
 *          innovation      surprise x0.3, joy x0.4
 * PENALTY  error           sadness x0.4,  surprise x0.2
 *          resource_waste  disgust x0.3,  anger x0.3
 *          conflict        anger x0.5,    fear x0.2
 *          stagnation      sadness x0.4,  disgust x0.2
 * </pre>
 * Penalty values are negative, so their emotion deltas are taken from
 * {@code -scaled}: a penalty always raises the listed emotions.
 */
public enum IncentiveCategory {
    CURIOSITY     (IncentiveKind.REWARD,   5.0, Emotion.SURPRISE, 0.5, Emotion.JOY,      0.3),
    EFFICIENCY    (IncentiveKind.REWARD,   3.0, Emotion.JOY,      0.4, Emotion.TRUST,    0.2),
    COOPERATION   (IncentiveKind.REWARD,   4.0, Emotion.TRUST,    0.5, Emotion.JOY,      0.2),
    INNOVATION    (IncentiveKind.REWARD,   6.0, Emotion.SURPRISE, 0.3, Emotion.JOY,      0.4),
    ERROR         (IncentiveKind.PENALTY, -3.0, Emotion.SADNESS,  0.4, Emotion.SURPRISE, 0.2),
    RESOURCE_WASTE(IncentiveKind.PENALTY, -4.0, Emotion.DISGUST,  0.3, Emotion.ANGER,    0.3),
    CONFLICT      (IncentiveKind.PENALTY, -5.0, Emotion.ANGER,    0.5, Emotion.FEAR,     0.2),
    STAGNATION    (IncentiveKind.PENALTY, -2.0, Emotion.SADNESS,  0.4, Emotion.DISGUST,  0.2);

    private final IncentiveKind kind;
    private final double defaultWeight;
    private final Emotion primaryEmotion;
    private final double primaryFactor;
    private final Emotion secondaryEmotion;
    private final double secondaryFactor;

    IncentiveCategory(IncentiveKind kind, double defaultWeight,
                      Emotion primaryEmotion, double primaryFactor,
                      Emotion secondaryEmotion, double secondaryFactor) {
        this.kind             = kind;
        this.defaultWeight    = defaultWeight;
        this.primaryEmotion   = primaryEmotion;
        this.primaryFactor    = primaryFactor;
        this.secondaryEmotion = secondaryEmotion;
        this.secondaryFactor  = secondaryFactor;
    }

    public IncentiveKind kind()           { return kind; }
    public double defaultWeight()         { return defaultWeight; }
    public Emotion primaryEmotion()       { return primaryEmotion; }
    public double primaryFactor()         { return primaryFactor; }
    public Emotion secondaryEmotion()     { return secondaryEmotion; }
    public double secondaryFactor()       { return secondaryFactor; }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses a reward name such as {@code "curiosity"}; penalties are rejected. */
    public static IncentiveCategory reward(String name) {
        return parse(name, IncentiveKind.REWARD);
    }

    /** Parses a penalty name such as {@code "resource_waste"}; rewards are rejected. */
    public static IncentiveCategory penalty(String name) {
        return parse(name, IncentiveKind.PENALTY);
    }

    private static IncentiveCategory parse(String name, IncentiveKind expected) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (IncentiveCategory c : values()) {
                if (c.name().equals(normalized) && c.kind == expected) return c;
            }
        }
        throw new InvalidArgumentException("incentive",
            "Unknown " + expected.name().toLowerCase(Locale.ROOT) + " type: " + name);
    }
}
