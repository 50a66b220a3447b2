package com.arielplatform.common.emotion;

import com.arielplatform.common.exception.InvalidArgumentException;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded affective state of one agent.
 *
 * <p>Eight intensities in [0, 100] plus three derived metrics that are pure
 * functions of the intensities and are recomputed after every mutation:
 * <pre>
 *   stability        = (joy + trust - fear - anger) / 2
 *   adaptability     = (anticipation + surprise - sadness) / 2
 *   social_alignment = trust - disgust
 * </pre>
 * The derived metrics are not clamped.
 *
 * <p>Not thread-safe; owned by a single agent.
 */
public class EmotionalState {

    public static final double MIN_INTENSITY     = 0.0;
    public static final double MAX_INTENSITY     = 100.0;
    public static final double DEFAULT_INTENSITY = 50.0;
    public static final double DEFAULT_DECAY     = 0.9;

    private final EnumMap<Emotion, Double> intensities = new EnumMap<>(Emotion.class);
    private final double defaultDecay;

    private double stability;
    private double adaptability;
    private double socialAlignment;

    public EmotionalState() {
        this(DEFAULT_DECAY);
    }

    public EmotionalState(double defaultDecay) {
        requireDecay(defaultDecay);
        this.defaultDecay = defaultDecay;
        for (Emotion e : Emotion.values()) {
            intensities.put(e, DEFAULT_INTENSITY);
        }
        updateDerivedMetrics();
    }

    /**
     * Builds a state from eight intensities in {@link Emotion} order.
     */
    public static EmotionalState of(double... values) {
        Emotion[] emotions = Emotion.values();
        if (values == null || values.length != emotions.length) {
            throw new InvalidArgumentException("emotion",
                "Expected " + emotions.length + " intensities, got " + (values == null ? 0 : values.length));
        }
        EmotionalState state = new EmotionalState();
        for (int i = 0; i < emotions.length; i++) {
            if (values[i] < MIN_INTENSITY || values[i] > MAX_INTENSITY) {
                throw new InvalidArgumentException("emotion",
                    emotions[i].key() + " intensity out of [0, 100]: " + values[i]);
            }
            state.intensities.put(emotions[i], values[i]);
        }
        state.updateDerivedMetrics();
        return state;
    }

    public double intensity(Emotion emotion) {
        return intensities.get(emotion);
    }

    public void updateEmotion(Emotion emotion, double delta) {
        updateEmotion(emotion, delta, defaultDecay);
    }

    /**
     * Adds {@code delta} to one channel (clamped to [0, 100]) and multiplies every
     * other channel by {@code decay}.
     */
    public void updateEmotion(Emotion emotion, double delta, double decay) {
        if (emotion == null) {
            throw new InvalidArgumentException("emotion", "Emotion must not be null");
        }
        if (!Double.isFinite(delta)) {
            throw new InvalidArgumentException("emotion", "Delta must be finite: " + delta);
        }
        requireDecay(decay);
        double current = intensities.get(emotion);
        intensities.put(emotion, clamp(current + delta));

        for (Emotion other : Emotion.values()) {
            if (other != emotion) {
                intensities.put(other, intensities.get(other) * decay);
            }
        }
        updateDerivedMetrics();
    }

    /** String boundary for {@link #updateEmotion(Emotion, double, double)}. */
    public void updateEmotion(String name, double delta, double decay) {
        updateEmotion(Emotion.fromName(name), delta, decay);
    }

    /**
     * Highest-intensity emotion; ties resolve to the earliest in {@link Emotion} order.
     */
    public EmotionReading dominantEmotion() {
        Emotion dominant = Emotion.JOY;
        double max = intensities.get(Emotion.JOY);
        for (Emotion e : Emotion.values()) {
            double v = intensities.get(e);
            if (v > max) {
                max = v;
                dominant = e;
            }
        }
        return new EmotionReading(dominant, max);
    }

    /**
     * Intensities in {@link Emotion} order, scaled to unit L2 norm.
     * An all-zero state is returned unscaled.
     */
    public double[] emotionalVector() {
        Emotion[] emotions = Emotion.values();
        double[] vector = new double[emotions.length];
        double sumSquares = 0.0;
        for (int i = 0; i < emotions.length; i++) {
            vector[i] = intensities.get(emotions[i]);
            sumSquares += vector[i] * vector[i];
        }
        double norm = Math.sqrt(sumSquares);
        if (norm > 0.0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }
        return vector;
    }

    /**
     * Euclidean distance between the two normalised vectors. Compares direction
     * only: a state and its uniformly scaled copy are at distance 0.
     */
    public double emotionalDistance(EmotionalState other) {
        double[] v1 = emotionalVector();
        double[] v2 = other.emotionalVector();
        double sum = 0.0;
        for (int i = 0; i < v1.length; i++) {
            double d = v1[i] - v2[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    public double stability() {
        return stability;
    }

    public double adaptability() {
        return adaptability;
    }

    public double socialAlignment() {
        return socialAlignment;
    }

    public EmotionSnapshot snapshot() {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Emotion e : Emotion.values()) {
            values.put(e.key(), intensities.get(e));
        }
        EmotionReading dominant = dominantEmotion();
        return new EmotionSnapshot(values, stability, adaptability, socialAlignment,
            dominant.emotion().key(), dominant.intensity());
    }

    private void updateDerivedMetrics() {
        double joy          = intensities.get(Emotion.JOY);
        double sadness      = intensities.get(Emotion.SADNESS);
        double fear         = intensities.get(Emotion.FEAR);
        double anger        = intensities.get(Emotion.ANGER);
        double trust        = intensities.get(Emotion.TRUST);
        double disgust      = intensities.get(Emotion.DISGUST);
        double anticipation = intensities.get(Emotion.ANTICIPATION);
        double surprise     = intensities.get(Emotion.SURPRISE);

        stability       = (joy + trust - fear - anger) / 2;
        adaptability    = (anticipation + surprise - sadness) / 2;
        socialAlignment = trust - disgust;
    }

    private static void requireDecay(double decay) {
        // NaN fails both comparisons, so test the accepted range
        if (!(decay >= 0.0 && decay <= 1.0)) {
            throw new InvalidArgumentException("emotion", "Decay factor must be in [0, 1]: " + decay);
        }
    }

    private static double clamp(double value) {
        return Math.max(MIN_INTENSITY, Math.min(MAX_INTENSITY, value));
    }
}
