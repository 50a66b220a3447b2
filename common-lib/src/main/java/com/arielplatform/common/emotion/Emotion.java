package com.arielplatform.common.emotion;

import com.arielplatform.common.exception.InvalidArgumentException;

import java.util.Locale;

/**
 * The eight primary affective channels. Declaration order is the tie-break
 * order for {@link EmotionalState#dominantEmotion()}.
 */
public enum Emotion {
    JOY,
    SADNESS,
    FEAR,
    ANGER,
    TRUST,
    DISGUST,
    ANTICIPATION,
    SURPRISE;

    /** Lower-case wire name, e.g. {@code "joy"}. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire name. Unknown names are rejected here so the state never
     * sees an unrecognised channel.
     *
     * @throws InvalidArgumentException when {@code name} is not one of the eight emotions
     */
    public static Emotion fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (Emotion e : values()) {
                if (e.name().equals(normalized)) return e;
            }
        }
        throw new InvalidArgumentException("emotion", "Unknown emotion: " + name);
    }
}
