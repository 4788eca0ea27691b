package io.brainrunr.memory;

import java.util.Locale;

/**
 * Emotion tag attached to every memory.
 */
public enum Emotion {
    HAPPY(0.2),
    SAD(0.25),
    SURPRISED(0.35),
    MOVED(0.3),
    EXCITED(0.4),
    NOSTALGIC(0.15),
    CURIOUS(0.1),
    NEUTRAL(0.0);

    private final double recallBoost;

    Emotion(double recallBoost) {
        this.recallBoost = recallBoost;
    }

    /** How much more readily a memory with this emotion comes back in context recall. */
    public double recallBoost() {
        return recallBoost;
    }

    /**
     * Parses a tag case-insensitively. Blank input means {@link #NEUTRAL}.
     *
     * @throws ValidationException for a value outside the enumerated set
     */
    public static Emotion fromString(String s) {
        if (s == null || s.isBlank()) return NEUTRAL;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown emotion: " + s);
        }
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
