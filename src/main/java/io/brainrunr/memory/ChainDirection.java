package io.brainrunr.memory;

import java.util.Locale;

/**
 * Direction of a causal chain walk. {@code FORWARD} follows links from source to target,
 * {@code BACKWARD} follows them from target back to source.
 */
public enum ChainDirection {
    FORWARD,
    BACKWARD;

    public static ChainDirection fromString(String s) {
        if (s == null || s.isBlank()) return FORWARD;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "forward" -> FORWARD;
            case "backward" -> BACKWARD;
            default -> throw new ValidationException("Invalid direction: " + s);
        };
    }
}
