package io.brainrunr.memory;

import java.util.Locale;

/**
 * Categories for memory records.
 *
 * <ul>
 *   <li>{@code DAILY}: everyday events, the default.</li>
 *   <li>{@code PHILOSOPHICAL}: reflections and open questions.</li>
 *   <li>{@code TECHNICAL}: things learned about tools and systems.</li>
 *   <li>{@code MEMORY}: recollections about remembering itself.</li>
 *   <li>{@code OBSERVATION}: what the camera or microphone picked up.</li>
 *   <li>{@code FEELING}: inner states.</li>
 *   <li>{@code CONVERSATION}: exchanges with people.</li>
 * </ul>
 */
public enum MemoryCategory {
    DAILY,
    PHILOSOPHICAL,
    TECHNICAL,
    MEMORY,
    OBSERVATION,
    FEELING,
    CONVERSATION;

    /**
     * Parses a category case-insensitively. Blank input means {@link #DAILY}.
     *
     * @throws ValidationException for a value outside the enumerated set
     */
    public static MemoryCategory fromString(String s) {
        if (s == null || s.isBlank()) return DAILY;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown category: " + s);
        }
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
