package io.brainrunr.memory;

import java.time.Instant;
import java.util.List;

/**
 * A named, ordered group of memories, e.g. "looking for the morning sky".
 *
 * @param id           unique identifier
 * @param title        episode title
 * @param memoryIds    member ids in insertion order
 * @param participants people involved
 * @param summary      free-text summary
 * @param startTime    earliest member creation time
 * @param endTime      latest member creation time
 * @param emotion      emotion of the most important member
 * @param importance   highest member importance
 */
public record Episode(
        String id,
        String title,
        List<String> memoryIds,
        List<String> participants,
        String summary,
        Instant startTime,
        Instant endTime,
        Emotion emotion,
        int importance
) {
    public Episode {
        memoryIds = memoryIds == null ? List.of() : List.copyOf(memoryIds);
        participants = participants == null ? List.of() : List.copyOf(participants);
    }
}
