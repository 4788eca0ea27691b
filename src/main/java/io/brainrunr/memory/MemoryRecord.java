package io.brainrunr.memory;

import java.time.Instant;
import java.util.List;

/**
 * A single stored unit of experience.
 *
 * @param id           unique identifier, immutable
 * @param content      the memory content
 * @param embedding    dense vector of the deployment's dimension
 * @param emotion      emotion tag
 * @param category     category tag
 * @param importance   1-5
 * @param createdAt    creation time
 * @param lastAccessed last read-path retrieval, null if never retrieved
 * @param accessCount  number of read-path retrievals
 * @param media        optional media reference
 * @param camera       optional camera pose
 * @param episodeId    episode this memory belongs to, or null
 * @param tags         free-form tags
 */
public record MemoryRecord(
        String id,
        String content,
        float[] embedding,
        Emotion emotion,
        MemoryCategory category,
        int importance,
        Instant createdAt,
        Instant lastAccessed,
        int accessCount,
        MediaReference media,
        CameraPose camera,
        String episodeId,
        List<String> tags
) {
    public MemoryRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /** Time used for recency: the last access, or the creation time if never accessed. */
    public Instant lastTouched() {
        return lastAccessed != null ? lastAccessed : createdAt;
    }
}
