package io.brainrunr.api;

import io.brainrunr.memory.CameraPose;
import io.brainrunr.memory.MediaReference;
import io.brainrunr.memory.MemoryRecord;

import java.time.Instant;
import java.util.List;

/**
 * JSON shape of a memory. The embedding stays server-side.
 */
public record MemoryView(
        String id,
        String content,
        String emotion,
        String category,
        int importance,
        Instant createdAt,
        Instant lastAccessed,
        int accessCount,
        MediaReference media,
        CameraPose camera,
        String episodeId,
        List<String> tags
) {
    public static MemoryView from(MemoryRecord r) {
        return new MemoryView(r.id(), r.content(), r.emotion().tag(), r.category().tag(), r.importance(),
                r.createdAt(), r.lastAccessed(), r.accessCount(), r.media(), r.camera(), r.episodeId(), r.tags());
    }
}
