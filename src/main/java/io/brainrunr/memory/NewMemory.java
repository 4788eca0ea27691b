package io.brainrunr.memory;

import java.util.List;

/**
 * Everything needed to create a {@link MemoryRecord}. The store assigns the id and timestamps.
 *
 * @param content    textual content
 * @param embedding  dense vector, must have the configured dimension
 * @param emotion    emotion tag
 * @param category   category tag
 * @param importance 1 (trivial) to 5 (critical)
 * @param media      optional media reference
 * @param camera     optional camera pose
 * @param tags       free-form tags, never null
 */
public record NewMemory(
        String content,
        float[] embedding,
        Emotion emotion,
        MemoryCategory category,
        int importance,
        MediaReference media,
        CameraPose camera,
        List<String> tags
) {
    public NewMemory {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public NewMemory(String content, float[] embedding, Emotion emotion, MemoryCategory category, int importance) {
        this(content, embedding, emotion, category, importance, null, null, List.of());
    }
}
