package io.brainrunr.memory;

/**
 * Image or audio attached to a memory. The transcript is produced outside the engine
 * and only carried here.
 *
 * @param type       what kind of media the path points to
 * @param path       file path or URI of the media
 * @param transcript speech-to-text output for audio, may be null
 */
public record MediaReference(MediaType type, String path, String transcript) {

    public enum MediaType {
        IMAGE,
        AUDIO
    }

    public MediaReference {
        if (type == null) {
            throw new ValidationException("Media type is required");
        }
        if (path == null || path.isBlank()) {
            throw new ValidationException("Media path is required");
        }
    }

    public static MediaReference image(String path) {
        return new MediaReference(MediaType.IMAGE, path, null);
    }

    public static MediaReference audio(String path, String transcript) {
        return new MediaReference(MediaType.AUDIO, path, transcript);
    }
}
