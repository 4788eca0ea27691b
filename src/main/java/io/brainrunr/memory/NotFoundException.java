package io.brainrunr.memory;

/**
 * A referenced record or episode does not exist.
 */
public class NotFoundException extends MemoryException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException memory(String id) {
        return new NotFoundException("Memory not found: " + id);
    }

    public static NotFoundException episode(String id) {
        return new NotFoundException("Episode not found: " + id);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
