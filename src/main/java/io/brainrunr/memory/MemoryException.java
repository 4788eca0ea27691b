package io.brainrunr.memory;

/**
 * Base type for failures of memory operations. Each subtype carries its {@link ErrorKind}.
 */
public abstract class MemoryException extends RuntimeException {

    protected MemoryException(String message) {
        super(message);
    }

    protected MemoryException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
