package io.brainrunr.memory;

/**
 * The underlying SQLite store failed. The transaction in flight has been rolled back.
 */
public class StoreIOException extends MemoryException {

    public StoreIOException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.STORE_IO;
    }
}
