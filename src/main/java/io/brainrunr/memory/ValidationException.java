package io.brainrunr.memory;

/**
 * Out-of-domain input: unknown emotion or category, importance outside 1..5,
 * wrong embedding dimension. Raised before anything is written.
 */
public class ValidationException extends MemoryException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
