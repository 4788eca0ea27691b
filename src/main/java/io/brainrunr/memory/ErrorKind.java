package io.brainrunr.memory;

/**
 * Error kinds surfaced unchanged to callers of the memory engine.
 */
public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    STORE_IO
}
