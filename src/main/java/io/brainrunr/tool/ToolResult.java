package io.brainrunr.tool;

import io.brainrunr.memory.ErrorKind;

/**
 * The result of a tool invocation.
 *
 * @param value     text returned to the caller
 * @param errorKind kind of failure, null on success
 */
public record ToolResult(String value, ErrorKind errorKind) {

    public static ToolResult of(String value) {
        return new ToolResult(value, null);
    }

    public static ToolResult error(ErrorKind kind, String message) {
        return new ToolResult(message, kind);
    }

    public boolean isError() {
        return errorKind != null;
    }

    /** Text form handed to a language model: errors carry their kind as a prefix. */
    public String render() {
        return isError() ? "Error [%s]: %s".formatted(errorKind, value) : value;
    }
}
