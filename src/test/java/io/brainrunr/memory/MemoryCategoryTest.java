package io.brainrunr.memory;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MemoryCategoryTest {

    @Test
    void shouldParseFromString() {
        assertEquals(MemoryCategory.PHILOSOPHICAL, MemoryCategory.fromString("philosophical"));
        assertEquals(MemoryCategory.TECHNICAL, MemoryCategory.fromString("TECHNICAL"));
    }

    @Test
    void shouldDefaultToDaily() {
        assertEquals(MemoryCategory.DAILY, MemoryCategory.fromString(null));
        assertEquals(MemoryCategory.DAILY, MemoryCategory.fromString("  "));
    }

    @Test
    void shouldRejectUnknownCategory() {
        var ex = assertThrows(ValidationException.class, () -> MemoryCategory.fromString("gossip"));
        assertEquals(ErrorKind.VALIDATION, ex.kind());
    }
}
