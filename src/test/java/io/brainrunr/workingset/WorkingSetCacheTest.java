package io.brainrunr.workingset;

import io.brainrunr.config.MemoryProperties;
import io.brainrunr.memory.MemoryRecord;
import io.brainrunr.testsupport.EngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkingSetCacheTest {

    @TempDir
    Path tempDir;

    private EngineFixture engine;

    @BeforeEach
    void setUp() {
        MemoryProperties defaults = EngineFixture.defaults(tempDir);
        engine = EngineFixture.open(tempDir, new MemoryProperties(defaults.path(), defaults.embeddingDimension(),
                defaults.search(), defaults.graph(), defaults.recall(),
                new MemoryProperties.WorkingSet(3, 24), defaults.consolidation()));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static List<String> ids(List<WorkingSetEntry> entries) {
        return entries.stream().map(WorkingSetEntry::id).toList();
    }

    @Test
    void shouldStartEmpty() {
        assertTrue(engine.workingSet.get().isEmpty());
        assertTrue(engine.workingSet.refresh().isEmpty());
        assertEquals(3, engine.workingSet.capacity());
    }

    @Test
    void shouldHoldAtMostCapacity() {
        for (int i = 0; i < 6; i++) {
            engine.remember("memory " + i);
        }

        List<WorkingSetEntry> entries = engine.workingSet.refresh();

        assertEquals(3, entries.size());
        assertEquals(entries, engine.workingSet.get());
        for (int i = 1; i < entries.size(); i++) {
            assertTrue(entries.get(i - 1).score() >= entries.get(i).score());
        }
    }

    @Test
    void shouldRankFrequentlyAccessedFirst() {
        MemoryRecord busy = engine.remember("busy");
        engine.remember("quiet one");
        engine.remember("quiet two");
        for (int i = 0; i < 5; i++) {
            engine.store.updateAccess(busy.id());
        }

        List<WorkingSetEntry> entries = engine.workingSet.refresh();

        assertEquals(busy.id(), entries.get(0).id());
        assertEquals(1.0 + Math.log(6), entries.get(0).score(), 1e-9);
    }

    @Test
    void shouldPreferRecentlyTouched() {
        MemoryRecord old = engine.remember("old");
        engine.clock.advance(Duration.ofHours(48));
        MemoryRecord fresh = engine.remember("fresh");

        List<WorkingSetEntry> entries = engine.workingSet.refresh();

        assertEquals(List.of(fresh.id(), old.id()), ids(entries));
        assertTrue(entries.get(1).score() < 0.3);
    }

    @Test
    void shouldDropDeletedMemories() {
        MemoryRecord kept = engine.remember("kept");
        MemoryRecord gone = engine.remember("gone");
        assertTrue(ids(engine.workingSet.refresh()).contains(gone.id()));

        engine.store.delete(gone.id());

        assertEquals(List.of(kept.id()), ids(engine.workingSet.refresh()));
    }

    @Test
    void shouldComputeDecayedScore() {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");

        assertEquals(1.0, WorkingSetCache.score(0, now, now, 24), 1e-9);
        assertEquals(0.5, WorkingSetCache.score(0, now.minus(Duration.ofHours(24)), now, 24), 1e-9);
        assertEquals(0.25, WorkingSetCache.score(0, now.minus(Duration.ofHours(48)), now, 24), 1e-9);
        assertEquals(1.0 + Math.log(4), WorkingSetCache.score(3, now, now, 24), 1e-9);
        assertEquals(1.0, WorkingSetCache.score(0, now.plus(Duration.ofHours(5)), now, 24), 1e-9);
    }
}
