package io.brainrunr.episode;

import io.brainrunr.memory.Episode;
import io.brainrunr.memory.MemoryRecord;
import io.brainrunr.memory.NotFoundException;
import io.brainrunr.testsupport.EngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EpisodeManagerTest {

    @TempDir
    Path tempDir;

    private EngineFixture engine;
    private EpisodeManager episodes;

    @BeforeEach
    void setUp() {
        engine = EngineFixture.open(tempDir);
        episodes = engine.episodes;
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void shouldBuildSummaryFromMembersInChronologicalOrder() {
        MemoryRecord first = engine.remember("woke up early and looked out of the window at the grey sky");
        MemoryRecord second = engine.remember("the sun finally came out");

        Episode episode = episodes.create("Morning sky", List.of(second.id(), first.id()), List.of(), null);

        assertEquals("woke up early and looked out of the window at the " + " -> " + "the sun finally came out",
                episode.summary());
    }

    @Test
    void shouldKeepExplicitSummary() {
        MemoryRecord memory = engine.remember("walked along the river");

        Episode episode = episodes.create("Walk", List.of(memory.id()), List.of("Sam"), "a quiet walk");

        assertEquals("a quiet walk", episode.summary());
        assertEquals(List.of("Sam"), episode.participants());
        assertEquals("Walk", episodes.get(episode.id()).title());
    }

    @Test
    void shouldReturnMembersChronologically() {
        MemoryRecord first = engine.remember("first step");
        MemoryRecord second = engine.remember("second step");
        MemoryRecord third = engine.remember("third step");

        Episode episode = episodes.create("Steps", List.of(third.id(), first.id(), second.id()), List.of(), null);

        assertEquals(List.of(third.id(), first.id(), second.id()), episode.memoryIds());
        assertEquals(List.of(first.id(), second.id(), third.id()),
                episodes.getEpisodeMemories(episode.id()).stream().map(MemoryRecord::id).toList());
        assertEquals(episode.id(), engine.store.get(first.id()).episodeId());
    }

    @Test
    void shouldSearchByTitleAndSummary() {
        Episode beach = episodes.create("Beach trip", List.of(engine.remember("sand castles").id()), List.of(), null);
        Episode office = episodes.create("Office day", List.of(engine.remember("long meeting").id()), List.of(), null);

        List<Episode> byTitle = episodes.search("beach", 5);
        assertEquals(List.of(beach.id()), byTitle.stream().map(Episode::id).toList());

        List<Episode> bySummary = episodes.search("meeting", 5);
        assertEquals(office.id(), bySummary.get(0).id());

        assertTrue(episodes.search("   ", 5).isEmpty());
        assertTrue(episodes.search("zzz", 5).isEmpty());
    }

    @Test
    void shouldListNewestFirst() {
        Episode older = episodes.create("Older", List.of(engine.remember("one").id()), List.of(), null);
        engine.clock.advance(java.time.Duration.ofMinutes(5));
        Episode newer = episodes.create("Newer", List.of(engine.remember("two").id()), List.of(), null);

        assertEquals(List.of(newer.id(), older.id()), episodes.list().stream().map(Episode::id).toList());
    }

    @Test
    void shouldDeleteEpisodeAndKeepMemories() {
        MemoryRecord memory = engine.remember("kept memory");
        Episode episode = episodes.create("Temporary", List.of(memory.id()), List.of(), null);

        episodes.delete(episode.id());

        assertThrows(NotFoundException.class, () -> episodes.get(episode.id()));
        assertNull(engine.store.get(memory.id()).episodeId());
        assertThrows(NotFoundException.class, () -> episodes.delete(episode.id()));
    }

    @Test
    void shouldFailForUnknownEpisode() {
        assertThrows(NotFoundException.class, () -> episodes.getEpisodeMemories("missing"));
    }

    @Test
    void shouldTruncateEachMemberInSummary() {
        String longContent = "x".repeat(80);
        MemoryRecord memory = new MemoryRecord("id", longContent, new float[0], null, null, 3,
                EngineFixture.START, null, 0, null, null, null, List.of());

        assertEquals("x".repeat(50), EpisodeManager.buildSummary(List.of(memory)));
        assertEquals("", EpisodeManager.buildSummary(List.of()));
    }
}
