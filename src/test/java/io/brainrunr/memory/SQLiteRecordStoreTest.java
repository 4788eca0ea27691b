package io.brainrunr.memory;

import io.brainrunr.graph.CoActivationEvent.Origin;
import io.brainrunr.testsupport.EngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteRecordStoreTest {

    @TempDir
    Path tempDir;

    private EngineFixture engine;
    private SQLiteRecordStore store;

    @BeforeEach
    void setUp() {
        engine = EngineFixture.open(tempDir);
        store = engine.store;
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void shouldCreateAndGetMemory() {
        float[] embedding = engine.embedding.embed("sunset over the bay");
        MemoryRecord created = store.create(new NewMemory("sunset over the bay", embedding, Emotion.MOVED,
                MemoryCategory.OBSERVATION, 4, MediaReference.image("/tmp/sunset.jpg"), new CameraPose(30.0, -10.0),
                List.of("sky", "evening")));

        MemoryRecord loaded = store.get(created.id());
        assertEquals("sunset over the bay", loaded.content());
        assertArrayEquals(embedding, loaded.embedding());
        assertEquals(Emotion.MOVED, loaded.emotion());
        assertEquals(MemoryCategory.OBSERVATION, loaded.category());
        assertEquals(4, loaded.importance());
        assertEquals(EngineFixture.START, loaded.createdAt());
        assertNull(loaded.lastAccessed());
        assertEquals(0, loaded.accessCount());
        assertEquals(MediaReference.MediaType.IMAGE, loaded.media().type());
        assertEquals("/tmp/sunset.jpg", loaded.media().path());
        assertEquals(30.0, loaded.camera().pan());
        assertEquals(-10.0, loaded.camera().tilt());
        assertEquals(List.of("sky", "evening"), loaded.tags());
        assertNull(loaded.episodeId());
    }

    @Test
    void shouldKeepAudioTranscript() {
        MemoryRecord created = store.create(new NewMemory("a voice in the hall", engine.embedding.embed("voice"),
                Emotion.CURIOUS, MemoryCategory.CONVERSATION, 2,
                MediaReference.audio("/tmp/hall.wav", "good morning"), null, List.of()));

        MemoryRecord loaded = store.get(created.id());
        assertEquals(MediaReference.MediaType.AUDIO, loaded.media().type());
        assertEquals("good morning", loaded.media().transcript());
        assertNull(loaded.camera());
    }

    @Test
    void shouldRejectWrongEmbeddingDimension() {
        var memory = new NewMemory("short vector", new float[3], Emotion.NEUTRAL, MemoryCategory.DAILY, 3);

        var ex = assertThrows(ValidationException.class, () -> store.create(memory));
        assertEquals(ErrorKind.VALIDATION, ex.kind());
        assertEquals(0, store.count());
    }

    @Test
    void shouldRejectImportanceOutOfRange() {
        float[] embedding = engine.embedding.embed("importance");
        assertThrows(ValidationException.class, () ->
                store.create(new NewMemory("too low", embedding, Emotion.NEUTRAL, MemoryCategory.DAILY, 0)));
        assertThrows(ValidationException.class, () ->
                store.create(new NewMemory("too high", embedding, Emotion.NEUTRAL, MemoryCategory.DAILY, 6)));
        assertEquals(0, store.count());
    }

    @Test
    void shouldRejectBlankContentAndMissingTags() {
        float[] embedding = engine.embedding.embed("blank");
        assertThrows(ValidationException.class, () ->
                store.create(new NewMemory("  ", embedding, Emotion.NEUTRAL, MemoryCategory.DAILY, 3)));
        assertThrows(ValidationException.class, () ->
                store.create(new NewMemory("no emotion", embedding, null, MemoryCategory.DAILY, 3)));
        assertThrows(ValidationException.class, () ->
                store.create(new NewMemory("no category", embedding, Emotion.NEUTRAL, null, 3)));
    }

    @Test
    void shouldThrowNotFoundForMissingMemory() {
        var ex = assertThrows(NotFoundException.class, () -> store.get("missing"));
        assertEquals(ErrorKind.NOT_FOUND, ex.kind());
        assertTrue(store.find("missing").isEmpty());
    }

    @Test
    void shouldUpdateAccessStatistics() {
        MemoryRecord record = engine.remember("morning coffee");

        store.updateAccess(record.id());
        store.updateAccess(record.id());
        store.updateAccess("unknown-id");

        MemoryRecord loaded = store.get(record.id());
        assertEquals(2, loaded.accessCount());
        assertEquals(engine.clock.instant(), loaded.lastAccessed());
    }

    @Test
    void shouldListRecentNewestFirst() {
        MemoryRecord first = engine.remember("first", 3, MemoryCategory.DAILY);
        MemoryRecord second = engine.remember("second", 3, MemoryCategory.TECHNICAL);
        MemoryRecord third = engine.remember("third", 3, MemoryCategory.DAILY);

        List<MemoryRecord> all = store.listRecent(10, null);
        assertEquals(List.of(third.id(), second.id(), first.id()), all.stream().map(MemoryRecord::id).toList());

        List<MemoryRecord> daily = store.listRecent(10, MemoryCategory.DAILY);
        assertEquals(List.of(third.id(), first.id()), daily.stream().map(MemoryRecord::id).toList());

        assertEquals(1, store.listRecent(1, null).size());
    }

    @Test
    void shouldFilterCandidates() {
        engine.remember("first", 3, MemoryCategory.DAILY);
        MemoryRecord technical = engine.remember("second", 3, MemoryCategory.TECHNICAL);

        List<MemoryRecord> filtered = store.candidates(SearchFilters.category(MemoryCategory.TECHNICAL));
        assertEquals(1, filtered.size());
        assertEquals(technical.id(), filtered.get(0).id());

        var fromSecond = new SearchFilters(null, null, technical.createdAt(), null);
        assertEquals(1, store.candidates(fromSecond).size());
        assertEquals(2, store.candidates(SearchFilters.none()).size());
    }

    @Test
    void shouldReturnOnlyExistingRecordsFromGetAll() {
        MemoryRecord a = engine.remember("alpha");
        MemoryRecord b = engine.remember("beta");

        List<MemoryRecord> found = store.getAll(List.of(a.id(), "missing", b.id()));
        assertEquals(2, found.size());
        assertTrue(store.getAll(List.of()).isEmpty());
    }

    @Test
    void shouldFollowCausalChainForward() {
        MemoryRecord a = engine.remember("the kettle whistled");
        MemoryRecord b = engine.remember("tea was ready");

        store.createLink(a.id(), b.id(), CausalLink.CAUSED_BY, null);

        List<ChainNode> chain = store.getCausalChain(a.id(), ChainDirection.FORWARD, 3);
        assertEquals(List.of(a.id(), b.id()), chain.stream().map(n -> n.record().id()).toList());
        assertNull(chain.get(0).linkType());
        assertEquals(CausalLink.CAUSED_BY, chain.get(1).linkType());
        assertEquals(1, chain.get(1).depth());
    }

    @Test
    void shouldFollowCausalChainBackward() {
        MemoryRecord a = engine.remember("rain started");
        MemoryRecord b = engine.remember("the street got wet");
        MemoryRecord c = engine.remember("someone slipped");
        store.createLink(a.id(), b.id(), CausalLink.LEADS_TO, null);
        store.createLink(b.id(), c.id(), CausalLink.LEADS_TO, null);

        List<ChainNode> chain = store.getCausalChain(c.id(), ChainDirection.BACKWARD, 5);
        assertEquals(List.of(c.id(), b.id(), a.id()), chain.stream().map(n -> n.record().id()).toList());
        assertEquals(2, chain.get(2).depth());

        List<ChainNode> shallow = store.getCausalChain(c.id(), ChainDirection.BACKWARD, 1);
        assertEquals(2, shallow.size());
    }

    @Test
    void shouldTerminateOnCausalCycle() {
        MemoryRecord a = engine.remember("hungry");
        MemoryRecord b = engine.remember("ate too much");
        store.createLink(a.id(), b.id(), CausalLink.LEADS_TO, null);
        store.createLink(b.id(), a.id(), CausalLink.LEADS_TO, "and round again");

        List<ChainNode> chain = store.getCausalChain(a.id(), ChainDirection.FORWARD, 10);
        assertEquals(List.of(a.id(), b.id()), chain.stream().map(n -> n.record().id()).toList());
    }

    @Test
    void shouldIgnoreDuplicateLinks() {
        MemoryRecord a = engine.remember("alpha");
        MemoryRecord b = engine.remember("beta");

        store.createLink(a.id(), b.id(), CausalLink.RELATED, "first");
        CausalLink again = store.createLink(a.id(), b.id(), CausalLink.RELATED, "second");

        assertEquals("first", again.note());
        assertEquals(1, store.linksFrom(a.id()).size());
        assertEquals(1, store.linksTo(b.id()).size());
    }

    @Test
    void shouldRejectLinkToMissingMemory() {
        MemoryRecord a = engine.remember("alpha");

        assertThrows(NotFoundException.class, () -> store.createLink(a.id(), "missing", CausalLink.RELATED, null));
        assertThrows(NotFoundException.class, () -> store.getCausalChain("missing", ChainDirection.FORWARD, 3));
        assertTrue(store.linksFrom(a.id()).isEmpty());
    }

    @Test
    void shouldCreateEpisodeAndSetBackReferences() {
        MemoryRecord a = engine.remember("opened the curtains", 2);
        MemoryRecord b = engine.remember("saw the morning sky", 5);

        Episode episode = store.createEpisode("morning sky", List.of(b.id(), a.id()), List.of("owner"), "short");

        assertEquals(List.of(b.id(), a.id()), episode.memoryIds());
        assertEquals(a.createdAt(), episode.startTime());
        assertEquals(b.createdAt(), episode.endTime());
        assertEquals(5, episode.importance());
        assertEquals(episode.id(), store.get(a.id()).episodeId());
        assertEquals(episode.id(), store.get(b.id()).episodeId());
        assertEquals(episode, store.getEpisode(episode.id()));
    }

    @Test
    void shouldLeaveNothingBehindWhenEpisodeMemberIsMissing() {
        MemoryRecord a = engine.remember("alpha");

        assertThrows(NotFoundException.class,
                () -> store.createEpisode("broken", List.of(a.id(), "missing"), List.of(), null));

        assertTrue(store.listEpisodes().isEmpty());
        assertNull(store.get(a.id()).episodeId());
    }

    @Test
    void shouldRejectMemoryAlreadyInAnotherEpisode() {
        MemoryRecord a = engine.remember("alpha");
        store.createEpisode("first", List.of(a.id()), List.of(), null);

        assertThrows(ValidationException.class, () -> store.createEpisode("second", List.of(a.id()), List.of(), null));
        assertEquals(1, store.listEpisodes().size());
    }

    @Test
    void shouldRejectEmptyOrUntitledEpisode() {
        MemoryRecord a = engine.remember("alpha");

        assertThrows(ValidationException.class, () -> store.createEpisode("empty", List.of(), List.of(), null));
        assertThrows(ValidationException.class, () -> store.createEpisode(" ", List.of(a.id()), List.of(), null));
    }

    @Test
    void shouldClearBackReferencesWhenEpisodeDeleted() {
        MemoryRecord a = engine.remember("alpha");
        Episode episode = store.createEpisode("e", List.of(a.id()), List.of(), null);

        assertTrue(store.deleteEpisode(episode.id()));
        assertFalse(store.deleteEpisode(episode.id()));
        assertNull(store.get(a.id()).episodeId());
        assertThrows(NotFoundException.class, () -> store.getEpisode(episode.id()));
    }

    @Test
    void shouldDeleteMemoryWithItsEdgesLinksAndEvents() {
        MemoryRecord a = engine.remember("alpha");
        MemoryRecord b = engine.remember("beta");
        store.createLink(a.id(), b.id(), CausalLink.RELATED, null);
        engine.graph.bump(a.id(), b.id(), 0.3);
        engine.coActivationLog.recordAllPairs(List.of(a.id(), b.id()), Origin.SEARCH);
        Episode episode = store.createEpisode("pair", List.of(a.id(), b.id()), List.of(), null);
        long versionBefore = store.contentVersion();

        store.delete(a.id());

        assertTrue(store.find(a.id()).isEmpty());
        assertTrue(store.linksTo(b.id()).isEmpty());
        assertEquals(0.0, engine.graph.strength(a.id(), b.id()));
        assertEquals(0, engine.coActivationLog.pendingCount());
        assertEquals(List.of(b.id()), store.getEpisode(episode.id()).memoryIds());
        assertNotEquals(versionBefore, store.contentVersion());
        assertThrows(NotFoundException.class, () -> store.delete(a.id()));
    }

    @Test
    void shouldComputeStats() {
        engine.remember("first", 3, MemoryCategory.DAILY);
        engine.remember("second", 3, MemoryCategory.DAILY);
        engine.remember("third", 3, MemoryCategory.TECHNICAL);

        MemoryStats stats = store.stats();
        assertEquals(3, stats.totalCount());
        assertEquals(2, stats.byCategory().get(MemoryCategory.DAILY));
        assertEquals(1, stats.byCategory().get(MemoryCategory.TECHNICAL));
        assertEquals(3, stats.byEmotion().get(Emotion.NEUTRAL));
        assertEquals(EngineFixture.START, stats.oldest());
        assertTrue(stats.newest().isAfter(stats.oldest()));
    }

    @Test
    void shouldFindImportantAndDecayAccessCounts() {
        MemoryRecord vital = engine.remember("vital", 5);
        MemoryRecord minor = engine.remember("minor", 1);
        for (int i = 0; i < 4; i++) {
            store.updateAccess(vital.id());
        }
        store.updateAccess(minor.id());

        List<MemoryRecord> important = store.findImportant(4, 2, 10);
        assertEquals(List.of(vital.id()), important.stream().map(MemoryRecord::id).toList());

        assertEquals(2, store.decayAccessCounts(0.5));
        assertEquals(2, store.get(vital.id()).accessCount());
        assertEquals(0, store.get(minor.id()).accessCount());
        assertThrows(ValidationException.class, () -> store.decayAccessCounts(0.0));
    }

    @Test
    void shouldReportAccessStatisticsMostRecentFirst() {
        MemoryRecord a = engine.remember("alpha");
        MemoryRecord b = engine.remember("beta");
        store.updateAccess(a.id());

        List<AccessStat> stats = store.accessStatistics(10);
        assertEquals(a.id(), stats.get(0).id());
        assertEquals(1, stats.get(0).accessCount());
        assertEquals(b.id(), stats.get(1).id());
    }

    @Test
    void shouldPassHealthCheck() {
        assertTrue(store.healthCheck());
    }

    @Test
    void shouldLinkNewMemoryBothWaysToSimilarOnes() {
        MemoryRecord bay = engine.remember("sunset over the bay");
        MemoryRecord hill = engine.remember("sunset on the hill");

        MemoryRecord created = store.create(new NewMemory("sunset over the lake",
                engine.embedding.embed("sunset over the lake"), Emotion.NEUTRAL, MemoryCategory.DAILY, 3),
                List.of(bay.id(), hill.id(), "missing"));

        assertEquals(List.of(bay.id(), hill.id()),
                store.linksFrom(created.id()).stream().map(CausalLink::targetId).toList());
        assertEquals(List.of(created.id()), store.linksFrom(bay.id()).stream().map(CausalLink::targetId).toList());
        assertEquals(CausalLink.SIMILAR, store.linksFrom(hill.id()).get(0).linkType());
    }

    @Test
    void shouldCollectLinkedMemoriesInEitherDirection() {
        MemoryRecord a = engine.remember("a");
        MemoryRecord b = engine.remember("b");
        MemoryRecord c = engine.remember("c");
        MemoryRecord d = engine.remember("d");
        store.createLink(a.id(), b.id(), CausalLink.LEADS_TO, null);
        store.createLink(c.id(), b.id(), CausalLink.CAUSED_BY, null);
        store.createLink(c.id(), d.id(), CausalLink.RELATED, null);
        store.createLink(d.id(), a.id(), CausalLink.RELATED, null);

        assertEquals(List.of(b.id(), d.id()),
                store.getLinkedMemories(a.id(), 1).stream().map(MemoryRecord::id).toList());
        assertEquals(List.of(b.id(), d.id(), c.id()),
                store.getLinkedMemories(a.id(), 2).stream().map(MemoryRecord::id).toList());
        assertEquals(3, store.getLinkedMemories(a.id(), 99).size());
    }

    @Test
    void shouldRejectLinkedMemoriesOfMissingStart() {
        assertThrows(NotFoundException.class, () -> store.getLinkedMemories("missing", 2));
    }

    @Test
    void shouldListContentWithoutEmbeddings() {
        MemoryRecord bay = engine.remember("sunset over the bay");
        MemoryRecord tea = engine.remember("warm tea");

        assertEquals(Map.of(bay.id(), "sunset over the bay", tea.id(), "warm tea"), store.contents());
    }
}
