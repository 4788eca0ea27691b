package io.brainrunr.memory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store of memory records, causal links and episodes. Source of truth for the engine.
 *
 * <p>Every mutation is a single short transaction: on failure nothing is left visible.</p>
 */
public interface RecordStore {

    /**
     * Creates a memory record.
     *
     * @param memory the content, embedding and tags
     * @return the stored record with its fresh id and creation time
     * @throws ValidationException if a tag is missing, importance is outside 1..5,
     *                             or the embedding has the wrong dimension
     */
    MemoryRecord create(NewMemory memory);

    /**
     * Creates a memory and links it both ways to each of {@code similarIds} with a
     * {@code similar} link, all in one transaction. Ids that no longer exist are skipped.
     *
     * @throws ValidationException on the same conditions as {@link #create(NewMemory)}
     */
    MemoryRecord create(NewMemory memory, Collection<String> similarIds);

    /**
     * Gets a memory by id.
     *
     * @throws NotFoundException if absent
     */
    MemoryRecord get(String id);

    Optional<MemoryRecord> find(String id);

    /**
     * Returns the existing memories among the given ids, in no particular order.
     * Unknown ids are skipped.
     */
    List<MemoryRecord> getAll(Collection<String> ids);

    /**
     * Records a read-path retrieval: increments the access count and sets the last access time.
     * Unknown ids are ignored.
     */
    void updateAccess(String id);

    /** Batch form of {@link #updateAccess(String)}, applied in one transaction. */
    void updateAccess(Collection<String> ids);

    /**
     * Lists memories by creation time, newest first.
     *
     * @param limit    max number of results
     * @param category optional category filter (null for all)
     */
    List<MemoryRecord> listRecent(int limit, MemoryCategory category);

    /**
     * Returns every memory passing the filters, embeddings included.
     */
    List<MemoryRecord> candidates(SearchFilters filters);

    /**
     * Creates a directed causal link. Creating the same (source, target, type) twice is a no-op.
     *
     * @throws NotFoundException if either memory is absent
     */
    CausalLink createLink(String sourceId, String targetId, String linkType, String note);

    List<CausalLink> linksFrom(String id);

    List<CausalLink> linksTo(String id);

    /**
     * Walks causal links breadth-first from a memory. The result starts with the start memory
     * and never contains a memory twice, even when the links form a cycle.
     *
     * @param maxDepth clamped to 1..10
     * @throws NotFoundException if the start memory is absent
     */
    List<ChainNode> getCausalChain(String id, ChainDirection direction, int maxDepth);

    /**
     * Memories reachable from a memory over causal links in either direction, nearest first.
     * The start memory is excluded and no memory appears twice.
     *
     * @param depth number of hops, clamped to 1..5
     * @throws NotFoundException if the start memory is absent
     */
    List<MemoryRecord> getLinkedMemories(String id, int depth);

    /**
     * Creates an episode and sets the episode back-reference of every member in one transaction.
     *
     * @throws NotFoundException   if any member is absent
     * @throws ValidationException if the title is blank or there are no members
     */
    Episode createEpisode(String title, List<String> memoryIds, List<String> participants, String summary);

    /**
     * @throws NotFoundException if absent
     */
    Episode getEpisode(String episodeId);

    /** All episodes, newest first. */
    List<Episode> listEpisodes();

    /**
     * Deletes an episode and clears its members' back-references. Memories are kept.
     *
     * @return true if the episode existed
     */
    boolean deleteEpisode(String episodeId);

    /**
     * Administrative removal of a memory together with its embedding, links and association edges.
     *
     * @throws NotFoundException if absent
     */
    void delete(String id);

    int count();

    MemoryStats stats();

    /**
     * Memories with at least the given importance and access count, most recently accessed first.
     */
    List<MemoryRecord> findImportant(int minImportance, int minAccessCount, int limit);

    /**
     * Access statistics of the most recently touched memories.
     */
    List<AccessStat> accessStatistics(int limit);

    /**
     * Explicit decay pass: multiplies every access count by {@code factor}, rounding down.
     *
     * @param factor in (0, 1]
     * @return number of memories whose count changed
     */
    int decayAccessCounts(double factor);

    /**
     * Id to content of every memory, without embeddings. Feeds the lexical index.
     */
    Map<String, String> contents();

    /**
     * Changes whenever memory content is added or removed. Lets derived indexes detect staleness.
     */
    long contentVersion();

    /**
     * Verifies the store is operational.
     */
    boolean healthCheck();
}
