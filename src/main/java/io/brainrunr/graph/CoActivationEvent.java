package io.brainrunr.graph;

import java.time.Instant;

/**
 * Two memories retrieved together. Consumed by consolidation.
 *
 * @param id         log sequence number
 * @param pair       the co-activated memories
 * @param origin     which read path produced the event
 * @param occurredAt when the retrieval happened
 * @param replayedAt when consolidation consumed the event, null while pending
 */
public record CoActivationEvent(long id, IdPair pair, Origin origin, Instant occurredAt, Instant replayedAt) {

    public enum Origin {
        SEARCH,
        RECALL
    }
}
