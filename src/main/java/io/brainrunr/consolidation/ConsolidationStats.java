package io.brainrunr.consolidation;

/**
 * Outcome of one consolidation pass.
 *
 * @param replayEvents      events replayed into the graph
 * @param edgeUpdates       association bumps applied
 * @param linkUpdates       {@code related} causal links added
 * @param skippedEvents     events whose memories no longer exist
 * @param refreshedMemories distinct memories touched by replay
 */
public record ConsolidationStats(
        int replayEvents,
        int edgeUpdates,
        int linkUpdates,
        int skippedEvents,
        int refreshedMemories
) {
    public static final ConsolidationStats EMPTY = new ConsolidationStats(0, 0, 0, 0, 0);
}
