package io.brainrunr.workingset;

import java.time.Instant;

/**
 * A memory held in the working set.
 *
 * @param id             memory id
 * @param score          decayed activation at the last refresh
 * @param lastActivation last access, or creation time if never accessed
 */
public record WorkingSetEntry(String id, double score, Instant lastActivation) {
}
