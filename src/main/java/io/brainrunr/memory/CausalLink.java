package io.brainrunr.memory;

import java.time.Instant;

/**
 * Directed, typed edge between two memories. Cycles are allowed.
 *
 * @param sourceId  the memory the link starts from
 * @param targetId  the memory the link points to
 * @param linkType  relation name, e.g. {@code caused_by}, {@code leads_to}, {@code related}, {@code similar}
 * @param note      optional free text
 * @param createdAt when the link was created
 */
public record CausalLink(String sourceId, String targetId, String linkType, String note, Instant createdAt) {

    public static final String CAUSED_BY = "caused_by";
    public static final String LEADS_TO = "leads_to";
    public static final String RELATED = "related";
    public static final String SIMILAR = "similar";
}
