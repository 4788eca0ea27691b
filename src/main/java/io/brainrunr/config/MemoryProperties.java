package io.brainrunr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the memory engine.
 *
 * <p>Binds to {@code brain.memory} in application.yml:</p>
 * <pre>
 * brain:
 *   memory:
 *     path: ./data/memory
 *     embedding-dimension: 768
 *     search:
 *       alpha: 0.7
 *     graph:
 *       cap: 1.0
 *       auto-link-threshold: 0.6
 *     recall:
 *       depth-decay: 0.5
 *       diagnostics-record-access: false
 *     working-set:
 *       capacity: 20
 *       half-life-hours: 24
 *     consolidation:
 *       enabled: true
 *       interval-minutes: 60
 *       window-hours: 24
 *       max-replay-events: 200
 *       link-update-strength: 0.2
 * </pre>
 *
 * @param path               directory holding {@code brain.db}
 * @param embeddingDimension the fixed vector dimension D of this deployment
 */
@ConfigurationProperties(prefix = "brain.memory")
public record MemoryProperties(
        @DefaultValue("./data/memory") String path,
        @DefaultValue("768") int embeddingDimension,
        @DefaultValue Search search,
        @DefaultValue Graph graph,
        @DefaultValue Recall recall,
        @DefaultValue WorkingSet workingSet,
        @DefaultValue Consolidation consolidation
) {

    /**
     * @param alpha  weight of the embedding score in the hybrid score; the bigram score gets {@code 1 - alpha}
     * @param bm25K1 term-frequency saturation
     * @param bm25B  document-length normalization
     */
    public record Search(
            @DefaultValue("0.7") double alpha,
            @DefaultValue("1.2") double bm25K1,
            @DefaultValue("0.75") double bm25B
    ) {
    }

    /**
     * @param cap               upper bound of any association strength
     * @param autoLinkThreshold strength at which consolidation adds a {@code related} causal link; 0 disables it
     */
    public record Graph(
            @DefaultValue("1.0") double cap,
            @DefaultValue("0.6") double autoLinkThreshold
    ) {
    }

    /**
     * @param depthDecay              activation multiplier applied on every hop
     * @param diagnosticsRecordAccess whether diagnostic recall runs still count as record accesses
     */
    public record Recall(
            @DefaultValue("0.5") double depthDecay,
            @DefaultValue("false") boolean diagnosticsRecordAccess
    ) {
    }

    public record WorkingSet(
            @DefaultValue("20") int capacity,
            @DefaultValue("24") double halfLifeHours
    ) {
    }

    public record Consolidation(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("60") int intervalMinutes,
            @DefaultValue("24") int windowHours,
            @DefaultValue("200") int maxReplayEvents,
            @DefaultValue("0.2") double linkUpdateStrength
    ) {
    }

    /** Defaults matching the annotated values, for tests and programmatic setups. */
    public static MemoryProperties defaults(String path, int embeddingDimension) {
        return new MemoryProperties(
                path,
                embeddingDimension,
                new Search(0.7, 1.2, 0.75),
                new Graph(1.0, 0.6),
                new Recall(0.5, false),
                new WorkingSet(20, 24),
                new Consolidation(true, 60, 24, 200, 0.2)
        );
    }
}
