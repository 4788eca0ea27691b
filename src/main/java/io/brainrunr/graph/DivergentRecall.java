package io.brainrunr.graph;

import java.util.List;

/**
 * Results of a divergent recall run, strongest activation first, with the run's statistics.
 */
public record DivergentRecall(List<RecallResult> results, DivergentDiagnostics diagnostics) {

    public DivergentRecall {
        results = List.copyOf(results);
    }
}
