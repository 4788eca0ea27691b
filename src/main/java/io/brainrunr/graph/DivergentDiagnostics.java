package io.brainrunr.graph;

/**
 * Branching statistics of one divergent recall run.
 *
 * @param seedCount          seeds taken from hybrid retrieval
 * @param stepBudget         {@code maxBranches^maxDepth}, the cap on traversal steps
 * @param expandedNodes      nodes whose neighbours were sampled
 * @param traversalSteps     edges followed
 * @param visitedNodes       distinct non-seed nodes reached
 * @param averageBranching   edges followed per expanded node
 * @param deepestHop         largest hop count reached
 * @param temperature        sampling temperature after clamping
 * @param maxBranches        branching limit after clamping
 * @param maxDepth           depth limit after clamping
 */
public record DivergentDiagnostics(
        int seedCount,
        long stepBudget,
        int expandedNodes,
        int traversalSteps,
        int visitedNodes,
        double averageBranching,
        int deepestHop,
        double temperature,
        int maxBranches,
        int maxDepth
) {
}
