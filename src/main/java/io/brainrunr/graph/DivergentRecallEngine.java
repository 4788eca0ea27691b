package io.brainrunr.graph;

import io.brainrunr.config.MemoryProperties;
import io.brainrunr.graph.CoActivationEvent.Origin;
import io.brainrunr.memory.CausalLink;
import io.brainrunr.memory.MemoryRecord;
import io.brainrunr.memory.RecordStore;
import io.brainrunr.memory.SearchFilters;
import io.brainrunr.search.HybridRetriever;
import io.brainrunr.search.ScoredMemory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Surfaces memories that are associated with, rather than similar to, a context.
 *
 * <p>Seeds come from hybrid retrieval. Activation then spreads over the association graph in
 * rounds: each frontier node samples among its strongest neighbours with a softmax at the
 * requested temperature and passes on {@code activation * strength * depthDecay} to each
 * neighbour it picked. Neighbours are association edges plus the node's outgoing causal links,
 * each id weighted by its strongest connection. Every node is expanded at most once and the run
 * stops after {@code maxBranches^maxDepth} traversal steps.</p>
 */
@Component
public class DivergentRecallEngine {

    private static final Logger log = LoggerFactory.getLogger(DivergentRecallEngine.class);

    public static final int DEFAULT_RESULTS = 5;
    public static final int DEFAULT_BRANCHES = 3;
    public static final int DEFAULT_DEPTH = 3;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    static final int DIAGNOSTIC_BRANCHES = 4;
    static final int DIAGNOSTIC_DEPTH = 3;

    private static final double MIN_SEED_ACTIVATION = 0.01;

    static final double SIMILAR_LINK_WEIGHT = 1.0;
    static final double CAUSAL_LINK_WEIGHT = 0.85;
    static final double OTHER_LINK_WEIGHT = 0.8;

    private final HybridRetriever retriever;
    private final AssociationGraph graph;
    private final RecordStore store;
    private final CoActivationLog coActivationLog;
    private final SoftmaxSampler sampler;
    private final double depthDecay;
    private final boolean diagnosticsRecordAccess;

    public DivergentRecallEngine(HybridRetriever retriever, AssociationGraph graph, RecordStore store,
                                 CoActivationLog coActivationLog, SoftmaxSampler sampler,
                                 MemoryProperties properties) {
        this.retriever = retriever;
        this.graph = graph;
        this.store = store;
        this.coActivationLog = coActivationLog;
        this.sampler = sampler;
        this.depthDecay = properties.recall().depthDecay();
        this.diagnosticsRecordAccess = properties.recall().diagnosticsRecordAccess();
    }

    /**
     * Runs a committing recall: returned memories are marked accessed and every
     * (seed, visited node) pair is logged for consolidation.
     */
    public DivergentRecall recall(String context, int nResults, int maxBranches, int maxDepth, double temperature) {
        Traversal traversal = traverse(context, maxBranches, maxDepth, temperature);
        List<RecallResult> results = traversal.results(clamp(nResults, 1, 20));

        coActivationLog.recordRetrieval(results.stream().map(r -> r.record().id()).toList(),
                traversal.seedPairs(), Origin.RECALL);
        log.debug("Divergent recall '{}': {} results, {} nodes visited",
                context, results.size(), traversal.visitedCount());
        return new DivergentRecall(results, traversal.diagnostics());
    }

    /**
     * Runs the same traversal with fixed parameters and no co-activation side effects.
     *
     * @param sampleSize number of results to evaluate, clamped to 3..20
     */
    public DivergentDiagnostics diagnose(String context, int sampleSize) {
        Traversal traversal = traverse(context, DIAGNOSTIC_BRANCHES, DIAGNOSTIC_DEPTH, DEFAULT_TEMPERATURE);
        List<RecallResult> results = traversal.results(clamp(sampleSize, 3, 20));
        if (diagnosticsRecordAccess && !results.isEmpty()) {
            store.updateAccess(results.stream().map(r -> r.record().id()).toList());
        }
        return traversal.diagnostics();
    }

    private Traversal traverse(String context, int maxBranches, int maxDepth, double temperature) {
        int branches = clamp(maxBranches, 1, 8);
        int depth = clamp(maxDepth, 1, 5);
        double temp = Double.isNaN(temperature) ? DEFAULT_TEMPERATURE : Math.max(0.0, Math.min(10.0, temperature));

        Traversal t = new Traversal(branches, depth, temp, (long) Math.pow(branches, depth));
        for (ScoredMemory seed : retriever.rank(context, SearchFilters.none(), branches)) {
            t.addSeed(seed.id(), Math.max(seed.score(), MIN_SEED_ACTIVATION));
        }

        List<String> frontier = new ArrayList<>(t.seeds);
        Set<String> expanded = new LinkedHashSet<>();
        rounds:
        for (int hop = 1; hop <= depth && !frontier.isEmpty(); hop++) {
            List<String> next = new ArrayList<>();
            for (String nodeId : frontier) {
                if (t.budgetSpent()) {
                    break rounds;
                }
                if (!expanded.add(nodeId)) {
                    continue;
                }
                t.expandedNodes++;
                for (Neighbor neighbor : sampleNeighbors(nodeId, branches, temp)) {
                    if (t.traversalSteps >= t.stepBudget) {
                        break rounds;
                    }
                    if (t.spread(nodeId, neighbor, depthDecay)) {
                        next.add(neighbor.id());
                    }
                }
            }
            frontier = next;
        }
        return t;
    }

    /**
     * Association edges merged with outgoing causal links, strongest weight per id,
     * ordered by weight descending then id and cut to {@code topK}.
     */
    List<Neighbor> neighborCandidates(String nodeId, int topK) {
        Map<String, Double> weights = new HashMap<>();
        for (Neighbor neighbor : graph.neighbors(nodeId, topK)) {
            weights.merge(neighbor.id(), neighbor.strength(), Math::max);
        }
        for (CausalLink link : store.linksFrom(nodeId)) {
            if (!link.targetId().equals(nodeId)) {
                weights.merge(link.targetId(), linkWeight(link.linkType()), Math::max);
            }
        }
        return weights.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(topK)
                .map(e -> new Neighbor(e.getKey(), e.getValue()))
                .toList();
    }

    static double linkWeight(String linkType) {
        return switch (linkType) {
            case CausalLink.SIMILAR -> SIMILAR_LINK_WEIGHT;
            case CausalLink.RELATED, CausalLink.CAUSED_BY, CausalLink.LEADS_TO -> CAUSAL_LINK_WEIGHT;
            default -> OTHER_LINK_WEIGHT;
        };
    }

    private List<Neighbor> sampleNeighbors(String nodeId, int branches, double temperature) {
        List<Neighbor> candidates = neighborCandidates(nodeId, branches);
        if (candidates.isEmpty()) {
            return List.of();
        }
        double[] strengths = candidates.stream().mapToDouble(Neighbor::strength).toArray();
        Set<Integer> picked = new LinkedHashSet<>();
        for (int draw = 0; draw < branches; draw++) {
            picked.add(sampler.sample(strengths, temperature));
        }
        return picked.stream().map(candidates::get).toList();
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    /** Mutable state of one run. */
    private final class Traversal {
        final int branches;
        final int depth;
        final double temperature;
        final long stepBudget;

        final Set<String> seeds = new LinkedHashSet<>();
        final Map<String, Double> activation = new HashMap<>();
        final Map<String, Path> bestPath = new LinkedHashMap<>();
        int expandedNodes;
        int traversalSteps;
        int deepestHop;

        Traversal(int branches, int depth, double temperature, long stepBudget) {
            this.branches = branches;
            this.depth = depth;
            this.temperature = temperature;
            this.stepBudget = stepBudget;
        }

        boolean budgetSpent() {
            return traversalSteps >= stepBudget || expandedNodes >= stepBudget;
        }

        void addSeed(String id, double initial) {
            seeds.add(id);
            activation.put(id, initial);
            bestPath.put(id, new Path(id, 0, initial));
        }

        /** Passes activation along one edge. Returns true when the target was reached for the first time. */
        boolean spread(String fromId, Neighbor to, double decay) {
            traversalSteps++;
            Path parent = bestPath.get(fromId);
            double contribution = activation.get(fromId) * to.strength() * decay;
            boolean firstVisit = !activation.containsKey(to.id());
            activation.merge(to.id(), contribution, Double::sum);

            Path current = bestPath.get(to.id());
            if (current == null || (current.hops() > 0 && contribution > current.contribution())) {
                bestPath.put(to.id(), new Path(parent.seedId(), parent.hops() + 1, contribution));
                deepestHop = Math.max(deepestHop, parent.hops() + 1);
            }
            return firstVisit;
        }

        int visitedCount() {
            return (int) activation.keySet().stream().filter(id -> !seeds.contains(id)).count();
        }

        List<RecallResult> results(int limit) {
            List<String> ranked = activation.keySet().stream()
                    .filter(id -> !seeds.contains(id))
                    .sorted(Comparator.comparing((String id) -> activation.get(id)).reversed()
                            .thenComparing(Comparator.<String>naturalOrder()))
                    .toList();
            if (ranked.isEmpty()) {
                return List.of();
            }
            Map<String, MemoryRecord> records = new HashMap<>();
            for (MemoryRecord record : store.getAll(ranked)) {
                records.put(record.id(), record);
            }
            List<RecallResult> results = new ArrayList<>();
            for (String id : ranked) {
                MemoryRecord record = records.get(id);
                if (record == null) {
                    continue;
                }
                Path path = bestPath.get(id);
                results.add(new RecallResult(record, activation.get(id), path.seedId(), path.hops()));
                if (results.size() == limit) {
                    break;
                }
            }
            return results;
        }

        List<IdPair> seedPairs() {
            List<IdPair> pairs = new ArrayList<>();
            bestPath.forEach((id, path) -> {
                if (!seeds.contains(id)) {
                    pairs.add(IdPair.of(path.seedId(), id));
                }
            });
            return pairs;
        }

        DivergentDiagnostics diagnostics() {
            double avg = expandedNodes == 0 ? 0.0 : (double) traversalSteps / expandedNodes;
            return new DivergentDiagnostics(seeds.size(), stepBudget, expandedNodes, traversalSteps,
                    visitedCount(), avg, deepestHop, temperature, branches, depth);
        }
    }

    private record Path(String seedId, int hops, double contribution) {
    }
}
