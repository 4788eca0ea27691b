package io.brainrunr.api;

import io.brainrunr.consolidation.ConsolidationStats;
import io.brainrunr.episode.EpisodeManager;
import io.brainrunr.graph.DivergentDiagnostics;
import io.brainrunr.graph.DivergentRecall;
import io.brainrunr.graph.DivergentRecallEngine;
import io.brainrunr.memory.CameraPose;
import io.brainrunr.memory.CausalLink;
import io.brainrunr.memory.ChainDirection;
import io.brainrunr.memory.Emotion;
import io.brainrunr.memory.Episode;
import io.brainrunr.memory.MediaReference;
import io.brainrunr.memory.MemoryCategory;
import io.brainrunr.memory.MemoryRecord;
import io.brainrunr.memory.MemoryService;
import io.brainrunr.memory.MemoryStats;
import io.brainrunr.memory.SearchFilters;
import io.brainrunr.workingset.WorkingSetEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API over the memory engine. Errors are mapped by {@link MemoryApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
public class MemoryController {

    private static final Logger log = LoggerFactory.getLogger(MemoryController.class);

    private final MemoryService memory;
    private final EpisodeManager episodes;

    public MemoryController(MemoryService memory, EpisodeManager episodes) {
        this.memory = memory;
        this.episodes = episodes;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        boolean up = memory.healthCheck();
        return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("status", up ? "ok" : "unavailable", "service", "brainrunr"));
    }

    @PostMapping("/memories")
    public ResponseEntity<MemoryView> remember(@RequestBody RememberRequest request) {
        MediaReference media = null;
        if (request.audioPath() != null && !request.audioPath().isBlank()) {
            media = MediaReference.audio(request.audioPath(), request.transcript());
        } else if (request.imagePath() != null && !request.imagePath().isBlank()) {
            media = MediaReference.image(request.imagePath());
        }
        MemoryRecord record = memory.remember(request.content(),
                Emotion.fromString(request.emotion()),
                MemoryCategory.fromString(request.category()),
                request.importance() != null ? request.importance() : 3,
                media, request.camera(), request.tags());
        return ResponseEntity.status(HttpStatus.CREATED).body(MemoryView.from(record));
    }

    @GetMapping("/memories")
    public List<MemoryView> listRecent(@RequestParam(defaultValue = "10") int limit,
                                       @RequestParam(required = false) String category) {
        MemoryCategory filter = category == null || category.isBlank() ? null : MemoryCategory.fromString(category);
        return memory.listRecent(limit, filter).stream().map(MemoryView::from).toList();
    }

    @GetMapping("/memories/{id}")
    public MemoryView get(@PathVariable String id) {
        return MemoryView.from(memory.get(id));
    }

    @DeleteMapping("/memories/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        memory.delete(id);
        log.info("Memory {} deleted via API", id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/memories/stats")
    public MemoryStats stats() {
        return memory.stats();
    }

    @PostMapping("/memories/search")
    public List<ScoredView> search(@RequestBody SearchRequest request) {
        SearchFilters filters = new SearchFilters(
                request.category() == null || request.category().isBlank() ? null : MemoryCategory.fromString(request.category()),
                request.emotion() == null || request.emotion().isBlank() ? null : Emotion.fromString(request.emotion()),
                request.dateFrom(), request.dateTo());
        int n = request.nResults() != null ? request.nResults() : 5;
        return memory.search(request.query(), filters, n).stream()
                .map(s -> new ScoredView(MemoryView.from(s.record()), s.score(), s.similarity(), s.lexical()))
                .toList();
    }

    @PostMapping("/memories/recall-divergent")
    public RecallView recallDivergent(@RequestBody RecallRequest request) {
        DivergentRecall recall = memory.recallDivergent(request.context(),
                request.nResults() != null ? request.nResults() : DivergentRecallEngine.DEFAULT_RESULTS,
                request.maxBranches() != null ? request.maxBranches() : DivergentRecallEngine.DEFAULT_BRANCHES,
                request.maxDepth() != null ? request.maxDepth() : DivergentRecallEngine.DEFAULT_DEPTH,
                request.temperature() != null ? request.temperature() : DivergentRecallEngine.DEFAULT_TEMPERATURE);
        List<RecallView.Item> items = recall.results().stream()
                .map(r -> new RecallView.Item(MemoryView.from(r.record()), r.activation(), r.seedId(), r.hops()))
                .toList();
        return new RecallView(items, recall.diagnostics());
    }

    @GetMapping("/memories/diagnostics")
    public DivergentDiagnostics diagnostics(@RequestParam String context,
                                            @RequestParam(defaultValue = "20") int sampleSize) {
        return memory.associationDiagnostics(context, sampleSize);
    }

    @PostMapping("/memories/links")
    public ResponseEntity<CausalLink> link(@RequestBody LinkRequest request) {
        String type = request.linkType() == null || request.linkType().isBlank() ? CausalLink.CAUSED_BY : request.linkType();
        CausalLink link = memory.link(request.sourceId(), request.targetId(), type, request.note());
        return ResponseEntity.status(HttpStatus.CREATED).body(link);
    }

    @GetMapping("/memories/{id}/chain")
    public List<ChainView> causalChain(@PathVariable String id,
                                       @RequestParam(defaultValue = "forward") String direction,
                                       @RequestParam(defaultValue = "3") int maxDepth) {
        return memory.causalChain(id, ChainDirection.fromString(direction), maxDepth).stream()
                .map(n -> new ChainView(MemoryView.from(n.record()), n.linkType(), n.depth()))
                .toList();
    }

    @GetMapping("/working-set")
    public List<WorkingSetEntry> workingSet(@RequestParam(defaultValue = "false") boolean refresh) {
        return memory.workingSet(refresh);
    }

    @PostMapping("/consolidation")
    public ConsolidationStats consolidate(@RequestBody(required = false) ConsolidateRequest request) {
        if (request == null) {
            return memory.consolidate();
        }
        return memory.consolidate(
                request.windowHours() != null ? request.windowHours() : 24,
                request.maxReplayEvents() != null ? request.maxReplayEvents() : 200,
                request.linkUpdateStrength() != null ? request.linkUpdateStrength() : 0.2);
    }

    @PostMapping("/episodes")
    public ResponseEntity<Episode> createEpisode(@RequestBody EpisodeRequest request) {
        Episode episode = episodes.create(request.title(), request.memoryIds(), request.participants(), request.summary());
        return ResponseEntity.status(HttpStatus.CREATED).body(episode);
    }

    @GetMapping("/episodes")
    public List<Episode> listEpisodes(@RequestParam(required = false) String query,
                                      @RequestParam(defaultValue = "5") int nResults) {
        return query == null || query.isBlank() ? episodes.list() : episodes.search(query, nResults);
    }

    @GetMapping("/episodes/{id}")
    public Episode getEpisode(@PathVariable String id) {
        return episodes.get(id);
    }

    @GetMapping("/episodes/{id}/memories")
    public List<MemoryView> episodeMemories(@PathVariable String id) {
        return episodes.getEpisodeMemories(id).stream().map(MemoryView::from).toList();
    }

    @DeleteMapping("/episodes/{id}")
    public ResponseEntity<Void> deleteEpisode(@PathVariable String id) {
        episodes.delete(id);
        return ResponseEntity.noContent().build();
    }

    record RememberRequest(String content, String emotion, String category, Integer importance,
                           List<String> tags, String imagePath, String audioPath, String transcript,
                           CameraPose camera) {}

    record SearchRequest(String query, Integer nResults, String category, String emotion,
                         Instant dateFrom, Instant dateTo) {}

    record RecallRequest(String context, Integer nResults, Integer maxBranches, Integer maxDepth,
                         Double temperature) {}

    record LinkRequest(String sourceId, String targetId, String linkType, String note) {}

    record ConsolidateRequest(Integer windowHours, Integer maxReplayEvents, Double linkUpdateStrength) {}

    record EpisodeRequest(String title, List<String> memoryIds, List<String> participants, String summary) {}

    record ScoredView(MemoryView memory, double score, double similarity, double lexical) {}

    record ChainView(MemoryView memory, String linkType, int depth) {}

    record RecallView(List<Item> results, DivergentDiagnostics diagnostics) {
        record Item(MemoryView memory, double activation, String seedId, int hops) {}
    }
}
