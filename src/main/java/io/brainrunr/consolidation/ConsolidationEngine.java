package io.brainrunr.consolidation;

import io.brainrunr.config.MemoryProperties;
import io.brainrunr.graph.AssociationGraph;
import io.brainrunr.graph.CoActivationEvent;
import io.brainrunr.graph.CoActivationLog;
import io.brainrunr.graph.IdPair;
import io.brainrunr.memory.CausalLink;
import io.brainrunr.memory.MemoryDatabase;
import io.brainrunr.memory.SQLiteRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Replays recent co-activations into the association graph, like sleep consolidating the
 * day's experiences.
 *
 * <p>Each event is applied in its own transaction together with its replay mark, so a
 * crash mid-pass never double-counts an event and readers never see a half-updated pair.</p>
 */
@Component
public class ConsolidationEngine {

    private static final Logger log = LoggerFactory.getLogger(ConsolidationEngine.class);

    static final String AUTO_LINK_NOTE = "auto-linked by consolidation replay";
    static final int MAX_REPLAY_LIMIT = 10_000;

    private final MemoryDatabase db;
    private final CoActivationLog coActivationLog;
    private final AssociationGraph graph;
    private final Clock clock;
    private final double cap;
    private final double autoLinkThreshold;

    public ConsolidationEngine(MemoryDatabase db, CoActivationLog coActivationLog, AssociationGraph graph,
                               MemoryProperties properties, Clock clock) {
        this.db = db;
        this.coActivationLog = coActivationLog;
        this.graph = graph;
        this.clock = clock;
        this.cap = properties.graph().cap();
        this.autoLinkThreshold = properties.graph().autoLinkThreshold();
    }

    /**
     * Consumes up to {@code maxReplayEvents} pending events from the trailing window, oldest first.
     *
     * @param windowHours        at least 1
     * @param maxReplayEvents    clamped to 1..10000
     * @param linkUpdateStrength clamped to [0.05, 1.0]
     */
    public ConsolidationStats consolidate(int windowHours, int maxReplayEvents, double linkUpdateStrength) {
        int window = Math.max(1, windowHours);
        int limit = Math.max(1, Math.min(MAX_REPLAY_LIMIT, maxReplayEvents));
        double delta = Double.isNaN(linkUpdateStrength) ? 0.05 : Math.max(0.05, Math.min(1.0, linkUpdateStrength));

        Instant since = Instant.now(clock).minus(Duration.ofHours(window));
        List<CoActivationEvent> events = coActivationLog.pending(since, limit);
        if (events.isEmpty()) {
            log.debug("No co-activation events to replay in the last {}h", window);
            return ConsolidationStats.EMPTY;
        }

        int replayed = 0;
        int edgeUpdates = 0;
        int linkUpdates = 0;
        int skipped = 0;
        Set<String> refreshed = new HashSet<>();

        for (CoActivationEvent event : events) {
            Outcome outcome = replay(event, delta);
            switch (outcome) {
                case SKIPPED -> skipped++;
                case BUMPED, BUMPED_AND_LINKED -> {
                    replayed++;
                    edgeUpdates++;
                    refreshed.add(event.pair().low());
                    refreshed.add(event.pair().high());
                    if (outcome == Outcome.BUMPED_AND_LINKED) {
                        linkUpdates++;
                    }
                }
            }
        }

        ConsolidationStats stats = new ConsolidationStats(replayed, edgeUpdates, linkUpdates, skipped, refreshed.size());
        log.info("Consolidation replayed {} events: {} edge updates, {} new links, {} skipped",
                replayed, edgeUpdates, linkUpdates, skipped);
        return stats;
    }

    private Outcome replay(CoActivationEvent event, double delta) {
        IdPair pair = event.pair();
        return db.inTransaction(conn -> {
            if (!SQLiteRecordStore.exists(conn, pair.low()) || !SQLiteRecordStore.exists(conn, pair.high())) {
                coActivationLog.markReplayed(conn, event.id());
                return Outcome.SKIPPED;
            }
            double strength = graph.bumpWithin(conn, pair.low(), pair.high(), delta, cap);
            boolean linked = false;
            if (autoLinkThreshold > 0 && strength >= autoLinkThreshold) {
                CausalLink link = new CausalLink(pair.low(), pair.high(), CausalLink.RELATED, AUTO_LINK_NOTE,
                        Instant.now(clock).truncatedTo(ChronoUnit.MILLIS));
                linked = SQLiteRecordStore.insertLink(conn, link);
            }
            coActivationLog.markReplayed(conn, event.id());
            return linked ? Outcome.BUMPED_AND_LINKED : Outcome.BUMPED;
        });
    }

    private enum Outcome {
        SKIPPED,
        BUMPED,
        BUMPED_AND_LINKED
    }
}
