package io.brainrunr.workingset;

import io.brainrunr.config.MemoryProperties;
import io.brainrunr.memory.AccessStat;
import io.brainrunr.memory.MemoryRecord;
import io.brainrunr.memory.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded set of the currently most active memories.
 *
 * <p>Activation halves every {@code halfLifeHours} since the last access and grows
 * logarithmically with the access count. The cache only advises; it can be rebuilt from
 * the store at any time.</p>
 */
@Component
public class WorkingSetCache {

    private static final Logger log = LoggerFactory.getLogger(WorkingSetCache.class);

    private static final Comparator<WorkingSetEntry> ORDER = Comparator
            .comparingDouble(WorkingSetEntry::score).reversed()
            .thenComparing(WorkingSetEntry::id);

    private final RecordStore store;
    private final Clock clock;
    private final int capacity;
    private final double halfLifeHours;

    private volatile List<WorkingSetEntry> entries = List.of();

    public WorkingSetCache(RecordStore store, MemoryProperties properties, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.capacity = Math.max(1, properties.workingSet().capacity());
        this.halfLifeHours = properties.workingSet().halfLifeHours() > 0 ? properties.workingSet().halfLifeHours() : 24;
    }

    /** Current entries, most active first. */
    public List<WorkingSetEntry> get() {
        return entries;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Samples recent access statistics, rescores the current entries alongside them and keeps
     * the top {@code capacity}. Entries whose memory has been deleted drop out.
     */
    public synchronized List<WorkingSetEntry> refresh() {
        Instant now = clock.instant();
        Map<String, WorkingSetEntry> merged = new HashMap<>();
        for (AccessStat stat : store.accessStatistics(capacity * 4)) {
            merged.put(stat.id(), new WorkingSetEntry(stat.id(),
                    score(stat.accessCount(), stat.lastTouched(), now, halfLifeHours), stat.lastTouched()));
        }

        List<String> carried = entries.stream().map(WorkingSetEntry::id).filter(id -> !merged.containsKey(id)).toList();
        for (MemoryRecord record : store.getAll(carried)) {
            merged.put(record.id(), new WorkingSetEntry(record.id(),
                    score(record.accessCount(), record.lastTouched(), now, halfLifeHours), record.lastTouched()));
        }

        List<WorkingSetEntry> ranked = new ArrayList<>(merged.values());
        ranked.sort(ORDER);
        entries = List.copyOf(ranked.subList(0, Math.min(capacity, ranked.size())));
        log.debug("Working set refreshed: {} of {} candidates kept", entries.size(), ranked.size());
        return entries;
    }

    /**
     * {@code 2^(-ageHours / halfLifeHours) * (1 + ln(1 + accessCount))}. Future timestamps count as age 0.
     */
    public static double score(int accessCount, Instant lastActivation, Instant now, double halfLifeHours) {
        double ageHours = Math.max(0, Duration.between(lastActivation, now).toMillis()) / 3_600_000.0;
        double recency = Math.pow(2.0, -ageHours / halfLifeHours);
        return recency * (1.0 + Math.log1p(Math.max(0, accessCount)));
    }
}
