package io.brainrunr.consolidation;

import io.brainrunr.memory.MemoryService;
import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Periodic consolidation pass with the configured defaults, followed by a working-set refresh.
 */
@Component
public class ConsolidationJob {

    private static final Logger log = LoggerFactory.getLogger(ConsolidationJob.class);

    private final MemoryService memory;

    public ConsolidationJob(MemoryService memory) {
        this.memory = memory;
    }

    @Job(name = "Memory consolidation")
    public void execute() {
        try {
            ConsolidationStats stats = memory.consolidate();
            log.info("Scheduled consolidation done: {} events replayed, {} edge updates, {} links added",
                    stats.replayEvents(), stats.edgeUpdates(), stats.linkUpdates());
        } catch (Exception e) {
            log.error("Scheduled consolidation failed", e);
        }
    }
}
