package io.brainrunr.consolidation;

import io.brainrunr.config.MemoryProperties;
import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Registers the consolidation recurring job with JobRunr once the application is ready.
 */
@Service
public class ConsolidationScheduler {

    private static final Logger log = LoggerFactory.getLogger(ConsolidationScheduler.class);
    static final String CONSOLIDATION_JOB_ID = "memory-consolidation";

    private final JobScheduler jobScheduler;
    private final MemoryProperties.Consolidation settings;

    public ConsolidationScheduler(JobScheduler jobScheduler, MemoryProperties properties) {
        this.jobScheduler = jobScheduler;
        this.settings = properties.consolidation();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!settings.enabled()) {
            log.info("Consolidation disabled via configuration");
            return;
        }

        String cronExpression = buildCronExpression(settings.intervalMinutes());
        jobScheduler.<ConsolidationJob>scheduleRecurrently(CONSOLIDATION_JOB_ID,
                cronExpression,
                x -> x.execute());

        log.info("Consolidation job registered: every {} minutes (cron: {})", settings.intervalMinutes(), cronExpression);
    }

    /**
     * Cron expression for an interval in minutes. Sub-hour intervals use the minute field;
     * whole hours use the hour field. Other intervals are approximated: to the hour when
     * longer than one, otherwise to the minute.
     */
    static String buildCronExpression(int intervalMinutes) {
        if (intervalMinutes <= 0) throw new IllegalArgumentException("Interval must be positive");
        if (intervalMinutes < 60) {
            return "*/%d * * * *".formatted(intervalMinutes);
        }
        int hours = Math.min(23, Math.max(1, Math.round(intervalMinutes / 60f)));
        return "0 */%d * * *".formatted(hours);
    }

    public boolean isEnabled() {
        return settings.enabled();
    }
}
