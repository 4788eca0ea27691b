package io.brainrunr.search;

import io.brainrunr.memory.MemoryRecord;

import java.time.Duration;
import java.time.Instant;

/**
 * Scoring for context recall. A hybrid hit loses up to {@value #DECAY_WEIGHT} as it ages
 * (half-life {@value #HALF_LIFE_DAYS} days) and gains from its emotion and importance:
 * {@code score - (1 - decay) * 0.3 + emotionBoost * 0.2 + importanceBoost * 0.2}, floored at 0.
 */
public final class RecallScoring {

    public static final double HALF_LIFE_DAYS = 30.0;
    static final double DECAY_WEIGHT = 0.3;
    static final double EMOTION_WEIGHT = 0.2;
    static final double IMPORTANCE_WEIGHT = 0.2;

    private RecallScoring() {
    }

    public static double score(ScoredMemory hit, Instant now) {
        MemoryRecord record = hit.record();
        double decay = timeDecay(record.createdAt(), now, HALF_LIFE_DAYS);
        double adjusted = hit.score()
                - (1.0 - decay) * DECAY_WEIGHT
                + record.emotion().recallBoost() * EMOTION_WEIGHT
                + importanceBoost(record.importance()) * IMPORTANCE_WEIGHT;
        return Math.max(0.0, adjusted);
    }

    /** {@code 2^(-ageDays / halfLifeDays)} in [0, 1]; 1 for memories dated in the future. */
    public static double timeDecay(Instant createdAt, Instant now, double halfLifeDays) {
        long ageMillis = Duration.between(createdAt, now).toMillis();
        if (ageMillis <= 0) {
            return 1.0;
        }
        double ageDays = ageMillis / 86_400_000.0;
        return Math.max(0.0, Math.min(1.0, Math.pow(2.0, -ageDays / halfLifeDays)));
    }

    /** 0 for importance 1 up to 0.4 for importance 5. */
    public static double importanceBoost(int importance) {
        int clamped = Math.max(1, Math.min(5, importance));
        return (clamped - 1) / 10.0;
    }
}
