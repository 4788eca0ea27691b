package io.brainrunr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Brainrunr: associative long-term memory for an embodied agent.
 * Stores experience records in SQLite, ranks them by embedding and bigram relevance,
 * and spreads activation over a co-activation graph that JobRunr consolidates.
 */
@SpringBootApplication
public class BrainRunrApplication {

    public static void main(String[] args) {
        SpringApplication.run(BrainRunrApplication.class, args);
    }
}
