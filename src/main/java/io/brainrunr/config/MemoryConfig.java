package io.brainrunr.config;

import io.brainrunr.graph.SoftmaxSampler;
import io.brainrunr.search.EmbeddingFunction;
import io.brainrunr.search.SpringAiEmbeddingFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

/**
 * Wires the memory engine's collaborators: the clock, the embedding model and the
 * random source behind divergent recall.
 */
@Configuration
@EnableConfigurationProperties(MemoryProperties.class)
public class MemoryConfig {

    private static final Logger log = LoggerFactory.getLogger(MemoryConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EmbeddingFunction embeddingFunction(EmbeddingModel embeddingModel, MemoryProperties properties) {
        log.info("Embedding via {} ({} dimensions)", embeddingModel.getClass().getSimpleName(),
                properties.embeddingDimension());
        return new SpringAiEmbeddingFunction(embeddingModel, properties.embeddingDimension());
    }

    @Bean
    public SoftmaxSampler softmaxSampler() {
        return new SoftmaxSampler(new Random());
    }
}
