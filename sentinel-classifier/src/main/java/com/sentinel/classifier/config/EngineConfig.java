package com.sentinel.classifier.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.classifier.engine.ClassificationEngine;
import com.sentinel.classifier.engine.ConfidenceScorer;
import com.sentinel.classifier.engine.RuleCatalogLoader;
import com.sentinel.classifier.engine.RuleMatcher;
import com.sentinel.classifier.engine.TextNormalizer;
import com.sentinel.classifier.service.RuleCatalogService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free rule engine into the application context.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ClassifierProperties.class)
public class EngineConfig {

    @Bean
    public TextNormalizer textNormalizer() {
        return new TextNormalizer();
    }

    @Bean
    public RuleMatcher ruleMatcher() {
        return new RuleMatcher();
    }

    /**
     * Fails startup when the configured confidence constants break the scoring order
     */
    @Bean
    public ConfidenceScorer confidenceScorer(ClassifierProperties properties) {
        ConfidenceScorer scorer = new ConfidenceScorer(properties.getScoring().toPolicy());
        log.info("Scoring policy: {}", scorer.getPolicy());
        return scorer;
    }

    @Bean
    public RuleCatalogLoader ruleCatalogLoader(ObjectMapper objectMapper, TextNormalizer textNormalizer) {
        return new RuleCatalogLoader(objectMapper, textNormalizer);
    }

    @Bean
    public ClassificationEngine classificationEngine(TextNormalizer textNormalizer,
                                                     RuleMatcher ruleMatcher,
                                                     ConfidenceScorer confidenceScorer,
                                                     RuleCatalogService ruleCatalogService) {
        return new ClassificationEngine(textNormalizer, ruleMatcher, confidenceScorer, ruleCatalogService::current);
    }
}
