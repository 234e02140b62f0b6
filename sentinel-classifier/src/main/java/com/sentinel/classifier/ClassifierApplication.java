package com.sentinel.classifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Sentinel Classifier Service - Transaction Description Categorization
 *
 * This service handles:
 * - Classifying free-text transaction descriptions with the rule engine
 * - Keeping a history of classified transactions and per-category statistics
 * - Publishing classification events to Kafka for downstream consumers
 */
@SpringBootApplication
public class ClassifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClassifierApplication.class, args);
    }
}
