package com.sentinel.classifier.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a single classification call.
 *
 * Confidence is in [0, 1]; 1.0 is only ever produced by an override.
 */
@Value
@Builder
public class ClassificationResult {

    Category category;

    double confidence;

    ClassificationMethod method;

    /**
     * Override phrase or keyword that decided the category, null for fallbacks
     */
    String matchedTerm;

    int hitCount;
}
