package com.sentinel.classifier.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Confidence constants used by {@link ConfidenceScorer}.
 *
 * Keyword confidence is {@code min(tokenCeiling, tokenBaseConfidence + hits * tokenIncrement)}.
 * The ordering empty < baseline < any keyword match < 1.0 (overrides) is enforced by
 * {@link #validate()}.
 */
@Value
@Builder
public class ScoringPolicy {

    public static final double OVERRIDE_CONFIDENCE = 1.0;

    @Builder.Default
    Category defaultCategory = Category.OTHER;

    /**
     * Confidence for text that had content but matched nothing
     */
    @Builder.Default
    double baselineConfidence = 0.5;

    @Builder.Default
    double emptyConfidence = 0.0;

    @Builder.Default
    double tokenBaseConfidence = 0.6;

    @Builder.Default
    double tokenIncrement = 0.15;

    @Builder.Default
    double tokenCeiling = 0.95;

    public static ScoringPolicy defaults() {
        return ScoringPolicy.builder().build();
    }

    public ScoringPolicy validate() {
        if (defaultCategory == null) {
            throw new IllegalArgumentException("defaultCategory is required");
        }
        requireUnitInterval("baselineConfidence", baselineConfidence);
        requireUnitInterval("emptyConfidence", emptyConfidence);
        requireUnitInterval("tokenBaseConfidence", tokenBaseConfidence);
        requireUnitInterval("tokenIncrement", tokenIncrement);
        requireUnitInterval("tokenCeiling", tokenCeiling);
        if (emptyConfidence < 0.0 || emptyConfidence >= baselineConfidence) {
            throw new IllegalArgumentException("emptyConfidence must be in [0, baselineConfidence)");
        }
        if (tokenIncrement <= 0.0) {
            throw new IllegalArgumentException("tokenIncrement must be positive");
        }
        if (tokenBaseConfidence + tokenIncrement <= baselineConfidence) {
            throw new IllegalArgumentException("a single keyword hit must score above baselineConfidence");
        }
        if (tokenCeiling >= OVERRIDE_CONFIDENCE) {
            throw new IllegalArgumentException("tokenCeiling must stay below the override confidence of 1.0");
        }
        if (tokenBaseConfidence + tokenIncrement > tokenCeiling) {
            throw new IllegalArgumentException("tokenCeiling must allow at least one keyword hit");
        }
        return this;
    }

    private static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be a number in [0, 1], got " + value);
        }
    }
}
