package com.sentinel.classifier.engine;

import lombok.Builder;
import lombok.Value;

/**
 * A category proposed by the {@link RuleMatcher} for one normalized text.
 */
@Value
@Builder
public class Candidate {

    Category category;

    /**
     * Override phrase or the leftmost keyword that hit
     */
    String matchedTerm;

    MatchKind kind;

    /**
     * Number of distinct keywords of this category found in the text; 1 for overrides
     */
    int hitCount;

    /**
     * Token index of the leftmost keyword hit; 0 for overrides
     */
    int position;
}
