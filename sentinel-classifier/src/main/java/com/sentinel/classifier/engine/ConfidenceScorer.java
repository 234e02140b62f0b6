package com.sentinel.classifier.engine;

import java.util.Comparator;
import java.util.List;

/**
 * Resolves matcher candidates into one {@link ClassificationResult}.
 *
 * Keyword candidates are ranked by hit count (more is better), then by the position of
 * their leftmost hit (earlier is better), then by {@link Category} declaration order.
 */
public class ConfidenceScorer {

    private static final Comparator<Candidate> KEYWORD_RANKING = Comparator
            .comparingInt(Candidate::getHitCount).reversed()
            .thenComparingInt(Candidate::getPosition)
            .thenComparing(Candidate::getCategory);

    private final ScoringPolicy policy;

    public ConfidenceScorer(ScoringPolicy policy) {
        this.policy = policy.validate();
    }

    public ScoringPolicy getPolicy() {
        return policy;
    }

    public ClassificationResult score(List<Candidate> candidates, boolean emptyText) {
        if (candidates == null || candidates.isEmpty()) {
            return emptyText ? emptyResult() : defaultResult();
        }

        for (Candidate candidate : candidates) {
            if (candidate.getKind() == MatchKind.OVERRIDE) {
                return ClassificationResult.builder()
                        .category(candidate.getCategory())
                        .confidence(ScoringPolicy.OVERRIDE_CONFIDENCE)
                        .method(ClassificationMethod.OVERRIDE)
                        .matchedTerm(candidate.getMatchedTerm())
                        .hitCount(1)
                        .build();
            }
        }

        Candidate winner = candidates.stream().min(KEYWORD_RANKING).orElseThrow();
        return ClassificationResult.builder()
                .category(winner.getCategory())
                .confidence(tokenConfidence(winner.getHitCount()))
                .method(ClassificationMethod.TOKEN_MATCH)
                .matchedTerm(winner.getMatchedTerm())
                .hitCount(winner.getHitCount())
                .build();
    }

    double tokenConfidence(int hitCount) {
        double raw = policy.getTokenBaseConfidence() + hitCount * policy.getTokenIncrement();
        double clamped = Math.min(policy.getTokenCeiling(), raw);
        return Math.round(clamped * 10_000) / 10_000.0;
    }

    private ClassificationResult emptyResult() {
        return ClassificationResult.builder()
                .category(Category.OTHER)
                .confidence(policy.getEmptyConfidence())
                .method(ClassificationMethod.EMPTY_NORMALIZED)
                .hitCount(0)
                .build();
    }

    private ClassificationResult defaultResult() {
        return ClassificationResult.builder()
                .category(policy.getDefaultCategory())
                .confidence(policy.getBaselineConfidence())
                .method(ClassificationMethod.DEFAULT_OTHER)
                .hitCount(0)
                .build();
    }
}
