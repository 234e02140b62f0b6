package com.sentinel.classifier.engine;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point of the rule engine: normalize, match, score.
 *
 * Stateless apart from the catalog supplier, which is read once per call so a concurrent
 * reload never mixes two catalogs inside one classification. Safe for unrestricted
 * concurrent use.
 */
public class ClassificationEngine {

    private final TextNormalizer normalizer;
    private final RuleMatcher matcher;
    private final ConfidenceScorer scorer;
    private final Supplier<RuleCatalog> catalog;

    public ClassificationEngine(TextNormalizer normalizer, RuleMatcher matcher,
                                ConfidenceScorer scorer, Supplier<RuleCatalog> catalog) {
        this.normalizer = normalizer;
        this.matcher = matcher;
        this.scorer = scorer;
        this.catalog = catalog;
    }

    /**
     * Classifies a transaction description. Never throws.
     *
     * @param description free text, may be null or empty
     * @param amount      reserved for amount-aware rules; currently ignored by matching and scoring
     */
    public ClassificationResult classify(String description, BigDecimal amount) {
        RuleCatalog snapshot = catalog.get();
        NormalizedText text = normalizer.normalize(description);
        List<Candidate> candidates = matcher.match(text, snapshot);
        return scorer.score(candidates, text.isEmpty());
    }
}
