package com.sentinel.classifier.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the categories a normalized text is evidence for.
 *
 * Tiers are evaluated in order and the first one that yields anything wins:
 * overrides (whole text equals a phrase), then keywords (token sequence containment).
 * Keywords never match inside a longer token, so {@code rent} does not hit {@code parent}.
 */
public class RuleMatcher {

    public List<Candidate> match(NormalizedText text, RuleCatalog catalog) {
        if (text.isEmpty()) {
            return List.of();
        }

        Optional<Category> override = catalog.findOverride(text);
        if (override.isPresent()) {
            return List.of(Candidate.builder()
                    .category(override.get())
                    .matchedTerm(text.getValue())
                    .kind(MatchKind.OVERRIDE)
                    .hitCount(1)
                    .position(0)
                    .build());
        }

        List<String> tokens = text.getTokens();
        List<Candidate> candidates = new ArrayList<>();
        for (Map.Entry<Category, List<Keyword>> entry : catalog.getKeywords().entrySet()) {
            int hits = 0;
            int leftmost = Integer.MAX_VALUE;
            Keyword first = null;

            for (Keyword keyword : entry.getValue()) {
                int position = Collections.indexOfSubList(tokens, keyword.getTokens());
                if (position < 0) {
                    continue;
                }
                hits++;
                // on equal position the longer phrase is the more specific evidence
                if (position < leftmost
                        || (position == leftmost && keyword.getTokens().size() > first.getTokens().size())) {
                    leftmost = position;
                    first = keyword;
                }
            }

            if (hits > 0) {
                candidates.add(Candidate.builder()
                        .category(entry.getKey())
                        .matchedTerm(first.getPhrase())
                        .kind(MatchKind.KEYWORD)
                        .hitCount(hits)
                        .position(leftmost)
                        .build());
            }
        }
        return candidates;
    }
}
