package com.sentinel.classifier.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of classification rules: keywords per category plus exact-phrase overrides.
 *
 * All phrases are stored in normalized form, so the matcher compares them against
 * {@link NormalizedText} without re-casing. Instances are only created through
 * {@link Builder}, which rejects empty or contradictory entries with
 * {@link CatalogConfigException}.
 */
public final class RuleCatalog {

    private final Map<Category, List<Keyword>> keywords;
    private final Map<String, Category> overrides;
    private final String source;
    private final Instant loadedAt;

    private RuleCatalog(Map<Category, List<Keyword>> keywords, Map<String, Category> overrides,
                        String source, Instant loadedAt) {
        this.keywords = keywords;
        this.overrides = overrides;
        this.source = source;
        this.loadedAt = loadedAt;
    }

    public static Builder builder(TextNormalizer normalizer) {
        return new Builder(normalizer);
    }

    /**
     * Keywords per category, iterated in category declaration order.
     */
    public Map<Category, List<Keyword>> getKeywords() {
        return keywords;
    }

    public List<Keyword> keywordsFor(Category category) {
        return keywords.getOrDefault(category, List.of());
    }

    public Map<String, Category> getOverrides() {
        return overrides;
    }

    public Optional<Category> findOverride(NormalizedText text) {
        return Optional.ofNullable(overrides.get(text.getValue()));
    }

    public int keywordCount() {
        return keywords.values().stream().mapToInt(List::size).sum();
    }

    public int overrideCount() {
        return overrides.size();
    }

    public String getSource() {
        return source;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    @Override
    public String toString() {
        return "RuleCatalog{source='" + source + "', keywords=" + keywordCount()
                + ", overrides=" + overrideCount() + ", loadedAt=" + loadedAt + '}';
    }

    public static class Builder {

        private final TextNormalizer normalizer;
        private final Map<Category, Map<String, Keyword>> keywords = new EnumMap<>(Category.class);
        private final Map<String, Category> overrides = new LinkedHashMap<>();
        private String source = "inline";

        private Builder(TextNormalizer normalizer) {
            this.normalizer = normalizer;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder keywords(Category category, String... phrases) {
            for (String phrase : phrases) {
                keyword(category, phrase);
            }
            return this;
        }

        public Builder keyword(Category category, String phrase) {
            if (category == null) {
                throw new CatalogConfigException("Keyword '" + phrase + "' has no category");
            }
            if (phrase == null) {
                throw new CatalogConfigException("Null keyword for category " + category.getValue());
            }
            NormalizedText normalized = normalizer.normalize(phrase);
            if (normalized.isEmpty()) {
                throw new CatalogConfigException(
                        "Keyword '" + phrase + "' for category " + category.getValue() + " is empty after normalization");
            }
            keywords.computeIfAbsent(category, c -> new LinkedHashMap<>())
                    .putIfAbsent(normalized.getValue(), Keyword.of(normalized));
            return this;
        }

        public Builder override(String phrase, Category category) {
            if (category == null) {
                throw new CatalogConfigException("Override '" + phrase + "' has no category");
            }
            if (phrase == null) {
                throw new CatalogConfigException("Null override phrase for category " + category.getValue());
            }
            NormalizedText normalized = normalizer.normalize(phrase);
            if (normalized.isEmpty()) {
                throw new CatalogConfigException("Override phrase '" + phrase + "' is empty after normalization");
            }
            Category existing = overrides.putIfAbsent(normalized.getValue(), category);
            if (existing != null && existing != category) {
                throw new CatalogConfigException("Override phrase '" + normalized.getValue() + "' maps to both "
                        + existing.getValue() + " and " + category.getValue());
            }
            return this;
        }

        public RuleCatalog build() {
            Map<Category, List<Keyword>> frozen = new EnumMap<>(Category.class);
            keywords.forEach((category, byPhrase) ->
                    frozen.put(category, List.copyOf(new ArrayList<>(byPhrase.values()))));
            return new RuleCatalog(
                    Collections.unmodifiableMap(frozen),
                    Collections.unmodifiableMap(new LinkedHashMap<>(overrides)),
                    source,
                    Instant.now());
        }
    }
}
