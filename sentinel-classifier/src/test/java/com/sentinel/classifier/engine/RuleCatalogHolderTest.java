package com.sentinel.classifier.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleCatalogHolderTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    void replaceReturnsPreviousCatalog() {
        RuleCatalog first = RuleCatalog.builder(normalizer).keywords(Category.FOOD, "coffee").build();
        RuleCatalog second = RuleCatalog.builder(normalizer).keywords(Category.RENT, "rent").build();
        RuleCatalogHolder holder = new RuleCatalogHolder(first);

        assertThat(holder.replace(second)).isSameAs(first);
        assertThat(holder.get()).isSameAs(second);
    }

    @Test
    void rejectsNullCatalog() {
        assertThatThrownBy(() -> new RuleCatalogHolder(null)).isInstanceOf(IllegalArgumentException.class);

        RuleCatalogHolder holder = new RuleCatalogHolder(RuleCatalog.builder(normalizer).build());
        assertThatThrownBy(() -> holder.replace(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
