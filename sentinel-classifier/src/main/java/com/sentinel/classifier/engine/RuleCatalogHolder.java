package com.sentinel.classifier.engine;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Publishes the current {@link RuleCatalog}. Replacement is a single reference swap, so a
 * reader sees either the old or the new catalog in full.
 */
public class RuleCatalogHolder implements Supplier<RuleCatalog> {

    private final AtomicReference<RuleCatalog> current;

    public RuleCatalogHolder(RuleCatalog initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial catalog is required");
        }
        this.current = new AtomicReference<>(initial);
    }

    @Override
    public RuleCatalog get() {
        return current.get();
    }

    /**
     * @return the catalog that was replaced
     */
    public RuleCatalog replace(RuleCatalog next) {
        if (next == null) {
            throw new IllegalArgumentException("catalog is required");
        }
        return current.getAndSet(next);
    }
}
