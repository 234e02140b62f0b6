package com.sentinel.classifier.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.sentinel.classifier.config.ClassifierProperties;
import com.sentinel.classifier.dto.CatalogSummary;
import com.sentinel.classifier.dto.ClassificationResponse;
import com.sentinel.classifier.engine.CatalogConfigException;
import com.sentinel.classifier.engine.Category;
import com.sentinel.classifier.engine.RuleCatalog;
import com.sentinel.classifier.engine.RuleCatalogHolder;
import com.sentinel.classifier.engine.RuleCatalogLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owns the live rule catalog.
 *
 * The catalog is loaded once when the service is created; a broken catalog aborts startup.
 * {@link #reload()} builds the replacement completely before swapping it in, and a
 * rejected reload leaves the previous catalog serving.
 */
@Slf4j
@Service
public class RuleCatalogService {

    private final RuleCatalogLoader loader;
    private final ResourceLoader resourceLoader;
    private final Cache<String, ClassificationResponse> classificationCache;
    private final String location;
    private final RuleCatalogHolder holder;

    public RuleCatalogService(RuleCatalogLoader loader,
                              ResourceLoader resourceLoader,
                              Cache<String, ClassificationResponse> classificationCache,
                              ClassifierProperties properties) {
        this.loader = loader;
        this.resourceLoader = resourceLoader;
        this.classificationCache = classificationCache;
        this.location = properties.getRules().getLocation();
        this.holder = new RuleCatalogHolder(loadFromLocation());
    }

    public RuleCatalog current() {
        return holder.get();
    }

    public CatalogSummary summary() {
        return toSummary(holder.get());
    }

    /**
     * Re-read the configured location and publish the result.
     *
     * @throws CatalogConfigException when the new source is invalid; the old catalog stays active
     */
    public CatalogSummary reload() {
        RuleCatalog next;
        try {
            next = loadFromLocation();
        } catch (CatalogConfigException e) {
            log.warn("Rejected rule catalog reload from {}, keeping {}: {}", location, holder.get(), e.getMessage());
            throw e;
        }

        RuleCatalog previous = holder.replace(next);
        // cached responses were computed with the old rules
        classificationCache.invalidateAll();
        log.info("Rule catalog reloaded: {} -> {}", previous, next);
        return toSummary(next);
    }

    private RuleCatalog loadFromLocation() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogConfigException("Rule catalog not found at " + location);
        }
        try (InputStream input = resource.getInputStream()) {
            return loader.load(input, location);
        } catch (IOException e) {
            throw new CatalogConfigException("Failed to read rule catalog " + location, e);
        }
    }

    private CatalogSummary toSummary(RuleCatalog catalog) {
        Map<String, Integer> perCategory = new LinkedHashMap<>();
        for (Category category : Category.values()) {
            perCategory.put(category.getValue(), catalog.keywordsFor(category).size());
        }
        return CatalogSummary.builder()
                .source(catalog.getSource())
                .loadedAt(catalog.getLoadedAt())
                .keywordsPerCategory(perCategory)
                .overrideCount(catalog.overrideCount())
                .build();
    }
}
