package com.sentinel.classifier.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Parses a JSON rule document into a {@link RuleCatalog}.
 *
 * Expected shape:
 * <pre>
 * {
 *   "keywords":  { "food": ["coffee", "uber eats"], "transport": ["gas"] },
 *   "overrides": { "groceries and toiletries": "food" }
 * }
 * </pre>
 * {@code keywords} is required, {@code overrides} optional. Other top-level keys are ignored.
 */
@Slf4j
public class RuleCatalogLoader {

    private static final String KEYWORDS = "keywords";
    private static final String OVERRIDES = "overrides";
    private static final Set<String> KNOWN_KEYS = Set.of(KEYWORDS, OVERRIDES);

    private final ObjectMapper objectMapper;
    private final TextNormalizer normalizer;

    public RuleCatalogLoader(ObjectMapper objectMapper, TextNormalizer normalizer) {
        this.objectMapper = objectMapper;
        this.normalizer = normalizer;
    }

    public RuleCatalog load(InputStream input, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(input);
        } catch (IOException e) {
            throw new CatalogConfigException("Rule catalog " + source + " is not valid JSON", e);
        }
        return load(root, source);
    }

    public RuleCatalog load(String json, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CatalogConfigException("Rule catalog " + source + " is not valid JSON", e);
        }
        return load(root, source);
    }

    public RuleCatalog load(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new CatalogConfigException("Rule catalog " + source + " must be a JSON object");
        }

        root.fieldNames().forEachRemaining(key -> {
            if (!KNOWN_KEYS.contains(key)) {
                log.debug("Ignoring unknown key '{}' in rule catalog {}", key, source);
            }
        });

        RuleCatalog.Builder builder = RuleCatalog.builder(normalizer).source(source);
        readKeywords(root.get(KEYWORDS), builder);
        readOverrides(root.get(OVERRIDES), builder);

        RuleCatalog catalog = builder.build();
        log.info("Loaded rule catalog from {}: {} keywords, {} overrides",
                source, catalog.keywordCount(), catalog.overrideCount());
        return catalog;
    }

    private void readKeywords(JsonNode node, RuleCatalog.Builder builder) {
        if (node == null || !node.isObject()) {
            throw new CatalogConfigException("'" + KEYWORDS + "' must be an object of category -> keyword list");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            Category category = requireCategory(entry.getKey());
            JsonNode list = entry.getValue();
            if (!list.isArray()) {
                throw new CatalogConfigException("Keywords for category '" + entry.getKey() + "' must be an array");
            }
            for (JsonNode keyword : list) {
                if (!keyword.isTextual()) {
                    throw new CatalogConfigException("Keyword " + keyword + " for category '"
                            + entry.getKey() + "' is not a string");
                }
                builder.keyword(category, keyword.textValue());
            }
        }
    }

    private void readOverrides(JsonNode node, RuleCatalog.Builder builder) {
        if (node == null || node.isNull()) {
            return;
        }
        if (!node.isObject()) {
            throw new CatalogConfigException("'" + OVERRIDES + "' must be an object of phrase -> category");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isTextual()) {
                throw new CatalogConfigException("Override '" + entry.getKey() + "' must map to a category name");
            }
            builder.override(entry.getKey(), requireCategory(entry.getValue().textValue()));
        }
    }

    private Category requireCategory(String name) {
        return Category.fromName(name)
                .orElseThrow(() -> new CatalogConfigException("Unknown category '" + name + "'"));
    }
}
