package com.sentinel.classifier.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Spending categories a transaction description can be assigned to.
 *
 * Declaration order is the final tie-break priority when two categories have the
 * same keyword evidence: earlier constants win.
 */
public enum Category {

    FOOD,
    TRANSPORT,
    ENTERTAINMENT,
    SHOPPING,
    BILLS,
    UTILITIES,
    RENT,
    TRANSFER,

    /**
     * Universal fallback when no rule applies
     */
    OTHER;

    /**
     * Lowercase wire name, e.g. {@code "food"}
     */
    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup by name.
     */
    public static Optional<Category> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String wanted = name.trim().toUpperCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.name().equals(wanted)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Category fromJson(String name) {
        return fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown category: " + name));
    }
}
