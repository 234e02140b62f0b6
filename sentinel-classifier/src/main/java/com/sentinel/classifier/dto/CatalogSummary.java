package com.sentinel.classifier.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Shape of the rule catalog currently in use.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogSummary {

    private String source;
    private Instant loadedAt;
    private Map<String, Integer> keywordsPerCategory;
    private int overrideCount;
}
