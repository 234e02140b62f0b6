package com.sentinel.classifier.dto;

import com.sentinel.classifier.engine.Category;
import com.sentinel.classifier.engine.ClassificationMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * DTO for a classified transaction and Kafka event payload.
 * Used for both API responses and event publishing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifiedTransactionEvent {

    private Long id;
    private String text;
    private BigDecimal amount;
    private Category category;
    private double confidence;
    private ClassificationMethod method;
    private String matchedTerm;
    private int hitCount;
    private Instant classifiedAt;
}
