package com.sentinel.classifier.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response body of the classification endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationResponse {

    private ClassifiedTransactionEvent transaction;

    /**
     * Human readable summary, e.g. "Transaction classified as food via token_match (0.75)"
     */
    private String message;
}
