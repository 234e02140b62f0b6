package com.sentinel.classifier.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * DTO for a classification request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifyTransactionRequest {

    /**
     * Free-text description. May be empty; an empty description classifies as "other".
     */
    @NotNull(message = "Text is required")
    @Size(max = 2000, message = "Text must be at most 2000 characters")
    private String text;

    /**
     * Optional amount. Negative amounts are refunds and are never served from cache.
     */
    private BigDecimal amount;
}
