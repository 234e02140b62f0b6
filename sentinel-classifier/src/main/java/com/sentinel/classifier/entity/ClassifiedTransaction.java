package com.sentinel.classifier.entity;

import com.sentinel.classifier.engine.Category;
import com.sentinel.classifier.engine.ClassificationMethod;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A transaction description together with the category the rule engine assigned to it.
 */
@Entity
@Table(name = "classified_transactions", indexes = {
        @Index(name = "idx_classified_category", columnList = "category"),
        @Index(name = "idx_classified_at", columnList = "classifiedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifiedTransaction {

    /**
     * Sequential identifier, first record is 1
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Description exactly as submitted
     */
    @Column(nullable = false, length = 2000)
    private String description;

    /**
     * Optional amount; negative values are refunds
     */
    @Column(precision = 19, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Category category;

    @Column(nullable = false)
    private Double confidence;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ClassificationMethod method;

    /**
     * Override phrase or keyword that decided the category
     */
    @Column(length = 500)
    private String matchedTerm;

    @Column(nullable = false)
    private int hitCount;

    @Column(nullable = false, updatable = false)
    @Builder.Default
    private Instant classifiedAt = Instant.now();
}
