package com.sentinel.classifier.controller;

import com.sentinel.classifier.dto.ClassifiedTransactionEvent;
import com.sentinel.classifier.dto.TransactionStatsResponse;
import com.sentinel.classifier.engine.Category;
import com.sentinel.classifier.exception.InvalidRequestException;
import com.sentinel.classifier.service.ClassificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the classification history.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
public class ClassifiedTransactionController {

    private final ClassificationService classificationService;

    /**
     * Get all classified transactions, optionally filtered by category name
     */
    @GetMapping
    public ResponseEntity<List<ClassifiedTransactionEvent>> getTransactions(
            @RequestParam(required = false) String category) {
        log.info("Fetching classified transactions, category filter: {}", category);
        Category filter = category == null ? null : Category.fromName(category)
                .orElseThrow(() -> new InvalidRequestException("Unknown category: " + category));
        return ResponseEntity.ok(classificationService.getTransactions(filter));
    }

    /**
     * Get a classified transaction by ID
     */
    @GetMapping("/{id}")
    public ResponseEntity<ClassifiedTransactionEvent> getTransaction(@PathVariable Long id) {
        log.info("Fetching classified transaction: {}", id);
        return ResponseEntity.ok(classificationService.getTransaction(id));
    }

    /**
     * Per-category counts over the whole history
     */
    @GetMapping("/stats")
    public ResponseEntity<TransactionStatsResponse> getStats() {
        return ResponseEntity.ok(classificationService.getStats());
    }
}
