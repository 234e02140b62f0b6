package com.sentinel.classifier.controller;

import com.sentinel.classifier.dto.BatchClassifyRequest;
import com.sentinel.classifier.dto.ClassificationResponse;
import com.sentinel.classifier.dto.ClassifyTransactionRequest;
import com.sentinel.classifier.service.ClassificationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for classifying transaction descriptions.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/classifications")
@RequiredArgsConstructor
public class ClassificationController {

    private final ClassificationService classificationService;

    /**
     * Classify a single description.
     * Fresh results are stored in the history and published to Kafka.
     */
    @PostMapping
    public ResponseEntity<ClassificationResponse> classify(@Valid @RequestBody ClassifyTransactionRequest request) {
        log.debug("Received classification request, text length: {}", request.getText().length());
        return ResponseEntity.ok(classificationService.classify(request));
    }

    /**
     * Classify several descriptions in one call
     */
    @PostMapping("/batch")
    public ResponseEntity<List<ClassificationResponse>> classifyBatch(@Valid @RequestBody BatchClassifyRequest request) {
        log.info("Received batch classification request with {} items", request.getTransactions().size());
        return ResponseEntity.ok(classificationService.classifyBatch(request.getTransactions()));
    }
}
