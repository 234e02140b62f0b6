package com.sentinel.classifier.controller;

import com.sentinel.classifier.repository.ClassifiedTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness and readiness probes.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SystemController {

    private final ClassifiedTransactionRepository repository;

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * Ready when the history store answers a query
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Boolean>> ready() {
        try {
            repository.count();
            return ResponseEntity.ok(Map.of("ready", true));
        } catch (DataAccessException e) {
            log.warn("Readiness check failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("ready", false));
        }
    }
}
