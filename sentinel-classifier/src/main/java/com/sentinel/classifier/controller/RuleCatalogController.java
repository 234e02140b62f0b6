package com.sentinel.classifier.controller;

import com.sentinel.classifier.dto.CatalogSummary;
import com.sentinel.classifier.service.RuleCatalogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inspection and hot reload of the rule catalog.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/rules")
@RequiredArgsConstructor
public class RuleCatalogController {

    private final RuleCatalogService ruleCatalogService;

    @GetMapping
    public ResponseEntity<CatalogSummary> getCatalog() {
        return ResponseEntity.ok(ruleCatalogService.summary());
    }

    /**
     * Reload rules from the configured location. An invalid catalog is rejected with 422
     * and the current one keeps serving.
     */
    @PostMapping("/reload")
    public ResponseEntity<CatalogSummary> reload() {
        log.info("Rule catalog reload requested");
        return ResponseEntity.ok(ruleCatalogService.reload());
    }
}
