package com.sentinel.classifier.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.sentinel.classifier.config.ClassifierProperties;
import com.sentinel.classifier.dto.ClassificationResponse;
import com.sentinel.classifier.dto.ClassifiedTransactionEvent;
import com.sentinel.classifier.dto.ClassifyTransactionRequest;
import com.sentinel.classifier.dto.TransactionStatsResponse;
import com.sentinel.classifier.engine.Category;
import com.sentinel.classifier.engine.ClassificationEngine;
import com.sentinel.classifier.engine.ClassificationResult;
import com.sentinel.classifier.entity.ClassifiedTransaction;
import com.sentinel.classifier.exception.InvalidRequestException;
import com.sentinel.classifier.exception.TransactionNotFoundException;
import com.sentinel.classifier.metrics.ClassificationMetrics;
import com.sentinel.classifier.repository.ClassifiedTransactionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Service for classifying transactions and querying the classification history.
 * Handles caching, persistence, event publishing and metrics around the rule engine.
 */
@Slf4j
@Service
public class ClassificationService {

    private final ClassificationEngine engine;
    private final ClassifiedTransactionRepository repository;
    private final Cache<String, ClassificationResponse> cache;
    private final ClassificationEventPublisher eventPublisher;
    private final ClassificationMetrics metrics;
    private final boolean cacheEnabled;
    private final int maxBatchSize;

    public ClassificationService(ClassificationEngine engine,
                                 ClassifiedTransactionRepository repository,
                                 Cache<String, ClassificationResponse> classificationCache,
                                 ClassificationEventPublisher eventPublisher,
                                 ClassificationMetrics metrics,
                                 ClassifierProperties properties) {
        this.engine = engine;
        this.repository = repository;
        this.cache = classificationCache;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.cacheEnabled = properties.getCache().isEnabled();
        this.maxBatchSize = properties.getBatch().getMaxSize();
    }

    /**
     * Classify a transaction description.
     * 1. Serve from cache when the same text and amount were seen recently (refunds excluded)
     * 2. Otherwise run the rule engine and persist the result
     * 3. Publish the classified transaction to Kafka
     */
    @Transactional
    public ClassificationResponse classify(ClassifyTransactionRequest request) {
        long started = System.nanoTime();
        String cacheKey = cacheKey(request.getText(), request.getAmount());
        boolean cacheable = cacheEnabled && !isRefund(request.getAmount());

        if (cacheable) {
            ClassificationResponse cached = cache.getIfPresent(cacheKey);
            if (cached != null) {
                metrics.recordCacheHit();
                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                metrics.recordLatency(elapsed);
                log.info("Cache hit for key '{}' (transaction {}) in {} ms",
                        cacheKey, cached.getTransaction().getId(), elapsed.toMillis());
                return cached;
            }
            metrics.recordCacheMiss();
        }

        ClassificationResult result = engine.classify(request.getText(), request.getAmount());

        ClassifiedTransaction saved = repository.save(ClassifiedTransaction.builder()
                .description(request.getText())
                .amount(request.getAmount())
                .category(result.getCategory())
                .confidence(result.getConfidence())
                .method(result.getMethod())
                .matchedTerm(result.getMatchedTerm())
                .hitCount(result.getHitCount())
                .build());

        ClassifiedTransactionEvent event = toEvent(saved);
        ClassificationResponse response = ClassificationResponse.builder()
                .transaction(event)
                .message(message(result))
                .build();

        if (cacheable) {
            cache.put(cacheKey, response);
        }

        eventPublisher.publish(event);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        metrics.recordHit(result.getMethod());
        metrics.recordLatency(elapsed);
        log.info("Classified transaction {}: category={}, confidence={}, method={}, matched='{}', duration={} ms",
                saved.getId(), result.getCategory().getValue(), result.getConfidence(),
                result.getMethod().getTag(), result.getMatchedTerm(), elapsed.toMillis());

        return response;
    }

    /**
     * Classify several descriptions; responses keep the request order.
     */
    @Transactional
    public List<ClassificationResponse> classifyBatch(List<ClassifyTransactionRequest> requests) {
        if (requests.size() > maxBatchSize) {
            throw new InvalidRequestException(
                    "Batch of " + requests.size() + " exceeds the limit of " + maxBatchSize + " transactions");
        }
        log.info("Classifying batch of {} transactions", requests.size());
        return requests.stream()
                .map(this::classify)
                .toList();
    }

    /**
     * Get all classified transactions, optionally restricted to one category
     */
    @Transactional(readOnly = true)
    public List<ClassifiedTransactionEvent> getTransactions(Category category) {
        List<ClassifiedTransaction> rows = category == null
                ? repository.findAllByOrderByIdAsc()
                : repository.findByCategoryOrderByIdAsc(category);
        return rows.stream()
                .map(this::toEvent)
                .toList();
    }

    @Transactional(readOnly = true)
    public ClassifiedTransactionEvent getTransaction(Long id) {
        return repository.findById(id)
                .map(this::toEvent)
                .orElseThrow(() -> new TransactionNotFoundException(id));
    }

    /**
     * Count of stored transactions per category
     */
    @Transactional(readOnly = true)
    public TransactionStatsResponse getStats() {
        Map<String, Long> stats = new LinkedHashMap<>();
        for (Category category : Category.values()) {
            stats.put(category.getValue(), 0L);
        }

        long total = 0;
        for (ClassifiedTransactionRepository.CategoryCount row : repository.countGroupedByCategory()) {
            stats.put(row.getCategory().getValue(), row.getTotal());
            total += row.getTotal();
        }

        return TransactionStatsResponse.builder()
                .totalTransactions(total)
                .stats(stats)
                .build();
    }

    static String cacheKey(String text, BigDecimal amount) {
        String normalizedText = text == null ? "" : text.strip().toLowerCase(Locale.ROOT);
        String amountText = amount == null ? "0.00" : amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
        return normalizedText + ":" + amountText;
    }

    private static boolean isRefund(BigDecimal amount) {
        return amount != null && amount.signum() < 0;
    }

    private static String message(ClassificationResult result) {
        return String.format(Locale.ROOT, "Transaction classified as %s via %s (%.2f)",
                result.getCategory().getValue(), result.getMethod().getTag(), result.getConfidence());
    }

    /**
     * Convert entity to event DTO
     */
    private ClassifiedTransactionEvent toEvent(ClassifiedTransaction transaction) {
        return ClassifiedTransactionEvent.builder()
                .id(transaction.getId())
                .text(transaction.getDescription())
                .amount(transaction.getAmount())
                .category(transaction.getCategory())
                .confidence(transaction.getConfidence())
                .method(transaction.getMethod())
                .matchedTerm(transaction.getMatchedTerm())
                .hitCount(transaction.getHitCount())
                .classifiedAt(transaction.getClassifiedAt())
                .build();
    }
}
