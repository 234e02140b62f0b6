package com.sentinel.classifier.metrics;

import com.sentinel.classifier.engine.ClassificationMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the classification path.
 *
 * Exported via actuator as {@code classification_hits_total{hit_type}},
 * {@code classification_cache_requests_total{result}} and {@code classification_latency_seconds}.
 */
@Component
public class ClassificationMetrics {

    private final MeterRegistry registry;
    private final Timer latency;
    private final Counter cacheHits;
    private final Counter cacheMisses;

    public ClassificationMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.latency = Timer.builder("classification.latency")
                .description("Latency of a classification request")
                .register(registry);
        this.cacheHits = cacheCounter("hit");
        this.cacheMisses = cacheCounter("miss");
    }

    public void recordHit(ClassificationMethod method) {
        Counter.builder("classification.hits")
                .description("Classifications by hit type")
                .tag("hit_type", method.getTag())
                .register(registry)
                .increment();
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordLatency(Duration duration) {
        latency.record(duration);
    }

    private Counter cacheCounter(String result) {
        return Counter.builder("classification.cache.requests")
                .description("Cache requests labeled by result")
                .tag("result", result)
                .register(registry);
    }
}
