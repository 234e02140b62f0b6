package com.sentinel.classifier.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sentinel.classifier.dto.ClassificationResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Local cache of classification responses keyed by description and amount.
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    public Cache<String, ClassificationResponse> classificationCache(ClassifierProperties properties) {
        ClassifierProperties.Cache settings = properties.getCache();
        log.info("Configuring classification cache - enabled: {}, maxSize: {}, ttl: {}",
                settings.isEnabled(), settings.getMaxSize(), settings.getTtl());

        return Caffeine.newBuilder()
                .maximumSize(settings.getMaxSize())
                .expireAfterWrite(settings.getTtl())
                .recordStats()
                .build();
    }
}
