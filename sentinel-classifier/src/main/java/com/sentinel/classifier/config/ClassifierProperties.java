package com.sentinel.classifier.config;

import com.sentinel.classifier.engine.Category;
import com.sentinel.classifier.engine.ScoringPolicy;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Classifier settings bound from {@code classifier.*}.
 */
@ConfigurationProperties(prefix = "classifier")
@NoArgsConstructor
@Getter
@Setter
public class ClassifierProperties {

    private Rules rules = new Rules();
    private Scoring scoring = new Scoring();
    private Cache cache = new Cache();
    private Batch batch = new Batch();
    private Events events = new Events();

    @Getter
    @Setter
    public static class Rules {
        /** Spring resource location of the JSON rule catalog. */
        private String location = "classpath:classification-rules.json";
    }

    @Getter
    @Setter
    public static class Scoring {
        private Category defaultCategory = Category.OTHER;
        private double baselineConfidence = 0.5;
        private double emptyConfidence = 0.0;
        private double tokenBaseConfidence = 0.6;
        private double tokenIncrement = 0.15;
        private double tokenCeiling = 0.95;

        public ScoringPolicy toPolicy() {
            return ScoringPolicy.builder()
                    .defaultCategory(defaultCategory)
                    .baselineConfidence(baselineConfidence)
                    .emptyConfidence(emptyConfidence)
                    .tokenBaseConfidence(tokenBaseConfidence)
                    .tokenIncrement(tokenIncrement)
                    .tokenCeiling(tokenCeiling)
                    .build();
        }
    }

    @Getter
    @Setter
    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(1);
        private long maxSize = 10_000;
    }

    @Getter
    @Setter
    public static class Batch {
        /** Upper bound on items accepted by one batch request. */
        private int maxSize = 100;
    }

    @Getter
    @Setter
    public static class Events {
        private boolean enabled = true;
    }
}
