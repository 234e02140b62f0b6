package com.sentinel.classifier.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka wiring for classification events: the JSON producer used by the event publisher
 * and the retry/dead-letter path of the request listener, plus the two service topics.
 */
@Slf4j
@Configuration
public class KafkaProducerConfig {

    static final String CLIENT_ID = "sentinel-classifier";

    private final String bootstrapServers;
    private final String classifiedTopic;
    private final String requestsTopic;
    private final int partitions;
    private final long maxBlockMs;

    public KafkaProducerConfig(@Value("${spring.kafka.bootstrap-servers}") String bootstrapServers,
                               @Value("${sentinel.kafka.topic.transaction-classified}") String classifiedTopic,
                               @Value("${sentinel.kafka.topic.classification-requests}") String requestsTopic,
                               @Value("${sentinel.kafka.topic.partitions:3}") int partitions,
                               @Value("${sentinel.kafka.producer.max-block-ms:5000}") long maxBlockMs) {
        this.bootstrapServers = bootstrapServers;
        this.classifiedTopic = classifiedTopic;
        this.requestsTopic = requestsTopic;
        this.partitions = partitions;
        this.maxBlockMs = maxBlockMs;
    }

    /**
     * Producer settings. Events are keyed by transaction id so one id always lands on the same
     * partition; {@code max.block.ms} bounds how long a send waits for broker metadata.
     */
    Map<String, Object> producerProperties() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.CLIENT_ID_CONFIG, CLIENT_ID);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);
        return props;
    }

    @Bean
    public ProducerFactory<String, Object> producerFactory() {
        log.info("Kafka producer '{}' -> {}, max.block.ms={}", CLIENT_ID, bootstrapServers, maxBlockMs);
        return new DefaultKafkaProducerFactory<>(producerProperties());
    }

    /**
     * Also referenced by name from {@code @RetryableTopic} for retry and DLT publishing
     */
    @Bean
    public KafkaTemplate<String, Object> kafkaTemplate(ProducerFactory<String, Object> producerFactory) {
        return new KafkaTemplate<>(producerFactory);
    }

    @Bean
    public KafkaAdmin.NewTopics classificationTopics() {
        return new KafkaAdmin.NewTopics(
                TopicBuilder.name(classifiedTopic).partitions(partitions).replicas(1).build(),
                TopicBuilder.name(requestsTopic).partitions(partitions).replicas(1).build());
    }
}
