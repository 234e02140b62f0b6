package com.sentinel.classifier.service;

import com.sentinel.classifier.config.ClassifierProperties;
import com.sentinel.classifier.dto.ClassifiedTransactionEvent;
import com.sentinel.classifier.engine.Category;
import org.apache.kafka.common.KafkaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClassificationEventPublisher Tests")
class ClassificationEventPublisherTest {

    private static final String TOPIC = "txn.classified";

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private ClassifierProperties properties;
    private ClassifiedTransactionEvent event;

    @BeforeEach
    void setUp() {
        properties = new ClassifierProperties();
        event = ClassifiedTransactionEvent.builder().id(11L).text("Costa").category(Category.FOOD).build();
    }

    private ClassificationEventPublisher newPublisher() {
        ClassificationEventPublisher publisher = new ClassificationEventPublisher(kafkaTemplate, properties);
        ReflectionTestUtils.setField(publisher, "transactionClassifiedTopic", TOPIC);
        return publisher;
    }

    @Test
    @DisplayName("Should send the event keyed by transaction id")
    void shouldSendKeyedById() {
        CompletableFuture<SendResult<String, Object>> pending = new CompletableFuture<>();
        when(kafkaTemplate.send(TOPIC, "11", event)).thenReturn(pending);

        newPublisher().publish(event);

        verify(kafkaTemplate).send(TOPIC, "11", event);
    }

    @Test
    @DisplayName("Should not propagate asynchronous send failures")
    void shouldSwallowAsyncFailure() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("broker down")));

        assertThatCode(() -> newPublisher().publish(event)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should not propagate synchronous send failures")
    void shouldSwallowSyncFailure() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenThrow(new KafkaException("metadata timeout"));

        assertThatCode(() -> newPublisher().publish(event)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should do nothing when events are disabled")
    void shouldSkipWhenDisabled() {
        properties.getEvents().setEnabled(false);

        newPublisher().publish(event);

        verifyNoInteractions(kafkaTemplate);
    }
}
