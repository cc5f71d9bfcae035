package com.example.cachesync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.kafka.ConcurrentKafkaListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Listener container with manual acknowledgement. A record whose listener throws is redelivered
 * with a fixed back-off and published to {@code <topic>.DLT} once redeliveries are exhausted.
 */
@Slf4j
@Configuration
public class KafkaManualAckConfig {

    @Bean(name = "manualAckContainerFactory")
    public ConcurrentKafkaListenerContainerFactory<String, byte[]> manualAckContainerFactory(
            ConcurrentKafkaListenerContainerFactoryConfigurer configurer,
            ConsumerFactory<Object, Object> consumerFactory,
            KafkaTemplate<Object, Object> kafkaTemplate,
            @Value("${cache-sync.kafka.max-redeliveries:5}") long maxRedeliveries,
            @Value("${cache-sync.kafka.redelivery-interval-ms:1000}") long redeliveryIntervalMs) {
        ConcurrentKafkaListenerContainerFactory<Object, Object> genericFactory =
                new ConcurrentKafkaListenerContainerFactory<>();
        configurer.configure(genericFactory, consumerFactory);
        genericFactory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        genericFactory.getContainerProperties().setDeliveryAttemptHeader(true);

        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(kafkaTemplate);
        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer,
                new FixedBackOff(redeliveryIntervalMs, maxRedeliveries));
        errorHandler.setCommitRecovered(true);
        errorHandler.setRetryListeners((record, ex, deliveryAttempt) ->
                log.warn("Delivery attempt {} failed for {}-{}@{}: {}", deliveryAttempt,
                        record.topic(), record.partition(), record.offset(), ex.getMessage()));
        genericFactory.setCommonErrorHandler(errorHandler);
        log.info("Manual-ack container factory configured with {} redeliveries every {} ms",
                maxRedeliveries, redeliveryIntervalMs);

        @SuppressWarnings("unchecked")
        ConcurrentKafkaListenerContainerFactory<String, byte[]> typedFactory =
                (ConcurrentKafkaListenerContainerFactory<String, byte[]>) (ConcurrentKafkaListenerContainerFactory<?, ?>) genericFactory;
        return typedFactory;
    }
}
