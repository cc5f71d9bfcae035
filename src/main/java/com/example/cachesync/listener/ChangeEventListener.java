package com.example.cachesync.listener;

import com.example.cachesync.error.RetryableProcessingException;
import com.example.cachesync.model.ChangeEvent;
import com.example.cachesync.model.CloudEventEnvelope;
import com.example.cachesync.model.ProcessingOutcome;
import com.example.cachesync.model.RawPayload;
import com.example.cachesync.service.ChangeEventProcessor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Entry point for document change notifications. Offsets are committed only after the pipeline
 * has finished with the record, or not at all when the failure is worth a redelivery.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChangeEventListener {

    static final String CE_ID = "ce_id";
    static final String CE_TYPE = "ce_type";
    static final String CE_SUBJECT = "ce_subject";
    private static final String DOCUMENTS_SEGMENT = "documents/";

    private final ChangeEventProcessor processor;
    private final ObjectMapper objectMapper;

    @KafkaListener(id = "changeEventsListener",
            topics = "#{'${cache-sync.kafka.topics}'.split(',')}",
            groupId = "${cache-sync.kafka.group-id:activity-cache-sync}",
            containerFactory = "manualAckContainerFactory")
    public void consume(ConsumerRecord<String, byte[]> record, Acknowledgment ack) {
        ChangeEvent event = toChangeEvent(record);
        ProcessingOutcome outcome = processor.process(event);
        if (outcome.shouldRedeliver()) {
            throw new RetryableProcessingException(event.eventId(),
                    outcome.classification().reason(), outcome.failure());
        }
        ack.acknowledge();
        log.debug("Acknowledged {} with outcome {}", event.eventId(), outcome.status());
    }

    ChangeEvent toChangeEvent(ConsumerRecord<String, byte[]> record) {
        String fallbackId = record.topic() + "-" + record.partition() + "@" + record.offset();
        Integer brokerAttempt = deliveryAttemptHeader(record);

        String headerSubject = header(record, CE_SUBJECT);
        if (headerSubject != null) {
            String id = header(record, CE_ID);
            log.debug("Binary-mode event {} of type {}", id, header(record, CE_TYPE));
            RawPayload payload = record.value() == null ? null : new RawPayload.Binary(record.value());
            return new ChangeEvent(id != null ? id : fallbackId, collectionOf(headerSubject), headerSubject,
                    payload, brokerAttempt != null ? brokerAttempt : 1);
        }

        CloudEventEnvelope envelope = parseEnvelope(record);
        if (envelope == null) {
            return new ChangeEvent(fallbackId, null, null, null, brokerAttempt != null ? brokerAttempt : 1);
        }
        int attempt = brokerAttempt != null ? brokerAttempt
                : envelope.getDeliveryAttempt() != null ? envelope.getDeliveryAttempt() : 1;
        return new ChangeEvent(envelope.getId() != null ? envelope.getId() : fallbackId,
                collectionOf(envelope.getSubject()), envelope.getSubject(), payloadOf(envelope.getData()), attempt);
    }

    private CloudEventEnvelope parseEnvelope(ConsumerRecord<String, byte[]> record) {
        if (record.value() == null) {
            log.warn("Record {}-{}@{} has no value", record.topic(), record.partition(), record.offset());
            return null;
        }
        try {
            return objectMapper.readValue(record.value(), CloudEventEnvelope.class);
        } catch (IOException e) {
            log.warn("Record {}-{}@{} is not a readable event envelope: {}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
            return null;
        }
    }

    private RawPayload payloadOf(JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return null;
        }
        if (data.isTextual()) {
            try {
                return new RawPayload.Binary(Base64.getDecoder().decode(data.asText()));
            } catch (IllegalArgumentException e) {
                return RawPayload.Binary.ofUtf8(data.asText());
            }
        }
        return new RawPayload.Structured(data);
    }

    static String collectionOf(String subject) {
        if (subject == null || subject.isEmpty()) {
            return null;
        }
        String path = subject;
        int documents = path.indexOf(DOCUMENTS_SEGMENT);
        if (documents >= 0) {
            path = path.substring(documents + DOCUMENTS_SEGMENT.length());
        }
        int slash = path.indexOf('/');
        return slash >= 0 ? path.substring(0, slash) : path;
    }

    private static String header(ConsumerRecord<String, byte[]> record, String name) {
        Header header = record.headers().lastHeader(name);
        if (header == null || header.value() == null) {
            return null;
        }
        return new String(header.value(), StandardCharsets.UTF_8);
    }

    private static Integer deliveryAttemptHeader(ConsumerRecord<String, byte[]> record) {
        Header header = record.headers().lastHeader(KafkaHeaders.DELIVERY_ATTEMPT);
        if (header == null || header.value() == null || header.value().length != Integer.BYTES) {
            return null;
        }
        return ByteBuffer.wrap(header.value()).getInt();
    }
}
