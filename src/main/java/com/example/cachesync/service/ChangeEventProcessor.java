package com.example.cachesync.service;

import com.example.cachesync.config.CacheSyncProperties;
import com.example.cachesync.decode.EventDecoder;
import com.example.cachesync.error.Classification;
import com.example.cachesync.error.ErrorClassifier;
import com.example.cachesync.model.CacheRecord;
import com.example.cachesync.model.ChangeEvent;
import com.example.cachesync.model.DecodedEvent;
import com.example.cachesync.model.EnrichmentResult;
import com.example.cachesync.model.Identifiers;
import com.example.cachesync.model.PipelineMode;
import com.example.cachesync.model.ProcessingOutcome;
import com.example.cachesync.validate.IdentifierValidator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs one change event through decode, validate, enrich and write. Every failure is caught here
 * exactly once and classified; the caller only decides whether to hand the event back to the broker.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeEventProcessor {

    static final String EVENTS_METRIC = "cache.sync.events";

    private final EventDecoder decoder;
    private final IdentifierValidator validator;
    private final CacheSyncProperties properties;
    private final EnrichmentService enrichmentService;
    private final CacheWriter cacheWriter;
    private final ErrorClassifier classifier;
    private final FailureRecorder failureRecorder;
    private final MeterRegistry meterRegistry;

    public ProcessingOutcome process(ChangeEvent event) {
        log.info("Processing event {} from {} ({}), attempt {}",
                event.eventId(), event.collectionName(), event.subjectPath(), event.deliveryAttempt());
        try {
            DecodedEvent decoded = decoder.decode(event.rawPayload());
            if (decoded.isDeletion()) {
                log.info("Event {} is a deletion, nothing to cache", event.eventId());
                count(ProcessingOutcome.Status.SKIPPED_DELETED);
                return ProcessingOutcome.skippedDeleted();
            }

            Identifiers identifiers = validator.validate(decoded.fields());
            PipelineMode mode = properties.modeFor(event.collectionName());
            EnrichmentResult result = enrichmentService.enrich(
                    event.collectionName(), mode, identifiers, decoded.fields());
            List<CacheRecord> written = cacheWriter.write(mode, event.collectionName(), identifiers, result);

            log.info("Event {} materialized into {}", event.eventId(),
                    written.stream().map(CacheRecord::key).toList());
            count(ProcessingOutcome.Status.COMPLETED);
            return ProcessingOutcome.completed();
        } catch (RuntimeException e) {
            Classification classification = classifier.classify(e, event.subjectPath());
            ProcessingOutcome outcome = ProcessingOutcome.failed(classification, e);
            if (outcome.shouldRedeliver()) {
                log.warn("Event {} failed with retryable error ({}): {}",
                        event.eventId(), classification.reason(), e.getMessage());
            } else {
                log.error("Event {} failed terminally ({}): {}",
                        event.eventId(), classification.reason(), e.getMessage(), e);
                failureRecorder.record(event, classification, e);
            }
            count(outcome.status());
            return outcome;
        }
    }

    private void count(ProcessingOutcome.Status status) {
        meterRegistry.counter(EVENTS_METRIC, "outcome", status.name().toLowerCase()).increment();
    }
}
