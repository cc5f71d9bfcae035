package com.example.cachesync.service;

import com.example.cachesync.error.Classification;
import com.example.cachesync.error.ErrorKind;
import com.example.cachesync.model.ChangeEvent;
import com.example.cachesync.model.FailedEvent;
import com.example.cachesync.repository.FailedEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Persists terminally failed events for later analysis. Never fails the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailureRecorder {

    private final FailedEventRepository repository;
    private final Clock clock;

    public void record(ChangeEvent event, Classification classification, Throwable error) {
        try {
            FailedEvent failed = new FailedEvent(
                    event.eventId(),
                    event.collectionName(),
                    event.subjectPath(),
                    ErrorKind.of(error).name(),
                    classification.reason(),
                    String.valueOf(error.getMessage()),
                    event.deliveryAttempt(),
                    Instant.now(clock));
            repository.save(failed);
            log.info("Recorded failed event {} ({})", event.eventId(), classification.reason());
        } catch (Exception e) {
            log.error("Could not record failed event {}", event.eventId(), e);
        }
    }
}
