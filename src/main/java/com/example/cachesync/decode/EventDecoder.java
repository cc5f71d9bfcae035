package com.example.cachesync.decode;

import com.example.cachesync.error.DecodeException;
import com.example.cachesync.model.DecodedEvent;
import com.example.cachesync.model.RawPayload;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Normalizes a raw change-event payload into typed document fields. Strategies are tried in a
 * fixed priority order: structured snapshot, JSON document, identifier scan.
 */
@Slf4j
@Component
public class EventDecoder {

    private final List<DecodingStrategy> strategies;

    @Autowired
    public EventDecoder(ObjectMapper objectMapper) {
        this(defaultStrategies(objectMapper));
    }

    EventDecoder(List<DecodingStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    static List<DecodingStrategy> defaultStrategies(ObjectMapper objectMapper) {
        StructuredFieldsStrategy structured = new StructuredFieldsStrategy();
        return List.of(
                structured,
                new JsonDocumentStrategy(objectMapper, structured),
                new IdentifierScanStrategy());
    }

    public DecodedEvent decode(RawPayload payload) {
        if (payload == null) {
            throw new DecodeException("Event carries no payload");
        }
        for (DecodingStrategy strategy : strategies) {
            Optional<DecodedEvent> decoded = strategy.tryDecode(payload);
            if (decoded.isPresent()) {
                DecodedEvent event = decoded.get();
                log.debug("Decoded {} as {} {} with {} field(s)",
                        payload.describe(), event.changeKind(), strategy.name(), event.fields().size());
                return event;
            }
        }
        throw new DecodeException("No known encoding applies to " + payload.describe());
    }
}
