package com.example.cachesync.decode;

import com.example.cachesync.model.DecodedEvent;
import com.example.cachesync.model.RawPayload;

import java.util.Optional;

/**
 * One way of turning a raw payload into document fields.
 */
public interface DecodingStrategy {

    /**
     * Name recorded on the decoded event, used in logs.
     */
    String name();

    /**
     * @return the decoded event, or empty when this strategy does not apply to the payload
     */
    Optional<DecodedEvent> tryDecode(RawPayload payload);
}
