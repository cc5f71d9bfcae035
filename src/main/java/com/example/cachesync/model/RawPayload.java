package com.example.cachesync.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;

/**
 * Undecoded event data as delivered by the broker. Either an already structured JSON value
 * or an opaque byte sequence whose encoding is unknown until a decoder accepts it.
 */
public sealed interface RawPayload permits RawPayload.Structured, RawPayload.Binary {

    /**
     * Short description used in logs, never the full payload.
     */
    String describe();

    record Structured(JsonNode node) implements RawPayload {
        @Override
        public String describe() {
            return "structured(" + node.getNodeType() + ")";
        }
    }

    record Binary(byte[] bytes) implements RawPayload {

        public static Binary ofUtf8(String text) {
            return new Binary(text.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public String describe() {
            return "binary(" + bytes.length + " bytes)";
        }
    }
}
