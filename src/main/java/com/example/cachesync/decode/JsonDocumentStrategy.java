package com.example.cachesync.decode;

import com.example.cachesync.model.DecodedEvent;
import com.example.cachesync.model.RawPayload;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes payloads carrying a plain JSON document, either as UTF-8 bytes or as a JSON object
 * without snapshot structure. Snapshot-shaped JSON is handed to {@link StructuredFieldsStrategy};
 * otherwise the top-level scalar fields are wrapped into a single-level snapshot so change kind
 * is derived the same way for every encoding.
 */
@Slf4j
public class JsonDocumentStrategy implements DecodingStrategy {

    public static final String NAME = "json";

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;
    private final StructuredFieldsStrategy structured;

    public JsonDocumentStrategy(ObjectMapper objectMapper, StructuredFieldsStrategy structured) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.structured = structured;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<DecodedEvent> tryDecode(RawPayload payload) {
        JsonNode node;
        if (payload instanceof RawPayload.Binary binary) {
            node = parse(binary.bytes());
        } else {
            node = ((RawPayload.Structured) payload).node();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        if (StructuredFieldsStrategy.hasSnapshotShape(node)) {
            return Optional.of(structured.decodeNode(node, NAME));
        }
        return Optional.of(structured.decodeNode(wrapTopLevel(node), NAME));
    }

    private JsonNode parse(byte[] bytes) {
        if (bytes.length == 0) {
            return null;
        }
        try {
            return strictReader.readTree(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            log.debug("Payload is not UTF-8 JSON: {}", e.getMessage());
            return null;
        }
    }

    private ObjectNode wrapTopLevel(JsonNode document) {
        ObjectNode fields = objectMapper.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> it = document.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode value = entry.getValue();
            ObjectNode wrapper = objectMapper.createObjectNode();
            if (value.isTextual()) {
                wrapper.put("stringValue", value.asText());
            } else if (value.isIntegralNumber() && value.canConvertToLong()) {
                wrapper.put("integerValue", value.asLong());
            } else if (value.isNumber()) {
                wrapper.put("doubleValue", value.asDouble());
            } else if (value.isBoolean()) {
                wrapper.put("booleanValue", value.asBoolean());
            } else {
                // single level only
                continue;
            }
            fields.set(entry.getKey(), wrapper);
        }
        ObjectNode snapshot = objectMapper.createObjectNode();
        snapshot.putObject("value").set("fields", fields);
        return snapshot;
    }
}
