package com.example.cachesync.decode;

import com.example.cachesync.model.DocumentFields;
import com.example.cachesync.model.FieldValue;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Unwraps Firestore typed value wrappers ({@code stringValue}, {@code mapValue}, ...) into
 * {@link FieldValue} variants. Wrappers outside the supported set are dropped.
 */
@Slf4j
final class FirestoreValueReader {

    static final Set<String> WRAPPER_KINDS = Set.of(
            "stringValue", "integerValue", "doubleValue", "booleanValue", "timestampValue",
            "mapValue", "arrayValue", "nullValue", "referenceValue", "geoPointValue", "bytesValue");

    private FirestoreValueReader() {
    }

    /**
     * True when {@code fieldsNode} is a non-empty object whose every entry is a single typed wrapper.
     */
    static boolean isTypedFieldMap(JsonNode fieldsNode) {
        if (fieldsNode == null || !fieldsNode.isObject() || fieldsNode.size() == 0) {
            return false;
        }
        Iterator<JsonNode> it = fieldsNode.elements();
        while (it.hasNext()) {
            JsonNode wrapper = it.next();
            if (!wrapper.isObject() || wrapper.size() != 1 || !WRAPPER_KINDS.contains(wrapper.fieldNames().next())) {
                return false;
            }
        }
        return true;
    }

    static DocumentFields readFields(JsonNode fieldsNode) {
        if (fieldsNode == null || !fieldsNode.isObject()) {
            return DocumentFields.empty();
        }
        Map<String, FieldValue> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = fieldsNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            FieldValue value = readValue(entry.getKey(), entry.getValue());
            if (value != null) {
                values.put(entry.getKey(), value);
            }
        }
        return DocumentFields.of(values);
    }

    static FieldValue readValue(String name, JsonNode wrapper) {
        if (wrapper == null || !wrapper.isObject()) {
            return null;
        }
        if (wrapper.has("stringValue")) {
            return new FieldValue.StringValue(wrapper.get("stringValue").asText());
        }
        if (wrapper.has("integerValue")) {
            // int64 is transported as a JSON string
            JsonNode raw = wrapper.get("integerValue");
            try {
                return new FieldValue.IntegerValue(raw.isNumber() ? raw.asLong() : Long.parseLong(raw.asText().trim()));
            } catch (NumberFormatException e) {
                log.warn("Dropping field '{}': integerValue '{}' is not a number", name, raw.asText());
                return null;
            }
        }
        if (wrapper.has("doubleValue")) {
            JsonNode raw = wrapper.get("doubleValue");
            try {
                return new FieldValue.DoubleValue(raw.isNumber() ? raw.asDouble() : Double.parseDouble(raw.asText().trim()));
            } catch (NumberFormatException e) {
                log.warn("Dropping field '{}': doubleValue '{}' is not a number", name, raw.asText());
                return null;
            }
        }
        if (wrapper.has("booleanValue")) {
            return new FieldValue.BooleanValue(wrapper.get("booleanValue").asBoolean());
        }
        if (wrapper.has("timestampValue")) {
            String raw = wrapper.get("timestampValue").asText();
            try {
                return new FieldValue.TimestampValue(Instant.parse(raw));
            } catch (DateTimeParseException e) {
                log.warn("Dropping field '{}': timestampValue '{}' is not ISO-8601", name, raw);
                return null;
            }
        }
        if (wrapper.has("mapValue")) {
            return new FieldValue.MapValue(readFields(wrapper.get("mapValue").get("fields")));
        }
        if (wrapper.has("arrayValue")) {
            JsonNode items = wrapper.get("arrayValue").get("values");
            List<FieldValue> values = new ArrayList<>();
            if (items != null && items.isArray()) {
                for (JsonNode item : items) {
                    FieldValue value = readValue(name, item);
                    if (value != null) {
                        values.add(value);
                    }
                }
            }
            return new FieldValue.ListValue(values);
        }
        if (!wrapper.has("nullValue")) {
            log.debug("Dropping field '{}' with unsupported value kind {}", name, wrapper.fieldNames().hasNext()
                    ? wrapper.fieldNames().next() : "<empty>");
        }
        return null;
    }
}
