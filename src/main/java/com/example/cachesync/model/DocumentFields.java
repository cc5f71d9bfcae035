package com.example.cachesync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping of field name to typed value, produced once per event by the decoder.
 */
public final class DocumentFields {

    private static final DocumentFields EMPTY = new DocumentFields(Map.of());

    private final Map<String, FieldValue> values;

    private DocumentFields(Map<String, FieldValue> values) {
        this.values = values;
    }

    public static DocumentFields empty() {
        return EMPTY;
    }

    public static DocumentFields of(Map<String, FieldValue> values) {
        if (values.isEmpty()) {
            return EMPTY;
        }
        return new DocumentFields(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public Optional<FieldValue> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * Returns the field only when it holds a string value.
     */
    public Optional<String> getString(String name) {
        FieldValue value = values.get(name);
        if (value instanceof FieldValue.StringValue stringValue) {
            return Optional.ofNullable(stringValue.value());
        }
        return Optional.empty();
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> toPlainMap() {
        Map<String, Object> plain = new LinkedHashMap<>();
        values.forEach((name, value) -> plain.put(name, value.toPlain()));
        return plain;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof DocumentFields other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "DocumentFields" + values;
    }
}
