package com.example.cachesync.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Typed value of a document field. The set of variants is closed; every variant knows how to
 * render itself as a plain Java value suitable for JSON serialization.
 */
public sealed interface FieldValue permits FieldValue.StringValue, FieldValue.IntegerValue,
        FieldValue.DoubleValue, FieldValue.BooleanValue, FieldValue.TimestampValue,
        FieldValue.MapValue, FieldValue.ListValue {

    /**
     * Plain representation: String, Long, Double, Boolean, ISO-8601 String, Map or List.
     */
    Object toPlain();

    record StringValue(String value) implements FieldValue {
        @Override
        public Object toPlain() {
            return value;
        }
    }

    record IntegerValue(long value) implements FieldValue {
        @Override
        public Object toPlain() {
            return value;
        }
    }

    record DoubleValue(double value) implements FieldValue {
        @Override
        public Object toPlain() {
            return value;
        }
    }

    record BooleanValue(boolean value) implements FieldValue {
        @Override
        public Object toPlain() {
            return value;
        }
    }

    record TimestampValue(Instant value) implements FieldValue {
        @Override
        public Object toPlain() {
            return value.toString();
        }
    }

    record MapValue(DocumentFields value) implements FieldValue {
        @Override
        public Object toPlain() {
            return value.toPlainMap();
        }
    }

    record ListValue(List<FieldValue> values) implements FieldValue {

        public ListValue {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public Object toPlain() {
            List<Object> plain = new ArrayList<>(values.size());
            for (FieldValue value : values) {
                plain.add(value.toPlain());
            }
            return plain;
        }
    }
}
