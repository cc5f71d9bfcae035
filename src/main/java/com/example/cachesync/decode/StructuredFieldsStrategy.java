package com.example.cachesync.decode;

import com.example.cachesync.model.ChangeKind;
import com.example.cachesync.model.DecodedEvent;
import com.example.cachesync.model.DocumentFields;
import com.example.cachesync.model.RawPayload;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Decodes document-event data that is already structured: {@code value} / {@code oldValue}
 * snapshots holding a {@code fields} map of typed wrappers, or a bare map of typed wrappers.
 */
public class StructuredFieldsStrategy implements DecodingStrategy {

    public static final String NAME = "structured";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<DecodedEvent> tryDecode(RawPayload payload) {
        if (payload instanceof RawPayload.Structured structured && hasSnapshotShape(structured.node())) {
            return Optional.of(decodeNode(structured.node(), NAME));
        }
        return Optional.empty();
    }

    static boolean hasSnapshotShape(JsonNode node) {
        if (node == null || !node.isObject()) {
            return false;
        }
        return isSnapshot(node.get("value")) || isSnapshot(node.get("oldValue"))
                || FirestoreValueReader.isTypedFieldMap(node.get("fields"));
    }

    /**
     * Missing before-snapshot means created, missing after-snapshot means deleted.
     */
    DecodedEvent decodeNode(JsonNode node, String encoding) {
        JsonNode after = node.get("value");
        boolean hasBefore = isSnapshot(node.get("oldValue"));
        boolean hasAfter = isSnapshot(after);

        JsonNode fieldsNode;
        if (hasAfter) {
            fieldsNode = after.get("fields");
        } else if (!hasBefore && FirestoreValueReader.isTypedFieldMap(node.get("fields"))) {
            fieldsNode = node.get("fields");
            hasAfter = true;
        } else {
            fieldsNode = null;
        }

        ChangeKind kind;
        if (!hasBefore) {
            kind = ChangeKind.CREATED;
        } else if (!hasAfter) {
            kind = ChangeKind.DELETED;
        } else {
            kind = ChangeKind.UPDATED;
        }
        DocumentFields fields = kind == ChangeKind.DELETED
                ? DocumentFields.empty()
                : FirestoreValueReader.readFields(fieldsNode);
        return new DecodedEvent(kind, fields, encoding);
    }

    /**
     * A snapshot holds a typed (or empty) {@code fields} map, or at least its document resource name.
     */
    private static boolean isSnapshot(JsonNode node) {
        if (node == null || !node.isObject()) {
            return false;
        }
        JsonNode fields = node.get("fields");
        if (fields != null && fields.isObject()) {
            return fields.size() == 0 || FirestoreValueReader.isTypedFieldMap(fields);
        }
        JsonNode name = node.get("name");
        return name != null && name.isTextual() && name.asText().contains("/documents/");
    }
}
