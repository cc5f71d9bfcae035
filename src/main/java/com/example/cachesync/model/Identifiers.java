package com.example.cachesync.model;

import java.util.Optional;

/**
 * Entity identifiers extracted from a document. {@code childId} is always present,
 * {@code parentId} may be null.
 */
public record Identifiers(String parentId, String childId) {

    public static Identifiers childOnly(String childId) {
        return new Identifiers(null, childId);
    }

    public boolean hasParent() {
        return parentId != null;
    }

    public Optional<String> parent() {
        return Optional.ofNullable(parentId);
    }
}
