package com.example.cachesync.model;

/**
 * Kind of document mutation, derived from the before/after snapshots of a change event.
 */
public enum ChangeKind {
    CREATED,
    UPDATED,
    DELETED
}
