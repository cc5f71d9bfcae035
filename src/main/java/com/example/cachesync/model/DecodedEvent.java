package com.example.cachesync.model;

/**
 * Result of decoding a raw payload.
 *
 * @param changeKind kind of mutation derived from the snapshot markers
 * @param fields     document fields of the after-snapshot (empty for deletions)
 * @param encoding   name of the decoding strategy that accepted the payload
 */
public record DecodedEvent(ChangeKind changeKind, DocumentFields fields, String encoding) {

    public boolean isDeletion() {
        return changeKind == ChangeKind.DELETED;
    }
}
