package com.example.cachesync.cache;

/**
 * Key scheme of the materialized records. Every key starts with the environment prefix.
 */
public final class CacheKeys {

    private final String prefix;

    public CacheKeys(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    public String summary(String childId) {
        return prefix + "summary:" + childId;
    }

    public String dayLog(String childId) {
        return prefix + "daylog:" + childId;
    }

    public String combined(String parentId, String childId) {
        return prefix + "parent:" + parentId + ":child:" + childId;
    }

    public String limited(String childId, String collectionName) {
        return prefix + "limited:child:" + childId + ":" + collectionName;
    }

    public String profile(String childId) {
        return prefix + "profile:" + childId;
    }

    public String profileWithParent(String parentId, String childId) {
        return prefix + "profile:parent:" + parentId + ":child:" + childId;
    }
}
