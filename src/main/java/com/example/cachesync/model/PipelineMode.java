package com.example.cachesync.model;

/**
 * Processing variant applied to a collection.
 */
public enum PipelineMode {
    /** Sleep, feed, diaper and pumping logs: summary plus current-day logs. */
    ACTIVITY,
    /** Identity and questionnaire data: a single profile record. */
    PROFILE
}
