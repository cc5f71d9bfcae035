package com.example.cachesync.error;

/**
 * Failure taxonomy of the pipeline. Recorded on audit rows as the {@code error_kind} column.
 */
public enum ErrorKind {
    DECODE,
    VALIDATION,
    SCHEMA,
    AUTH,
    NOT_FOUND,
    BAD_REQUEST,
    NETWORK_TRANSIENT,
    SERVER,
    UNKNOWN;

    /**
     * Kind for an exception that is not part of the pipeline hierarchy.
     */
    public static ErrorKind of(Throwable error) {
        if (error instanceof PipelineException pipelineException) {
            return pipelineException.getKind();
        }
        return UNKNOWN;
    }
}
