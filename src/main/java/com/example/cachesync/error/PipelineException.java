package com.example.cachesync.error;

/**
 * Base class of every failure raised by a pipeline stage.
 */
public abstract class PipelineException extends RuntimeException {

    private final ErrorKind kind;

    protected PipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
