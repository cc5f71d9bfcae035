package com.example.cachesync.error;

/**
 * A failure the pipeline recognises as an error but cannot attribute to a more specific kind.
 */
public class UnclassifiedException extends PipelineException {

    public UnclassifiedException(String message, Throwable cause) {
        super(ErrorKind.UNKNOWN, message, cause);
    }
}
