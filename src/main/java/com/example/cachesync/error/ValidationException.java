package com.example.cachesync.error;

/**
 * A mandatory field or identifier is missing.
 */
public class ValidationException extends PipelineException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
