package com.example.cachesync.error;

/**
 * No known encoding could be applied to a payload.
 */
public class DecodeException extends PipelineException {

    public DecodeException(String message) {
        super(ErrorKind.DECODE, message);
    }

    public DecodeException(String message, Throwable cause) {
        super(ErrorKind.DECODE, message, cause);
    }
}
