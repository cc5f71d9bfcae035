package com.example.cachesync.error;

/**
 * An enrichment API answered with a non-2xx status.
 */
public class UpstreamException extends PipelineException {

    private final String operation;
    private final int status;

    public UpstreamException(String operation, int status, Throwable cause) {
        super(kindFor(status), operation + " returned HTTP " + status, cause);
        this.operation = operation;
        this.status = status;
    }

    public String getOperation() {
        return operation;
    }

    public int getStatus() {
        return status;
    }

    static ErrorKind kindFor(int status) {
        if (status == 400) {
            return ErrorKind.BAD_REQUEST;
        }
        if (status == 401) {
            return ErrorKind.AUTH;
        }
        if (status == 404) {
            return ErrorKind.NOT_FOUND;
        }
        if (status >= 500) {
            return ErrorKind.SERVER;
        }
        return ErrorKind.UNKNOWN;
    }
}
