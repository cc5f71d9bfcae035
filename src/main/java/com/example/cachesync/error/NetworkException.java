package com.example.cachesync.error;

/**
 * A remote call (enrichment API or cache store) failed before a response was received.
 */
public class NetworkException extends PipelineException {

    private final TransportCode code;

    public NetworkException(String message, TransportCode code, Throwable cause) {
        super(code != null ? ErrorKind.NETWORK_TRANSIENT : ErrorKind.UNKNOWN, message, cause);
        this.code = code;
    }

    /**
     * Transport code, or {@code null} when the failure did not match a known transient condition.
     */
    public TransportCode getCode() {
        return code;
    }
}
