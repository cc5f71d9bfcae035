package com.example.cachesync.error;

import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Transport-level conditions that are expected to clear up on their own.
 */
public enum TransportCode {
    CONNECTION_REFUSED,
    TIMEOUT,
    DNS_FAILURE,
    CONNECTION_RESET;

    /**
     * Walks the cause chain looking for a recognised transient transport failure.
     *
     * @return the matching code, or {@code null} when the failure is not a known transient one
     */
    public static TransportCode detect(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof NetworkException networkException && networkException.getCode() != null) {
                return networkException.getCode();
            }
            if (current instanceof ConnectException) {
                return CONNECTION_REFUSED;
            }
            if (current instanceof SocketTimeoutException || current instanceof TimeoutException) {
                return TIMEOUT;
            }
            if (current instanceof UnknownHostException) {
                return DNS_FAILURE;
            }
            if (current instanceof SocketException && current.getMessage() != null
                    && current.getMessage().toLowerCase(Locale.ROOT).contains("reset")) {
                return CONNECTION_RESET;
            }
            current = current.getCause();
        }
        return null;
    }
}
