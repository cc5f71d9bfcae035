package com.example.cachesync.error;

import com.example.cachesync.config.CacheSyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Decides whether a failure is retryable. Rules are evaluated in a fixed order and the first
 * match wins; anything unrecognised is terminal so unknown errors are never retried forever.
 */
@Slf4j
@Component
public class ErrorClassifier {

    static final String MISSING_FIELD_MARKER = "Missing required field";

    private final List<String> testMarkers;

    public ErrorClassifier(CacheSyncProperties properties) {
        this.testMarkers = List.copyOf(properties.getTestMarkers());
    }

    public Classification classify(Throwable error, String subjectPath) {
        Throwable failure = unwrap(error);
        String message = failure.getMessage();

        if (isMissingMandatoryField(failure, message)) {
            return Classification.terminal("validation");
        }
        if (containsTestMarker(message) || containsTestMarker(subjectPath)) {
            return Classification.terminal("test-data");
        }

        Integer status = httpStatus(failure);
        if (status != null) {
            if (status == 404) {
                return Classification.terminal("not-found");
            }
            if (status == 401) {
                return Classification.terminal("unauthenticated");
            }
            if (status == 400) {
                return Classification.terminal("bad-request");
            }
        }
        if (TransportCode.detect(failure) != null) {
            return Classification.retryable("network");
        }
        if (status != null && status >= 500) {
            return Classification.retryable("server-error");
        }

        log.debug("No rule matched {}, treating as terminal", failure.getClass().getSimpleName());
        return Classification.terminal("unclassified");
    }

    private boolean isMissingMandatoryField(Throwable failure, String message) {
        if (failure instanceof ValidationException || failure instanceof DecodeException) {
            return true;
        }
        return message != null && message.contains(MISSING_FIELD_MARKER);
    }

    private boolean containsTestMarker(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (String marker : testMarkers) {
            if (!marker.isEmpty() && text.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private Integer httpStatus(Throwable failure) {
        Throwable current = failure;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof UpstreamException upstream) {
                return upstream.getStatus();
            }
            if (current instanceof RestClientResponseException response) {
                return response.getStatusCode().value();
            }
            current = current.getCause();
        }
        return null;
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
