package org.terragraph.wrapper.tool;

import java.util.List;

/**
 * Output fragments that identify transient provider or network errors worth retrying.
 */
public final class RetriableErrors {

    static final List<String> PATTERNS = List.of(
        "RequestError: send request failed",
        "unexpected EOF",
        "Throttling",
        "timeout while waiting for state",
        "ServiceUnavailable: Service Unavailable",
        "failed to decode query XML error response",
        "connection reset",
        "Connection reset",
        "Please try again.",
        "Client.Timeout exceeded",
        "Request limit for operation",
        "try again later",
        "handshake timeout",
        "SSL_ERROR_SYSCALL",
        "ConditionalCheckFailedException",
        "Api Rate Limit Exceeded",
        "TooManyUpdates"
    );

    private RetriableErrors() {
    }

    /**
     * @return the output lines that contain a retriable error.
     */
    public static List<String> find(List<String> output) {
        return output.stream()
            .filter(line -> PATTERNS.stream().anyMatch(line::contains))
            .toList();
    }
}
