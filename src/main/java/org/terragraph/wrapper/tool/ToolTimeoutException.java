package org.terragraph.wrapper.tool;

/**
 * Raised when retrying a command on transient errors exceeds the configured timeout.
 */
public class ToolTimeoutException extends RuntimeException {

    public ToolTimeoutException(String message) {
        super(message);
    }
}
