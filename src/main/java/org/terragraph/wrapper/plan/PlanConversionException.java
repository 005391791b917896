package org.terragraph.wrapper.plan;

/**
 * Raised when a binary plan cannot be converted to its structured form.
 */
public class PlanConversionException extends RuntimeException {

    public PlanConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
