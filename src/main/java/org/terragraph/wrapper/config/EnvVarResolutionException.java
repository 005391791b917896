package org.terragraph.wrapper.config;

/**
 * Raised when a configured environment variable cannot be given a value.
 */
public class EnvVarResolutionException extends RuntimeException {

    private final String variable;

    public EnvVarResolutionException(String variable, String message) {
        super("Cannot resolve envvar " + variable + ": " + message);
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
