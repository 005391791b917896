package org.terragraph.wrapper.config;

import java.util.Locale;

/**
 * Where the value of a configured environment variable comes from.
 */
public enum EnvVarSource {
    /** Literal value from the wrapper file. */
    TEXT,
    /** Copied from the environment of the running process. */
    PASSTHROUGH,
    /** Looked up by path in the parameter store. */
    SSM;

    /**
     * Parses the lower-case name used in {@code .tf_wrapper} files.
     *
     * @throws IllegalArgumentException for an unknown source.
     */
    public static EnvVarSource fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid envvar source: " + name, e);
        }
    }
}
