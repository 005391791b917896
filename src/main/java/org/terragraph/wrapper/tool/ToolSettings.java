package org.terragraph.wrapper.tool;

import java.time.Duration;

import com.typesafe.config.Config;

/**
 * Settings of the external tool, read from the {@code terragraph.tool} section of the application config.
 *
 * @param binary          executable name or path.
 * @param initBeforeRun   whether {@code init} runs before every operation.
 * @param colors          whether colored output is kept; {@code -no-color} is passed otherwise.
 * @param maxAttempts     attempts per command when the output shows a retriable error.
 * @param retryTimeout    total time after which retrying stops.
 * @param baseDelay       first backoff delay.
 * @param maxDelay        upper bound of a single backoff delay.
 * @param minimumVersion  lowest supported tool version, e.g. {@code 1.3.0}.
 */
public record ToolSettings(
    String binary,
    boolean initBeforeRun,
    boolean colors,
    int maxAttempts,
    Duration retryTimeout,
    Duration baseDelay,
    Duration maxDelay,
    String minimumVersion
) {

    public ToolSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive, got " + maxAttempts);
        }
    }

    /**
     * @param config the application config; must contain {@code terragraph.tool}.
     * @throws com.typesafe.config.ConfigException if a setting is missing or malformed.
     */
    public static ToolSettings fromConfig(Config config) {
        Config tool = config.getConfig("terragraph.tool");
        return new ToolSettings(
            tool.getString("binary"),
            tool.getBoolean("init-before-run"),
            tool.getBoolean("colors"),
            tool.getInt("retry.max-attempts"),
            tool.getDuration("retry.timeout"),
            tool.getDuration("retry.base-delay"),
            tool.getDuration("retry.max-delay"),
            tool.getString("minimum-version")
        );
    }

    public ToolSettings withInitBeforeRun(boolean value) {
        return new ToolSettings(binary, value, colors, maxAttempts, retryTimeout, baseDelay, maxDelay,
            minimumVersion);
    }

    public ToolSettings withColors(boolean value) {
        return new ToolSettings(binary, initBeforeRun, value, maxAttempts, retryTimeout, baseDelay, maxDelay,
            minimumVersion);
    }
}
