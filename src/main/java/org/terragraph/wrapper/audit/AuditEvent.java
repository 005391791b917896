package org.terragraph.wrapper.audit;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload posted to the audit API after a directory run.
 *
 * @param directory directory path relative to the repository root, with a leading slash.
 * @param status    {@code SUCCESS} or {@code FAILED}.
 * @param runBy     the local user name.
 * @param output    captured tool output.
 */
public record AuditEvent(
    @JsonProperty("directory") String directory,
    @JsonProperty("status") String status,
    @JsonProperty("run_by") String runBy,
    @JsonProperty("output") List<String> output
) {

    public static final String SUCCESS = "SUCCESS";
    public static final String FAILED = "FAILED";
}
