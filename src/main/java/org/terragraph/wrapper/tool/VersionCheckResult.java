package org.terragraph.wrapper.tool;

/**
 * Outcome of the startup tool version precondition.
 *
 * @param passed          whether the installed version is supported.
 * @param detectedVersion version reported by the tool, {@code null} if it could not be determined.
 * @param message         human-readable explanation.
 */
public record VersionCheckResult(boolean passed, String detectedVersion, String message) {
}
