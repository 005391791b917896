package org.terragraph.wrapper.tool;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Startup precondition: the installed tool must report a version at least {@link ToolSettings#minimumVersion()}.
 * Runs once before any work; callers decide what to do with a failed result.
 */
public class ToolVersionCheck {

    private static final Pattern VERSION_PATTERN = Pattern.compile("v?(\\d+)\\.(\\d+)\\.(\\d+)");

    private final CommandRunner runner;
    private final ToolSettings settings;

    public ToolVersionCheck(CommandRunner runner, ToolSettings settings) {
        this.runner = runner;
        this.settings = settings;
    }

    public VersionCheckResult check(Path workingDirectory) {
        CommandResult result = runner.run(List.of(settings.binary(), "version"), workingDirectory, Map.of());
        if (!result.isSuccess() || result.output().isEmpty()) {
            return new VersionCheckResult(false, null,
                "Could not determine " + settings.binary() + " version (exit code " + result.exitCode() + ")");
        }
        Matcher matcher = VERSION_PATTERN.matcher(result.output().get(0));
        if (!matcher.find()) {
            return new VersionCheckResult(false, null, "Unrecognized version output: " + result.output().get(0));
        }
        String detected = matcher.group(1) + "." + matcher.group(2) + "." + matcher.group(3);
        if (compare(detected, settings.minimumVersion()) < 0) {
            return new VersionCheckResult(false, detected,
                settings.binary() + " " + detected + " is older than the required " + settings.minimumVersion());
        }
        return new VersionCheckResult(true, detected, settings.binary() + " " + detected);
    }

    /**
     * Compares dotted numeric versions; missing components count as zero.
     */
    static int compare(String left, String right) {
        String[] a = left.split("\\.");
        String[] b = right.split("\\.");
        for (int i = 0; i < Math.max(a.length, b.length); i++) {
            int x = i < a.length ? Integer.parseInt(a[i]) : 0;
            int y = i < b.length ? Integer.parseInt(b[i]) : 0;
            if (x != y) {
                return Integer.compare(x, y);
            }
        }
        return 0;
    }
}
