package org.terragraph.wrapper.plan;

import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects privilege-sensitive changes in human-readable plan output.
 * <p>
 * Every resource change header ({@code # aws_iam_role.app will be created}) is checked: the change is
 * sensitive when its resource type contains one of the configured fragments. Resource addresses inside
 * modules and indexed instances are handled.
 */
public class IamChangeScanner implements Predicate<List<String>> {

    private static final Pattern ANSI_ESCAPE = Pattern.compile("\u001B\\[[;\\d]*m");
    private static final Pattern CHANGE_HEADER = Pattern.compile(
        "^\\s*#\\s+(\\S+)\\s+(?:will|must)\\s+be\\s+");
    private static final Pattern RESOURCE_TYPE = Pattern.compile("(?:^|\\.)(?:data\\.)?([a-z0-9_]+)\\.[^.]+$");

    private final List<String> resourceFragments;

    /**
     * @param resourceFragments resource type fragments, e.g. {@code aws_iam_} or {@code _bucket_policy}.
     */
    public IamChangeScanner(List<String> resourceFragments) {
        this.resourceFragments = List.copyOf(resourceFragments);
    }

    /**
     * @return {@code true} if any change in {@code output} touches a privilege-sensitive resource type.
     */
    public boolean scan(List<String> output) {
        return output.stream().anyMatch(this::isSensitiveChange);
    }

    @Override
    public boolean test(List<String> output) {
        return scan(output);
    }

    boolean isSensitiveChange(String line) {
        Matcher header = CHANGE_HEADER.matcher(ANSI_ESCAPE.matcher(line).replaceAll(""));
        if (!header.find()) {
            return false;
        }
        String address = header.group(1).replaceAll("\\[[^\\]]*]", "");
        Matcher type = RESOURCE_TYPE.matcher(address);
        if (!type.find()) {
            return false;
        }
        String resourceType = type.group(1);
        return resourceFragments.stream().anyMatch(resourceType::contains);
    }
}
