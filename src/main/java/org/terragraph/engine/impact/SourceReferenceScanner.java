package org.terragraph.engine.impact;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight text scan of Terraform sources for references to other local files and directories.
 *
 * <p>This does not parse HCL. Comments are stripped line by line, then regular expressions pick up
 * {@code source} attributes of {@code module} blocks and {@code ${path.module}}-relative arguments of the
 * file functions. Only local references (starting with {@code ./} or {@code ../}) are reported; registry
 * and VCS module sources are ignored.</p>
 */
public final class SourceReferenceScanner {

    private static final Pattern MODULE_SOURCE_PATTERN = Pattern.compile(
            "module\\s+\"[^\"]+\"\\s*\\{[^}]*?\\bsource\\s*=\\s*\"([^\"]+)\"");
    private static final Pattern FILE_FUNCTION_PATTERN = Pattern.compile(
            "\\b(?:file|templatefile|filebase64|filesha256|filemd5)\\(\\s*\"\\$\\{path\\.module}/([^\"]+)\"");

    private SourceReferenceScanner() {
    }

    /**
     * @return local module sources, e.g. {@code ../modules/vpc}, in order of appearance.
     */
    public static List<String> moduleSources(String content) {
        List<String> sources = new ArrayList<>();
        Matcher matcher = MODULE_SOURCE_PATTERN.matcher(stripComments(content));
        while (matcher.find()) {
            String source = matcher.group(1);
            if (isLocal(source)) {
                sources.add(source);
            }
        }
        return sources;
    }

    /**
     * @return paths read through file functions, relative to the module directory.
     */
    public static List<String> fileReferences(String content) {
        List<String> references = new ArrayList<>();
        Matcher matcher = FILE_FUNCTION_PATTERN.matcher(stripComments(content));
        while (matcher.find()) {
            references.add(matcher.group(1));
        }
        return references;
    }

    static boolean isLocal(String source) {
        return source.startsWith("./") || source.startsWith("../");
    }

    /**
     * Removes {@code #} and {@code //} line comments outside of string literals.
     */
    static String stripComments(String content) {
        StringBuilder result = new StringBuilder(content.length());
        for (String line : content.split("\\r?\\n")) {
            boolean inString = false;
            int end = line.length();
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (c == '"' && (i == 0 || line.charAt(i - 1) != '\\')) {
                    inString = !inString;
                } else if (!inString && (c == '#' || (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/'))) {
                    end = i;
                    break;
                }
            }
            result.append(line, 0, end).append('\n');
        }
        return result.toString();
    }
}
