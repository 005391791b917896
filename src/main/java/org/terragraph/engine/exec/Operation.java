package org.terragraph.engine.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A tool sub-command run in every directory, with the arguments it is invoked with.
 * <p>
 * {@code plan} runs with {@code -detailed-exitcode}: exit 0 means no changes, exit 2 means a diff and is
 * classified {@link ExitClassification#SUCCESS_WITH_DIFF}. Other operations succeed only with exit 0, and
 * report a diff unless their output states that nothing changed.
 *
 * @param name      the sub-command, e.g. {@code plan} or {@code apply}.
 * @param arguments full argument list passed to the tool.
 */
public record Operation(String name, List<String> arguments) {

    public static final String PLAN = "plan";
    public static final String APPLY = "apply";

    private static final int PLAN_DIFF_EXIT_CODE = 2;
    private static final Pattern NO_CHANGES = Pattern.compile(
        "No changes\\.|Resources: 0 added, 0 changed, 0 destroyed");

    public Operation {
        Objects.requireNonNull(name, "name");
        arguments = List.copyOf(arguments);
    }

    /**
     * Builds the default argument list for {@code name} followed by {@code extraArguments}.
     */
    public static Operation of(String name, String... extraArguments) {
        List<String> arguments = new ArrayList<>();
        arguments.add(name);
        switch (name) {
            case PLAN -> {
                arguments.add("-detailed-exitcode");
                arguments.add("-input=false");
            }
            case APPLY -> {
                arguments.add("-input=false");
                arguments.add("-auto-approve");
            }
            default -> {
            }
        }
        arguments.addAll(List.of(extraArguments));
        return new Operation(name, arguments);
    }

    public boolean isPlan() {
        return PLAN.equals(name);
    }

    /**
     * Interprets an exit status of this operation.
     */
    public ExitClassification classify(int exitCode, List<String> output) {
        if (isPlan()) {
            return switch (exitCode) {
                case 0 -> ExitClassification.SUCCESS;
                case PLAN_DIFF_EXIT_CODE -> ExitClassification.SUCCESS_WITH_DIFF;
                default -> ExitClassification.FAILURE;
            };
        }
        if (exitCode != 0) {
            return ExitClassification.FAILURE;
        }
        boolean unchanged = output.stream().anyMatch(line -> NO_CHANGES.matcher(line).find());
        return unchanged ? ExitClassification.SUCCESS : ExitClassification.SUCCESS_WITH_DIFF;
    }
}
