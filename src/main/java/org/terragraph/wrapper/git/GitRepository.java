package org.terragraph.wrapper.git;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.wrapper.tool.CommandResult;
import org.terragraph.wrapper.tool.CommandRunner;

/**
 * Read-only queries against the git working tree containing a directory, through the {@code git} CLI.
 */
public class GitRepository {

    private static final Logger log = LoggerFactory.getLogger(GitRepository.class);

    private final CommandRunner runner;
    private final Path workingDirectory;

    public GitRepository(CommandRunner runner, Path workingDirectory) {
        this.runner = runner;
        this.workingDirectory = workingDirectory;
    }

    /**
     * @return the top-level directory of the working tree.
     * @throws GitException if {@code workingDirectory} is not inside a git working tree.
     */
    public Path root() {
        List<String> output = git("rev-parse", "--show-toplevel");
        if (output.isEmpty()) {
            throw new GitException("git did not report a top-level directory for " + workingDirectory);
        }
        return Path.of(output.get(0).trim());
    }

    /**
     * Files changed since the merge base with {@code baseRef}: committed, staged, unstaged and untracked.
     *
     * @param baseRef branch or commit to compare against, e.g. {@code origin/master}.
     * @return absolute paths of changed files.
     * @throws GitException if a git command fails.
     */
    public Set<Path> changedFiles(String baseRef) {
        Path root = root();
        List<String> mergeBase = git("merge-base", baseRef, "HEAD");
        if (mergeBase.isEmpty()) {
            throw new GitException("No merge base between " + baseRef + " and HEAD");
        }

        List<String> names = new ArrayList<>(git("diff", "--name-only", mergeBase.get(0).trim()));
        names.addAll(git("ls-files", "--others", "--exclude-standard", "--full-name"));

        Set<Path> changed = new LinkedHashSet<>();
        for (String name : names) {
            if (!name.isBlank()) {
                changed.add(root.resolve(name.trim()).normalize());
            }
        }
        log.debug("{} file(s) changed since {}", changed.size(), baseRef);
        return changed;
    }

    private List<String> git(String... arguments) {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(arguments));
        CommandResult result = runner.run(command, workingDirectory, Map.of());
        if (!result.isSuccess()) {
            throw new GitException(String.join(" ", command) + " failed with exit code " + result.exitCode()
                + ": " + String.join("\n", result.output()));
        }
        return result.output();
    }
}
