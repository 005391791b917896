package org.terragraph.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.terragraph.cli.CommandLineInterface;
import org.terragraph.engine.scan.DirectoryScanner;
import org.terragraph.wrapper.backend.BackendChecker;
import org.terragraph.wrapper.config.WrapperConfigResolver;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "backend-check",
    description = "Verify that every Terraform directory declares a remote-state backend"
)
public class BackendCheckCommand implements Callable<Integer> {

    @Parameters(
        arity = "1..*",
        paramLabel = "PATH",
        description = "Directories to check, recursively"
    )
    private List<Path> paths;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        List<Path> roots = paths.stream()
            .map(path -> CommandSupport.existingDirectory(path, spec.commandLine(), "PATH"))
            .toList();
        parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();

        List<Path> missing = new BackendChecker(new DirectoryScanner(), new WrapperConfigResolver())
            .findMissingBackends(roots);
        if (missing.isEmpty()) {
            out.println("All directories declare a backend");
            out.flush();
            return 0;
        }
        out.println("Directories without a backend:");
        missing.forEach(directory -> out.println("  " + directory));
        out.println();
        out.println("Add a backend block or set backend_check = false in " + WrapperConfigResolver.FILE_NAME);
        out.flush();
        return 1;
    }
}
