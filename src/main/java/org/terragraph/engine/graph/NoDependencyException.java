package org.terragraph.engine.graph;

import java.nio.file.Path;

/**
 * Raised when a directory declares a dependency on a directory that does not exist
 * (or contains no Terraform sources).
 */
public class NoDependencyException extends GraphConstructionException {

    private final Path missingDirectory;
    private final Path declaringDirectory;

    public NoDependencyException(Path missingDirectory, Path declaringDirectory) {
        super("Dependency " + missingDirectory + " declared by " + declaringDirectory + " does not exist");
        this.missingDirectory = missingDirectory;
        this.declaringDirectory = declaringDirectory;
    }

    public Path getMissingDirectory() {
        return missingDirectory;
    }

    public Path getDeclaringDirectory() {
        return declaringDirectory;
    }
}
