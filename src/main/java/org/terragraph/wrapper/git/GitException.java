package org.terragraph.wrapper.git;

/**
 * Raised when a git command fails, e.g. because the directory is not inside a working tree.
 */
public class GitException extends RuntimeException {

    public GitException(String message) {
        super(message);
    }
}
