package org.terragraph.wrapper.pipeline;

/**
 * Thrown when a pipeline manifest is not a valid {@code step,directory} CSV file.
 */
public class PipelineManifestException extends RuntimeException {

    public PipelineManifestException(String message) {
        super(message);
    }
}
