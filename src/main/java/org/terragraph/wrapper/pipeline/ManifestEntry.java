package org.terragraph.wrapper.pipeline;

import java.nio.file.Path;

/**
 * One row of a pipeline manifest.
 *
 * @param manifest  the manifest file declaring the row.
 * @param line      1-based line number in the manifest.
 * @param step      the pipeline step name.
 * @param directory the directory the row points at, absolute and normalized.
 */
public record ManifestEntry(Path manifest, int line, String step, Path directory) {

    @Override
    public String toString() {
        return manifest.getFileName() + ":" + line + " (" + step + ") -> " + directory;
    }
}
