package org.terragraph.wrapper.pipeline;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Problems found by {@link PipelineConsistencyChecker}.
 *
 * @param unlisted   directories not listed in any manifest.
 * @param dangling   manifest entries pointing at directories that do not exist.
 * @param duplicates directories listed more than once, with every entry listing them.
 */
public record PipelineCheckReport(
    List<Path> unlisted,
    List<ManifestEntry> dangling,
    Map<Path, List<ManifestEntry>> duplicates
) {

    public PipelineCheckReport {
        unlisted = List.copyOf(unlisted);
        dangling = List.copyOf(dangling);
        duplicates = Collections.unmodifiableMap(new TreeMap<>(duplicates));
    }

    public boolean isClean() {
        return unlisted.isEmpty() && dangling.isEmpty() && duplicates.isEmpty();
    }
}
