package org.terragraph.engine.scan;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Directories discovered under a root.
 *
 * @param regularDirectories directories reached through their real path.
 * @param symlinks           symlinked directory path mapped to the real directory it resolves to.
 */
public record ScanResult(Set<Path> regularDirectories, Map<Path, Path> symlinks) {

    public ScanResult {
        regularDirectories = Set.copyOf(regularDirectories);
        symlinks = Map.copyOf(symlinks);
    }

    public boolean isEmpty() {
        return regularDirectories.isEmpty() && symlinks.isEmpty();
    }
}
