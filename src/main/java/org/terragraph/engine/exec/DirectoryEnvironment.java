package org.terragraph.engine.exec;

import java.nio.file.Path;
import java.util.Map;

/**
 * Supplies the resolved environment variables of a directory. Called once per directory before dispatch.
 */
@FunctionalInterface
public interface DirectoryEnvironment {

    Map<String, String> resolve(Path directory);

    static DirectoryEnvironment none() {
        return directory -> Map.of();
    }
}
