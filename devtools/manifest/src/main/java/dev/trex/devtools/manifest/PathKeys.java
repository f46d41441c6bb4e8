package dev.trex.devtools.manifest;

import java.nio.file.Path;

/**
 * Keys of manifest files and directories and composite test ids.
 * All of them use forward slashes whatever the host path separator is.
 */
public final class PathKeys {

    public static final String ROOT = ".";
    public static final String SEPARATOR = "/";
    public static final String TEST_SEPARATOR = "::";

    private PathKeys() {
        //
    }

    public static String normalize(String path) {
        return path.replace('\\', '/');
    }

    // Relative path to key, the empty path is the discovery root itself
    public static String of(Path relative) {
        String key = normalize(relative.toString());
        return key.isEmpty() ? ROOT : key;
    }

    public static String compositeId(String file, String test) {
        return normalize(file) + TEST_SEPARATOR + test;
    }

}
