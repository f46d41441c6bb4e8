package dev.trex.devtools.manifest;

import java.util.Collections;
import java.util.Set;

/**
 * Files listed by a manifest and every directory the default walk must enter to reach them.
 */
public final class AllowedSets {

    private final Set<String> files;
    private final Set<String> dirs;

    AllowedSets(Set<String> files, Set<String> dirs) {
        this.files = Collections.unmodifiableSet(files);
        this.dirs = Collections.unmodifiableSet(dirs);
    }

    public Set<String> getFiles() {
        return files;
    }

    public Set<String> getDirs() {
        return dirs;
    }

    public boolean isAllowedFile(String key) {
        return files.contains(key);
    }

    public boolean isAllowedDir(String key) {
        return dirs.contains(key);
    }

    @Override
    public String toString() {
        return "AllowedSets{files=" + files + ", dirs=" + dirs + '}';
    }
}
