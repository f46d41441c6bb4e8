package dev.trex.devtools.manifest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import dev.trex.devtools.log.Logger;

/**
 * Decides, entry by entry, whether the default discovery walk may collect a file or enter a directory.
 * Excluding a directory must stop the walk from descending into it.
 */
public class CollectionPruner {

    private static final Logger logger = Logger.getLogger(CollectionPruner.class);

    private final ManifestSession session;

    public CollectionPruner(ManifestSession session) {
        this.session = session;
    }

    public boolean shouldExclude(Path candidate) {
        Optional<AllowedSets> allowed = session.getAllowedSets();
        if (allowed.isEmpty()) {
            return false;
        }
        Optional<String> key = relativeKey(candidate);
        if (key.isEmpty()) {
            return false;
        }

        if (Files.isRegularFile(candidate)) {
            return !allowed.get().isAllowedFile(key.get());
        }
        if (Files.isDirectory(candidate)) {
            return !allowed.get().isAllowedDir(key.get());
        }
        return false;
    }

    // Empty for paths that cannot be resolved or lie outside the discovery root
    Optional<String> relativeKey(Path candidate) {
        Path root;
        Path real;
        try {
            root = session.getRoot().toRealPath();
            real = candidate.toRealPath();
        } catch (IOException e) {
            logger.info("Not pruning %s, unable to resolve it: %s", candidate, e.getMessage());
            return Optional.empty();
        }
        if (!real.startsWith(root)) {
            return Optional.empty();
        }
        return Optional.of(PathKeys.of(root.relativize(real)));
    }
}
