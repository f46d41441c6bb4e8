package dev.trex.devtools.manifest;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import dev.trex.devtools.log.Logger;

/**
 * Finds the discovery tool executable. Resolution never fails: when nothing is found the conventional
 * build location is returned anyway and the missing file tells the caller the tool is unavailable.
 */
public class BinaryResolver {

    private static final Logger logger = Logger.getLogger(BinaryResolver.class);

    public static final String BINARY_ENV = "TREX_BIN";
    public static final String BINARY_NAME = "trex";
    public static final String CONVENTIONAL_LOCATION = "../../target/release/" + BINARY_NAME;

    private final Map<String, String> env;
    private final Path anchor;

    public BinaryResolver(Map<String, String> env, Path anchor) {
        this.env = env;
        this.anchor = anchor;
    }

    public static BinaryResolver fromEnvironment(Path anchor) {
        return new BinaryResolver(System.getenv(), anchor);
    }

    public Path resolve() {
        String explicit = env.get(BINARY_ENV);
        if (explicit != null && !explicit.isEmpty()) {
            try {
                Path path = Path.of(explicit);
                logger.info("Discovery tool from %s: %s", BINARY_ENV, path);
                return path;
            } catch (InvalidPathException e) {
                logger.warn("Ignoring %s, not a valid path: %s", BINARY_ENV, e.getMessage());
            }
        }

        Path conventional = getConventionalLocation();
        if (Files.exists(conventional)) {
            logger.info("Discovery tool from build output: %s", conventional);
            return conventional;
        }

        Optional<Path> onSearchPath = findOnSearchPath();
        if (onSearchPath.isPresent()) {
            logger.info("Discovery tool from PATH: %s", onSearchPath.get());
            return onSearchPath.get();
        }
        return conventional;
    }

    public Path getConventionalLocation() {
        return anchor.resolve(CONVENTIONAL_LOCATION).toAbsolutePath().normalize();
    }

    Optional<Path> findOnSearchPath() {
        String searchPath = env.get("PATH");
        if (searchPath == null || searchPath.isEmpty()) {
            return Optional.empty();
        }
        for (String dir : searchPath.split(Pattern.quote(File.pathSeparator))) {
            if (dir.isEmpty()) {
                continue;
            }
            Path candidate;
            try {
                candidate = Path.of(dir, BINARY_NAME);
            } catch (InvalidPathException e) {
                continue; // not a usable PATH element
            }
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate.toAbsolutePath());
            }
        }
        return Optional.empty();
    }

    /**
     * Directory holding the code of {@code type}: the directory of its jar or its classes directory.
     * Falls back to the working directory when the code source is unknown.
     */
    public static Path codeLocation(Class<?> type) {
        CodeSource source = type.getProtectionDomain().getCodeSource();
        if (source != null && source.getLocation() != null) {
            try {
                Path location = Path.of(source.getLocation().toURI());
                return Files.isRegularFile(location) ? location.getParent() : location;
            } catch (URISyntaxException | IllegalArgumentException e) {
                logger.warn("Unable to resolve code location of %s: %s", type.getName(), e.getMessage());
            }
        }
        return Path.of("").toAbsolutePath();
    }
}
