package dev.trex.devtools.manifest;

import java.nio.file.Path;
import java.util.Optional;

import dev.trex.devtools.log.Logger;

/**
 * Manifest state of one discovery session. The manifest is acquired lazily by whichever caller needs it
 * first and is never refreshed afterwards.
 * <p>
 * A failed acquisition is remembered as well: the discovery tool runs at most once per session, and every
 * later caller sees the same unavailable result.
 */
public class ManifestSession {

    private static final Logger logger = Logger.getLogger(ManifestSession.class);

    private final Path root;
    private final BinaryResolver resolver;
    private final ManifestAcquirer acquirer;

    // null until the first acquisition attempt
    private ManifestResult result;
    private AllowedSets allowedSets;
    private OrderMap orderMap;

    public ManifestSession(Path root, BinaryResolver resolver, ManifestAcquirer acquirer) {
        this.root = root.toAbsolutePath().normalize();
        this.resolver = resolver;
        this.acquirer = acquirer;
    }

    public Path getRoot() {
        return root;
    }

    public synchronized ManifestResult ensure() {
        if (result != null) {
            return result;
        }

        Path binary = resolver.resolve();
        ManifestResult acquired = acquirer.acquire(root, binary);
        if (acquired.isAvailable()) {
            Manifest manifest = acquired.getManifest();
            allowedSets = AllowedSetBuilder.build(manifest);
            orderMap = OrderMap.of(manifest);
            logger.info("Manifest override is active for %s: %s tests in %s files",
                    root, manifest.getTestCount(), manifest.getEntries().size());
            if (!orderMap.getSplitFiles().isEmpty()) {
                logger.warn("Manifest lists %s in non-adjacent entries, their tests run together at the first entry",
                        orderMap.getSplitFiles());
            }
        } else {
            logger.warn("Manifest override is inactive, default discovery is used: %s", acquired.getReason());
        }
        result = acquired;
        return result;
    }

    public synchronized boolean isAttempted() {
        return result != null;
    }

    public boolean isActive() {
        return ensure().isAvailable();
    }

    public Optional<Manifest> getManifest() {
        return ensure().asOptional();
    }

    public synchronized Optional<AllowedSets> getAllowedSets() {
        ensure();
        return Optional.ofNullable(allowedSets);
    }

    public synchronized Optional<OrderMap> getOrderMap() {
        ensure();
        return Optional.ofNullable(orderMap);
    }
}
