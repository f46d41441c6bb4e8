package dev.trex.devtools.manifest;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a manifest acquisition: either a manifest or the reason there is none.
 * An unavailable result means the default discovery must run untouched.
 */
public final class ManifestResult {

    private final Manifest manifest;
    private final String reason;

    private ManifestResult(Manifest manifest, String reason) {
        this.manifest = manifest;
        this.reason = reason;
    }

    public static ManifestResult available(Manifest manifest) {
        return new ManifestResult(Objects.requireNonNull(manifest), null);
    }

    public static ManifestResult unavailable(String reason, Object... args) {
        return new ManifestResult(null, String.format(reason, args));
    }

    public boolean isAvailable() {
        return manifest != null;
    }

    public Manifest getManifest() {
        if (manifest == null) {
            throw new IllegalStateException("Manifest is unavailable: " + reason);
        }
        return manifest;
    }

    public Optional<Manifest> asOptional() {
        return Optional.ofNullable(manifest);
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return isAvailable() ? "available(" + manifest.getTestCount() + " tests)" : "unavailable(" + reason + ")";
    }
}
