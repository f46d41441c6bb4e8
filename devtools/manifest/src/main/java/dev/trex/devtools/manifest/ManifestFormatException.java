package dev.trex.devtools.manifest;

public class ManifestFormatException extends Exception {

    public ManifestFormatException(String message) {
        super(message);
    }

    public ManifestFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
