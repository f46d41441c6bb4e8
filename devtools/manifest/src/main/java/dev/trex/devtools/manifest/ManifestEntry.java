package dev.trex.devtools.manifest;

import java.util.List;
import java.util.Objects;

public final class ManifestEntry {

    private final String file;
    private final List<String> tests;

    public ManifestEntry(String file, List<String> tests) {
        this.file = PathKeys.normalize(Objects.requireNonNull(file, "file"));
        this.tests = List.copyOf(tests);
    }

    public String getFile() {
        return file;
    }

    public List<String> getTests() {
        return tests;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ManifestEntry)) {
            return false;
        }
        ManifestEntry that = (ManifestEntry) o;
        return file.equals(that.file) && tests.equals(that.tests);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, tests);
    }

    @Override
    public String toString() {
        return file + tests;
    }
}
