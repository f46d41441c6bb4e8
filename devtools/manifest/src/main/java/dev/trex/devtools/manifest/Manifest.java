package dev.trex.devtools.manifest;

import java.util.ArrayList;
import java.util.List;

/**
 * Files and tests selected by the discovery tool. Entry order and test order within an entry
 * are the execution order.
 */
public final class Manifest {

    private final List<ManifestEntry> entries;

    public Manifest(List<ManifestEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public List<ManifestEntry> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int getTestCount() {
        return entries.stream().mapToInt(entry -> entry.getTests().size()).sum();
    }

    /**
     * Composite ids ({@code file::test}) of all tests, file-major and test-minor.
     */
    public List<String> flatten() {
        List<String> ids = new ArrayList<>(getTestCount());
        for (ManifestEntry entry : entries) {
            for (String test : entry.getTests()) {
                ids.add(PathKeys.compositeId(entry.getFile(), test));
            }
        }
        return ids;
    }

    @Override
    public String toString() {
        return "Manifest" + entries;
    }
}
