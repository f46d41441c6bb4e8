package dev.trex.devtools.manifest;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Position of every composite id and every file in the flattened manifest.
 */
public final class OrderMap {

    // Sort key of anything the manifest does not mention
    public static final int UNLISTED = Integer.MAX_VALUE;

    private final Map<String, Integer> testPositions;
    private final Map<String, Integer> filePositions;
    private final Set<String> splitFiles;

    private OrderMap(Map<String, Integer> testPositions, Map<String, Integer> filePositions, Set<String> splitFiles) {
        this.testPositions = testPositions;
        this.filePositions = filePositions;
        this.splitFiles = Collections.unmodifiableSet(splitFiles);
    }

    public static OrderMap of(Manifest manifest) {
        Map<String, Integer> tests = new HashMap<>();
        Map<String, Integer> files = new HashMap<>();
        Set<String> split = new TreeSet<>();
        List<String> ids = manifest.flatten();
        for (int i = 0; i < ids.size(); i++) {
            // A repeated id takes its last position
            tests.put(ids.get(i), i);
        }
        Map<String, Integer> lastEntry = new HashMap<>();
        List<ManifestEntry> entries = manifest.getEntries();
        for (int i = 0; i < entries.size(); i++) {
            String file = entries.get(i).getFile();
            files.putIfAbsent(file, i);
            Integer previous = lastEntry.put(file, i);
            if (previous != null && previous != i - 1) {
                split.add(file);
            }
        }
        return new OrderMap(tests, files, split);
    }

    public boolean contains(String compositeId) {
        return testPositions.containsKey(compositeId);
    }

    public int rank(String compositeId) {
        return testPositions.getOrDefault(compositeId, UNLISTED);
    }

    public int fileRank(String file) {
        return filePositions.getOrDefault(PathKeys.normalize(file), UNLISTED);
    }

    /**
     * Files listed in more than one entry with other files in between. Their classes still run as a whole,
     * at the position of the first entry.
     */
    public Set<String> getSplitFiles() {
        return splitFiles;
    }

    public int size() {
        return testPositions.size();
    }
}
