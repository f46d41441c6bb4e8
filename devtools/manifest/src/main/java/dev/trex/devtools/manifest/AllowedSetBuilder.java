package dev.trex.devtools.manifest;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class AllowedSetBuilder {

    private AllowedSetBuilder() {
        //
    }

    /**
     * Every manifest file is allowed, and so is every proper prefix of it, down to the root ({@code .}).
     */
    public static AllowedSets build(Manifest manifest) {
        Set<String> files = new LinkedHashSet<>();
        Set<String> dirs = new LinkedHashSet<>();
        for (ManifestEntry entry : manifest.getEntries()) {
            String file = PathKeys.normalize(entry.getFile());
            files.add(file);

            List<String> parts = Arrays.asList(file.split(PathKeys.SEPARATOR, -1));
            for (int i = 0; i < parts.size(); i++) {
                dirs.add(i == 0 ? PathKeys.ROOT : String.join(PathKeys.SEPARATOR, parts.subList(0, i)));
            }
        }
        return new AllowedSets(files, dirs);
    }
}
