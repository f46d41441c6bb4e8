package dev.trex.devtools.manifest;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisabledOnOs(OS.WINDOWS)
class BinaryResolverTest {

    @TempDir
    Path tmp;

    @Test
    void environmentOverrideIsUsedVerbatim() throws IOException {
        Path anchor = Files.createDirectories(tmp.resolve("repo/tests/runner"));
        writeConventional(anchor);

        BinaryResolver resolver = new BinaryResolver(
                Map.of(BinaryResolver.BINARY_ENV, "/nowhere/trex"), anchor);

        assertEquals(Path.of("/nowhere/trex"), resolver.resolve());
    }

    @Test
    void emptyEnvironmentOverrideIsIgnored() throws IOException {
        Path anchor = Files.createDirectories(tmp.resolve("repo/tests/runner"));
        Path conventional = writeConventional(anchor);

        BinaryResolver resolver = new BinaryResolver(Map.of(BinaryResolver.BINARY_ENV, ""), anchor);

        assertEquals(conventional, resolver.resolve());
    }

    @Test
    void conventionalBuildOutputWinsOverSearchPath() throws IOException {
        Path anchor = Files.createDirectories(tmp.resolve("repo/tests/runner"));
        Path conventional = writeConventional(anchor);
        Path bin = Files.createDirectories(tmp.resolve("bin"));
        DiscoveryScripts.write(bin, BinaryResolver.BINARY_NAME, "exit 0");

        BinaryResolver resolver = new BinaryResolver(Map.of("PATH", bin.toString()), anchor);

        assertEquals(conventional, resolver.resolve());
    }

    @Test
    void searchPathIsUsedWhenThereIsNoBuildOutput() throws IOException {
        Path anchor = Files.createDirectories(tmp.resolve("repo/tests/runner"));
        Path empty = Files.createDirectories(tmp.resolve("empty"));
        Path bin = Files.createDirectories(tmp.resolve("bin"));
        Path onPath = DiscoveryScripts.write(bin, BinaryResolver.BINARY_NAME, "exit 0");

        BinaryResolver resolver = new BinaryResolver(
                Map.of("PATH", empty + File.pathSeparator + bin), anchor);

        assertEquals(onPath.toAbsolutePath(), resolver.resolve());
    }

    @Test
    void nonExecutableFileOnSearchPathIsSkipped() throws IOException {
        Path anchor = Files.createDirectories(tmp.resolve("repo/tests/runner"));
        Path bin = Files.createDirectories(tmp.resolve("bin"));
        Files.writeString(bin.resolve(BinaryResolver.BINARY_NAME), "not a program");

        BinaryResolver resolver = new BinaryResolver(Map.of("PATH", bin.toString()), anchor);

        assertEquals(resolver.getConventionalLocation(), resolver.resolve());
    }

    @Test
    void fallsBackToMissingConventionalLocation() throws IOException {
        Path anchor = Files.createDirectories(tmp.resolve("repo/tests/runner"));

        BinaryResolver resolver = new BinaryResolver(Map.of(), anchor);
        Path resolved = resolver.resolve();

        assertEquals(tmp.resolve("repo/target/release/trex").toAbsolutePath().normalize(), resolved);
        assertFalse(Files.exists(resolved));
    }

    @Test
    void codeLocationOfAClassesDirectoryIsTheDirectory() {
        Path location = BinaryResolver.codeLocation(BinaryResolverTest.class);

        assertTrue(Files.isDirectory(location));
    }

    private static Path writeConventional(Path anchor) throws IOException {
        Path release = Files.createDirectories(anchor.resolve("../../target/release").normalize());
        return DiscoveryScripts.write(release, BinaryResolver.BINARY_NAME, "exit 0").toAbsolutePath().normalize();
    }
}
