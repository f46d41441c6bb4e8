package dev.trex.devtools.manifest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import dev.trex.devtools.log.Logger;

/**
 * Runs {@code <binary> collect <root>} in {@code root} and parses its standard output.
 * Every failure is reported as an unavailable result, never as an exception.
 */
public class ManifestAcquirer {

    private static final Logger logger = Logger.getLogger(ManifestAcquirer.class);

    public static final String COLLECT_COMMAND = "collect";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final Duration STREAM_DRAIN_TIMEOUT = Duration.ofSeconds(5);
    private static final int STDERR_LOG_LIMIT = 2000;

    private final Duration timeout;

    public ManifestAcquirer() {
        this(DEFAULT_TIMEOUT);
    }

    public ManifestAcquirer(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public ManifestResult acquire(Path root, Path binary) {
        if (!Files.exists(binary)) {
            return ManifestResult.unavailable("discovery tool %s does not exist", binary);
        }

        List<String> command = List.of(binary.toString(), COLLECT_COMMAND, root.toString());
        logger.info("Running discovery: %s", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(root.toFile())
                    .start();
        } catch (IOException e) {
            return ManifestResult.unavailable("unable to start %s: %s", binary, e.getMessage());
        }

        ExecutorService outputThreads = Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "trex-discovery-output");
            thread.setDaemon(true);
            return thread;
        });
        try {
            Future<String> stdoutFuture = outputThreads.submit(() -> readStream(process.getInputStream()));
            Future<String> stderrFuture = outputThreads.submit(() -> readStream(process.getErrorStream()));

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return ManifestResult.unavailable("discovery tool did not finish in %s sec", timeout.getSeconds());
            }

            int exitCode = process.exitValue();
            String stdout = drain(stdoutFuture);
            String stderr = drain(stderrFuture);
            if (exitCode != 0) {
                logger.info("Discovery tool stderr:\n%s", truncate(stderr));
                return ManifestResult.unavailable("discovery tool exited with status %s", exitCode);
            }

            Manifest manifest = ManifestCodec.parse(stdout);
            logger.info("Discovery tool listed %s tests in %s files",
                    manifest.getTestCount(), manifest.getEntries().size());
            return ManifestResult.available(manifest);
        } catch (ManifestFormatException e) {
            return ManifestResult.unavailable("malformed discovery output: %s", e.getMessage());
        } catch (IOException e) {
            return ManifestResult.unavailable("unable to read discovery output: %s", e.getMessage());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return ManifestResult.unavailable("interrupted while waiting for the discovery tool");
        } finally {
            outputThreads.shutdownNow();
        }
    }

    private static String readStream(InputStream in) throws IOException {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String drain(Future<String> future) throws IOException, InterruptedException {
        try {
            return future.get(STREAM_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IOException(e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("output was not closed " + STREAM_DRAIN_TIMEOUT.getSeconds() +
                    " sec after exit", e);
        }
    }

    private static String truncate(String text) {
        return text.length() > STDERR_LOG_LIMIT ? text.substring(0, STDERR_LOG_LIMIT) + "..." : text;
    }
}
