package groundcontrol.coordinator.implementer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Base for implementers that shell out to a CLI tool.
 *
 * <p>Subclasses supply the command line. The process runs in the project
 * directory with a wall-clock timeout; stdout and stderr go to temp files so
 * a chatty tool can never block on a full pipe.
 */
public abstract class CommandLineImplementer implements Implementer {

    private static final Logger log = LoggerFactory.getLogger(CommandLineImplementer.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(600);

    private final String name;
    private final String displayName;
    private final String executable;
    private final String installHint;
    private final Duration timeout;

    protected CommandLineImplementer(String name, String displayName, String executable,
            String installHint, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.name = name;
        this.displayName = displayName;
        this.executable = executable;
        this.installHint = installHint;
        this.timeout = timeout;
    }

    /**
     * Full command line for one run, executable first.
     */
    protected abstract List<String> command(String prompt, String projectPath);

    @Override
    public String name() {
        return name;
    }

    public String displayName() {
        return displayName;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public boolean isAvailable() {
        return resolveExecutable() != null;
    }

    @Override
    public ImplementerResult execute(String prompt, String projectPath, Map<String, Object> context) {
        if (!isAvailable()) {
            return ImplementerResult.fail(installHint);
        }

        Path stdout = null;
        Path stderr = null;
        Process process = null;
        try {
            stdout = Files.createTempFile("gc-" + name + "-", ".out");
            stderr = Files.createTempFile("gc-" + name + "-", ".err");

            ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command(prompt, projectPath)));
            if (projectPath != null && !projectPath.isBlank()) {
                pb.directory(new File(projectPath));
            }
            pb.redirectOutput(stdout.toFile());
            pb.redirectError(stderr.toFile());

            log.debug("Starting {} in {}", displayName, projectPath);
            process = pb.start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                log.warn("{} timed out after {}s", displayName, timeout.toSeconds());
                return ImplementerResult.fail(
                        displayName + " execution timed out after " + timeout.toSeconds() + " seconds");
            }

            String out = Files.readString(stdout, StandardCharsets.UTF_8);
            String err = Files.readString(stderr, StandardCharsets.UTF_8);
            int exitCode = process.exitValue();
            if (exitCode == 0) {
                return ImplementerResult.ok(out);
            }
            return ImplementerResult.fail(out, displayName + " exited with code " + exitCode + ": " + err);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroy(process);
            return ImplementerResult.fail(displayName + " execution interrupted");
        } catch (IOException e) {
            destroy(process);
            log.warn("Failed to run {}: {}", displayName, e.getMessage());
            return ImplementerResult.fail("Failed to run " + displayName + ": " + e.getMessage());
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    /**
     * Locate the executable: an explicit path is used as is, a bare name is
     * searched on {@code PATH}.
     */
    Path resolveExecutable() {
        if (executable.contains(File.separator)) {
            Path p = Path.of(executable);
            return Files.isExecutable(p) ? p : null;
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return null;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir, executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    protected String executable() {
        return executable;
    }

    private static void destroy(Process process) {
        if (process != null) {
            process.destroyForcibly();
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
