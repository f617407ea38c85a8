package groundcontrol.coordinator.implementer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineImplementerTest {

    @TempDir
    Path project;

    /** Runs the prompt as a shell script. */
    static class ShellImplementer extends CommandLineImplementer {

        ShellImplementer(String executable, Duration timeout) {
            super("shell", "Shell", executable, "sh not found", timeout);
        }

        @Override
        protected List<String> command(String prompt, String projectPath) {
            return List.of(executable(), "-c", prompt);
        }
    }

    private ShellImplementer shell(Duration timeout) {
        return new ShellImplementer("sh", timeout);
    }

    @Test
    void zeroExitIsSuccessWithStdout() {
        ImplementerResult result = shell(Duration.ofSeconds(10))
                .execute("echo hello", project.toString(), Map.of());

        assertTrue(result.success());
        assertEquals("hello\n", result.output());
        assertNull(result.error());
    }

    @Test
    void runsInsideTheProjectDirectory() throws Exception {
        ImplementerResult result = shell(Duration.ofSeconds(10))
                .execute("echo content > marker.txt", project.toString(), Map.of());

        assertTrue(result.success());
        assertEquals("content\n", Files.readString(project.resolve("marker.txt")));
    }

    @Test
    void nonZeroExitCarriesCodeAndStderr() {
        ImplementerResult result = shell(Duration.ofSeconds(10))
                .execute("echo partial; echo broken >&2; exit 3", project.toString(), Map.of());

        assertFalse(result.success());
        assertEquals("partial\n", result.output());
        assertEquals("Shell exited with code 3: broken\n", result.error());
    }

    @Test
    void timeoutKillsTheProcess() {
        long start = System.nanoTime();
        ImplementerResult result = shell(Duration.ofSeconds(1))
                .execute("sleep 30", project.toString(), Map.of());
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertFalse(result.success());
        assertEquals("Shell execution timed out after 1 seconds", result.error());
        assertTrue(elapsedMs < 10_000, "took " + elapsedMs + " ms");
    }

    @Test
    void missingExecutableReportsInstallHint() {
        ShellImplementer missing = new ShellImplementer("gc-no-such-tool-xyz", Duration.ofSeconds(1));

        assertFalse(missing.isAvailable());
        ImplementerResult result = missing.execute("anything", project.toString(), Map.of());
        assertFalse(result.success());
        assertEquals("sh not found", result.error());
    }

    @Test
    void claudeCodeCommandLine() {
        // echo prints the arguments it was given
        ClaudeCodeImplementer claude = new ClaudeCodeImplementer("echo", Duration.ofSeconds(10));

        ImplementerResult result = claude.execute("fix the bug", project.toString(), Map.of());

        assertTrue(result.success());
        assertEquals("-p fix the bug --output-format text --max-turns 50 --dangerously-skip-permissions\n",
                result.output());
        assertEquals(ClaudeCodeImplementer.NAME, claude.name());
    }

    @Test
    void cursorCommandLine() {
        CursorCliImplementer cursor = new CursorCliImplementer("echo", Duration.ofSeconds(10));

        ImplementerResult result = cursor.execute("add tests", project.toString(), Map.of());

        assertTrue(result.success());
        assertEquals("--project-path " + project + " --prompt add tests\n", result.output());
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> shell(Duration.ZERO));
    }
}
