package groundcontrol.coordinator.implementer;

import java.time.Duration;
import java.util.List;

/**
 * Delegates code writing to the Claude Code CLI ({@code claude}) in print mode.
 */
public class ClaudeCodeImplementer extends CommandLineImplementer {

    public static final String NAME = "claude_code";

    static final String MAX_TURNS = "50";

    public ClaudeCodeImplementer() {
        this(DEFAULT_TIMEOUT);
    }

    public ClaudeCodeImplementer(Duration timeout) {
        this("claude", timeout);
    }

    ClaudeCodeImplementer(String executable, Duration timeout) {
        super(NAME, "Claude Code", executable,
                "Claude Code CLI not found. Install it: npm install -g @anthropic-ai/claude-code",
                timeout);
    }

    @Override
    protected List<String> command(String prompt, String projectPath) {
        return List.of(executable(),
                "-p", prompt,
                "--output-format", "text",
                "--max-turns", MAX_TURNS,
                "--dangerously-skip-permissions");
    }
}
