package groundcontrol.coordinator.implementer;

import java.time.Duration;
import java.util.List;

public class CursorCliImplementer extends CommandLineImplementer {

    public static final String NAME = "cursor_cli";

    public CursorCliImplementer() {
        this(DEFAULT_TIMEOUT);
    }

    public CursorCliImplementer(Duration timeout) {
        this("cursor", timeout);
    }

    CursorCliImplementer(String executable, Duration timeout) {
        super(NAME, "Cursor CLI", executable,
                "Cursor CLI not found. Install it from https://cursor.com",
                timeout);
    }

    @Override
    protected List<String> command(String prompt, String projectPath) {
        return List.of(executable(),
                "--project-path", projectPath,
                "--prompt", prompt);
    }
}
