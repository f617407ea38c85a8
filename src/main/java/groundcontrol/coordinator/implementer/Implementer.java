package groundcontrol.coordinator.implementer;

import java.util.Map;

/**
 * A tool that writes code inside a project checkout (Claude Code, Cursor CLI, ...).
 */
public interface Implementer {

    /**
     * Registry name, e.g. {@code claude_code}.
     */
    String name();

    /**
     * Run the tool against a project.
     *
     * @param prompt      full prompt: agent instructions plus task details
     * @param projectPath working directory for the tool
     * @param context     task, agent and project metadata; may be empty
     * @return outcome of the run, never null
     */
    ImplementerResult execute(String prompt, String projectPath, Map<String, Object> context);

    /**
     * Whether the tool is installed and reachable.
     */
    boolean isAvailable();
}
