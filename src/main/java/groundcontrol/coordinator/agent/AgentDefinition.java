package groundcontrol.coordinator.agent;

import java.util.List;

/**
 * A named role that tasks are assigned to.
 *
 * @param implementer preferred implementer name, or null to use the project default
 */
public record AgentDefinition(String name, String role, String implementer,
        List<String> capabilities, String systemPrompt) {

    public AgentDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("agent name is required");
        }
        role = role != null ? role : name;
        capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
        systemPrompt = systemPrompt != null ? systemPrompt.strip() : "";
    }
}
