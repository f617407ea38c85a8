package groundcontrol.coordinator.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agents known to the coordinator, keyed by name.
 */
public class AgentCatalog {

    private final Map<String, AgentDefinition> agents = new ConcurrentHashMap<>();

    /**
     * Catalog with the stock product-manager, architect, developer and reviewer agents.
     */
    public static AgentCatalog withDefaults() {
        AgentCatalog catalog = new AgentCatalog();
        DefaultAgents.all().forEach(catalog::register);
        return catalog;
    }

    public AgentCatalog register(AgentDefinition agent) {
        agents.put(agent.name(), agent);
        return this;
    }

    public Optional<AgentDefinition> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(agents.get(name));
    }

    /**
     * @throws IllegalArgumentException if the agent is unknown
     */
    public AgentDefinition get(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
                "Agent '" + name + "' not found. Available: " + names()));
    }

    public List<AgentDefinition> list() {
        List<AgentDefinition> all = new ArrayList<>(agents.values());
        all.sort((a, b) -> a.name().compareTo(b.name()));
        return all;
    }

    public List<String> names() {
        return list().stream().map(AgentDefinition::name).toList();
    }
}
