package groundcontrol.coordinator.planning;

import groundcontrol.coordinator.agent.AgentDefinition;

import java.util.List;

/**
 * Breaks project work down into tasks assigned to agents.
 */
@FunctionalInterface
public interface Planner {

    /**
     * @param settings project being planned
     * @param agents   agents tasks may be assigned to
     * @return planned tasks; dependencies refer to ids within the same plan
     * @throws Exception if planning fails; the run is marked failed
     */
    List<PlannedTask> plan(ProjectSettings settings, List<AgentDefinition> agents) throws Exception;
}
