package groundcontrol.coordinator.planning;

import groundcontrol.coordinator.config.CoordinatorConfig;

import java.util.List;

/**
 * Per-project settings for one run. Serialized as the run's configuration snapshot.
 *
 * @param framework   may be null
 * @param testRunner  may be null
 * @param agents      agent names offered to the planner; empty means every catalog agent
 * @param implementer default implementer for agents that name none; null means the coordinator default
 */
public record ProjectSettings(String name, String repoPath, String language, String framework,
        String testRunner, List<String> agents, int maxParallel, String implementer) {

    public static final int DEFAULT_MAX_PARALLEL = 3;

    public ProjectSettings {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("project name is required");
        }
        if (repoPath == null || repoPath.isBlank()) {
            throw new IllegalArgumentException("repository path is required");
        }
        if (maxParallel < CoordinatorConfig.MIN_PARALLEL || maxParallel > CoordinatorConfig.MAX_PARALLEL) {
            throw new IllegalArgumentException("maxParallel must be between "
                    + CoordinatorConfig.MIN_PARALLEL + " and " + CoordinatorConfig.MAX_PARALLEL
                    + ", got " + maxParallel);
        }
        language = language != null ? language : "python";
        agents = agents != null ? List.copyOf(agents) : List.of();
    }

    public static ProjectSettings of(String name, String repoPath) {
        return new ProjectSettings(name, repoPath, null, null, null, null,
                DEFAULT_MAX_PARALLEL, null);
    }

    public ProjectSettings withLanguage(String language, String framework, String testRunner) {
        return new ProjectSettings(name, repoPath, language, framework, testRunner, agents,
                maxParallel, implementer);
    }

    public ProjectSettings withAgents(List<String> agents) {
        return new ProjectSettings(name, repoPath, language, framework, testRunner, agents,
                maxParallel, implementer);
    }

    public ProjectSettings withMaxParallel(int maxParallel) {
        return new ProjectSettings(name, repoPath, language, framework, testRunner, agents,
                maxParallel, implementer);
    }

    public ProjectSettings withImplementer(String implementer) {
        return new ProjectSettings(name, repoPath, language, framework, testRunner, agents,
                maxParallel, implementer);
    }
}
