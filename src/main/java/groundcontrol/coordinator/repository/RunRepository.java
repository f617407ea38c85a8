package groundcontrol.coordinator.repository;

import groundcontrol.coordinator.model.Run;
import groundcontrol.coordinator.model.RunStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Run persistence.
 */
public interface RunRepository {

    /**
     * Save a new run.
     *
     * @param run the run to save
     * @throws DuplicateKeyException if a run with the same id exists
     */
    void save(Run run);

    /**
     * Find a run by ID.
     *
     * @param runId the run ID
     * @return the run if found
     */
    Optional<Run> findById(String runId);

    /**
     * Get recent runs, newest first.
     *
     * @param projectName project filter, or null for all projects
     * @param limit       maximum results
     * @return list of runs
     */
    List<Run> findRecent(String projectName, int limit);

    /**
     * Update run status. No transition checks are made.
     *
     * @param runId  the run ID
     * @param status the new status
     * @throws NotFoundException if the run does not exist
     */
    void updateStatus(String runId, RunStatus status);
}
