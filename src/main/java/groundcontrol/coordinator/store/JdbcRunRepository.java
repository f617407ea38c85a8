package groundcontrol.coordinator.store;

import groundcontrol.coordinator.model.Run;
import groundcontrol.coordinator.model.RunStatus;
import groundcontrol.coordinator.repository.DuplicateKeyException;
import groundcontrol.coordinator.repository.NotFoundException;
import groundcontrol.coordinator.repository.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of RunRepository.
 */
public class JdbcRunRepository implements RunRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunRepository.class);

    private final Database db;

    public JdbcRunRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Run run) {
        String sql = """
                    INSERT INTO runs (id, project_name, status, created_at, updated_at, config_snapshot)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        Instant now = Instant.now();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, run.id());
            ps.setString(2, run.projectName());
            ps.setString(3, run.status().name());
            ps.setTimestamp(4, Timestamp.from(run.createdAt() != null ? run.createdAt() : now));
            ps.setTimestamp(5, Timestamp.from(run.updatedAt() != null ? run.updatedAt() : now));
            ps.setString(6, run.configSnapshot());

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved run: {}", run.id());
        } catch (SQLException e) {
            if (SqlErrors.isDuplicateKey(e)) {
                throw new DuplicateKeyException("Run", run.id(), e);
            }
            throw SqlErrors.unavailable("Failed to save run: " + run.id(), e);
        }
    }

    @Override
    public Optional<Run> findById(String runId) {
        String sql = "SELECT * FROM runs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw SqlErrors.unavailable("Failed to find run: " + runId, e);
        }
    }

    @Override
    public List<Run> findRecent(String projectName, int limit) {
        String sql = projectName != null
                ? "SELECT * FROM runs WHERE project_name = ? ORDER BY created_at DESC LIMIT ?"
                : "SELECT * FROM runs ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int index = 1;
            if (projectName != null) {
                ps.setString(index++, projectName);
            }
            ps.setInt(index, limit);

            List<Run> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw SqlErrors.unavailable("Failed to find recent runs", e);
        }
    }

    @Override
    public void updateStatus(String runId, RunStatus status) {
        String sql = "UPDATE runs SET status = ?, updated_at = ? WHERE id = ?";

        int updated;
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, runId);

            updated = ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw SqlErrors.unavailable("Failed to update run status: " + runId, e);
        }

        if (updated == 0) {
            throw new NotFoundException("Run", runId);
        }
        log.debug("Run {} -> {}", runId, status);
    }

    private Run mapRow(ResultSet rs) throws SQLException {
        return Run.builder()
                .id(rs.getString("id"))
                .projectName(rs.getString("project_name"))
                .status(RunStatus.valueOf(rs.getString("status")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .configSnapshot(rs.getString("config_snapshot"))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
