package groundcontrol.coordinator.store;

import groundcontrol.coordinator.repository.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;

/**
 * SQLState classification shared by the JDBC repositories.
 */
final class SqlErrors {

    private static final Logger log = LoggerFactory.getLogger(SqlErrors.class);

    private static final String UNIQUE_VIOLATION = "23505";
    // H2 reports a missing parent row as 23506, PostgreSQL as 23503
    private static final String FK_PARENT_MISSING = "23506";
    private static final String FK_VIOLATION = "23503";

    private SqlErrors() {
    }

    static boolean isDuplicateKey(SQLException e) {
        return UNIQUE_VIOLATION.equals(e.getSQLState());
    }

    static boolean isMissingParent(SQLException e) {
        String state = e.getSQLState();
        return FK_PARENT_MISSING.equals(state) || FK_VIOLATION.equals(state);
    }

    static StoreUnavailableException unavailable(String message, SQLException e) {
        log.error("{} (SQLState {})", message, e.getSQLState(), e);
        return new StoreUnavailableException(message, e);
    }
}
