package tech.flowcatalyst.resourcebridge.common.errors;

import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.QueryTimeoutException;
import org.jboss.logging.Logger;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.time.DateTimeException;
import java.util.Map;

/**
 * Maps exceptions raised while executing a command onto the closed error set.
 *
 * <p>Storage failures are classified by the SQLState of the first
 * {@link SQLException} in the cause chain:
 * <ul>
 *   <li>23505 - duplicate_entry</li>
 *   <li>23503 - invalid_reference</li>
 *   <li>other 23xxx - constraint_error</li>
 *   <li>08xxx, connection and timeout failures - database_unavailable</li>
 * </ul>
 *
 * <p>The returned messages are fixed strings. The original exception is only
 * logged, never returned, so driver messages (table names, hosts, SQL) stay
 * out of responses.
 */
public final class ExceptionTranslator {

    private static final Logger LOG = Logger.getLogger(ExceptionTranslator.class);

    static final String UNIQUE_VIOLATION = "23505";
    static final String FOREIGN_KEY_VIOLATION = "23503";
    static final String INTEGRITY_CLASS = "23";
    static final String CONNECTION_CLASS = "08";

    private ExceptionTranslator() {
    }

    public static UseCaseError translate(Throwable e, String operation) {
        SQLException sqlException = findSqlException(e);
        if (sqlException != null) {
            return translateSql(e, sqlException, operation);
        }

        if (isUnavailable(e)) {
            LOG.errorf(e, "Database unavailable during %s", operation);
            return unavailable();
        }

        if (e instanceof PersistenceException) {
            LOG.errorf(e, "Database error during %s", operation);
            return new UseCaseError.StorageError(ErrorCode.INTERNAL_ERROR, "A database error occurred", Map.of());
        }

        if (e instanceof UnsupportedOperationException) {
            LOG.debugf("Unsupported operation during %s: %s", operation, e.getMessage());
            return UseCaseError.invalidInput("Operation not supported for this resource");
        }

        if (e instanceof IllegalArgumentException
                || e instanceof ClassCastException
                || e instanceof ArithmeticException
                || e instanceof DateTimeException) {
            LOG.debugf("Invalid input during %s: %s", operation, e.getMessage());
            return UseCaseError.invalidInput("Invalid input provided");
        }

        LOG.errorf(e, "Unexpected error during %s", operation);
        return new UseCaseError.StorageError(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", Map.of());
    }

    private static UseCaseError translateSql(Throwable original, SQLException sqlException, String operation) {
        String state = sqlException.getSQLState();

        if (UNIQUE_VIOLATION.equals(state)) {
            LOG.warnf("Unique constraint violated during %s: %s", operation, sqlException.getMessage());
            return new UseCaseError.ConflictError(
                ErrorCode.DUPLICATE_ENTRY,
                "A record with the same unique value already exists",
                Map.of()
            );
        }
        if (FOREIGN_KEY_VIOLATION.equals(state)) {
            LOG.warnf("Foreign key constraint violated during %s: %s", operation, sqlException.getMessage());
            return new UseCaseError.ConflictError(
                ErrorCode.INVALID_REFERENCE,
                "A referenced record does not exist",
                Map.of()
            );
        }
        if (state != null && state.startsWith(INTEGRITY_CLASS)) {
            LOG.warnf("Constraint violated during %s: %s", operation, sqlException.getMessage());
            return new UseCaseError.ConflictError(
                ErrorCode.CONSTRAINT_ERROR,
                "A database constraint was violated",
                Map.of()
            );
        }
        if ((state != null && state.startsWith(CONNECTION_CLASS)) || isUnavailable(original)) {
            LOG.errorf(original, "Database unavailable during %s", operation);
            return unavailable();
        }

        LOG.errorf(original, "Database error during %s (SQLState %s)", operation, state);
        return new UseCaseError.StorageError(ErrorCode.INTERNAL_ERROR, "A database error occurred", Map.of());
    }

    private static UseCaseError unavailable() {
        return new UseCaseError.StorageError(
            ErrorCode.DATABASE_UNAVAILABLE,
            "The database is currently unavailable",
            Map.of()
        );
    }

    private static boolean isUnavailable(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLTransientConnectionException
                    || current instanceof SQLNonTransientConnectionException
                    || current instanceof SQLTimeoutException
                    || current instanceof QueryTimeoutException
                    || current instanceof LockTimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static SQLException findSqlException(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLException sql) {
                return sql;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }
}
