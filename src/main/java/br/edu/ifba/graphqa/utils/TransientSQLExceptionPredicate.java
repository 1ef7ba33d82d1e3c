package br.edu.ifba.graphqa.utils;

import br.edu.ifba.graphqa.storage.GraphStoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Predicate to determine if an exception represents a transient graph store error
 * that should be retried.
 *
 * <p>Recognizes SQLite lock contention (SQLITE_BUSY = 5, SQLITE_LOCKED = 6, and their
 * extended codes), the JDBC transient exception types, transient SQLSTATE classes
 * and common lock/timeout message patterns. An unreachable or unopenable store
 * ({@link GraphStoreUnavailableException}) is never transient.</p>
 *
 * <h2>Usage with SmallRye Fault Tolerance:</h2>
 * <pre>{@code
 * @Retry(maxRetries = 3, delay = 200)
 * @RetryWhen(exception = TransientSQLExceptionPredicate.class)
 * public CentralityReport recompute(...) { ... }
 * }</pre>
 */
public final class TransientSQLExceptionPredicate implements Predicate<Throwable> {

    private static final Logger logger = LoggerFactory.getLogger(TransientSQLExceptionPredicate.class);

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    /**
     * SQLSTATE prefixes that indicate transient errors: connection exception (08)
     * and transaction rollback (40).
     */
    private static final Set<String> TRANSIENT_SQLSTATE_PREFIXES = Set.of("08", "40");

    private static final Pattern TRANSIENT_MESSAGE_PATTERN = Pattern.compile(
        "(?i)(" +
        "database\\s+(table\\s+)?is\\s+locked" +
        "|sqlite_busy" +
        "|sqlite_locked" +
        "|database\\s+is\\s+busy" +
        "|lock\\s+wait\\s+timeout" +
        "|read\\s+timed\\s*out" +
        "|try\\s+(again|later)" +
        "|temporarily\\s+unavailable" +
        ")"
    );

    @Override
    public boolean test(final Throwable throwable) {
        if (throwable == null || throwable instanceof GraphStoreUnavailableException) {
            return false;
        }

        if (throwable instanceof SQLTransientException || throwable instanceof SQLTimeoutException) {
            logger.debug("Transient JDBC exception detected: {}", throwable.getMessage());
            return true;
        }

        if (throwable instanceof SQLException sqlException && isTransientSqlError(sqlException)) {
            return true;
        }

        if (isTransientByMessage(throwable.getMessage())) {
            return true;
        }

        Throwable cause = throwable.getCause();
        if (cause != null && cause != throwable) {
            return test(cause);
        }
        return false;
    }

    private boolean isTransientSqlError(final SQLException sqlException) {
        int primaryCode = sqlException.getErrorCode() & 0xFF;
        if (primaryCode == SQLITE_BUSY || primaryCode == SQLITE_LOCKED) {
            logger.debug("SQLite lock contention detected (code {}): {}",
                sqlException.getErrorCode(), sqlException.getMessage());
            return true;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null && sqlState.length() >= 2
                && TRANSIENT_SQLSTATE_PREFIXES.contains(sqlState.substring(0, 2))) {
            logger.debug("Transient SQLSTATE detected: {}, message: {}", sqlState, sqlException.getMessage());
            return true;
        }
        return false;
    }

    private boolean isTransientByMessage(final String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        if (TRANSIENT_MESSAGE_PATTERN.matcher(message).find()) {
            logger.debug("Transient error detected by message pattern: {}",
                message.length() > 100 ? message.substring(0, 100) + "..." : message);
            return true;
        }
        return false;
    }
}
