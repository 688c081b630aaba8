package com.di.repartition.exception;

import com.di.repartition.environment.EnvironmentConfigException;
import com.di.repartition.plan.PlanDocumentException;
import com.di.repartition.plan.ProvenanceException;
import com.di.repartition.session.CatalogAccessException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Error categories used to decide whether a failure aborts an operation (connectivity) or is
 * isolated to one table or one check (everything else), and to label REST error responses.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection"),
    CONSTRAINT_VIOLATION("Database constraint violation", "Database constraint check failed"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or semantic error"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back"),
    PERMISSION_ERROR("Permission denied", "Insufficient privileges on a catalog or data view"),
    DATABASE_ERROR("Database error", "General database operation error"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    VALIDATION_ERROR("Validation error", "Input validation or plan gate violation"),
    CONFIGURATION_ERROR("Configuration error", "Application or environment profile configuration issue"),
    SERIALIZATION_ERROR("Serialization error", "Plan document could not be read or written"),
    TIMEOUT_ERROR("Timeout error", "Query exceeded the configured query timeout"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Oracle vendor codes that mean the session is gone even when no SQLState is reported. */
    private static final Set<Integer> ORACLE_CONNECTION_CODES = Set.of(
            1012,   // not logged on
            3113,   // end-of-file on communication channel
            3114,   // not connected to ORACLE
            3135,   // connection lost contact
            17002,  // IO error
            17008   // closed connection
    );

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK
    );

    /** Order matters: first match wins. Add new categories before APPLICATION_ERROR. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof CatalogAccessException, CONNECTION_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(t -> t instanceof PlanDocumentException, SERIALIZATION_ERROR);
        MATCHERS.put(t -> t instanceof EnvironmentConfigException, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof DataAccessException dae) {
            return categorizeDataAccess(dae);
        }
        if (exception instanceof SQLException sqlEx) {
            return categorizeSqlException(sqlEx);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    /** True when the failure means the session can no longer be used. */
    public static boolean isConnectionLoss(Throwable exception) {
        ErrorCategory category = categorize(exception);
        return category == CONNECTION_ERROR || category == NETWORK_ERROR;
    }

    private static ErrorCategory categorizeDataAccess(DataAccessException dae) {
        if (dae instanceof QueryTimeoutException) {
            return TIMEOUT_ERROR;
        }
        Throwable root = dae.getMostSpecificCause();
        if (root instanceof SQLException sqlEx) {
            return categorizeSqlException(sqlEx);
        }
        if (dae instanceof DataAccessResourceFailureException) {
            return CONNECTION_ERROR;
        }
        return root != dae ? categorize(root) : DATABASE_ERROR;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        if (sqlEx instanceof SQLTimeoutException) {
            return TIMEOUT_ERROR;
        }
        if (ORACLE_CONNECTION_CODES.contains(sqlEx.getErrorCode())) {
            return CONNECTION_ERROR;
        }
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null && !sqlState.isEmpty()) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "ora-00942", "ora-01031", "insufficient privileges", "permission", "access denied")) return PERMISSION_ERROR;
            if (containsAny(lower, "connection", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "constraint", "unique", "foreign key")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "syntax", "invalid identifier", "parse error")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || t instanceof SQLTimeoutException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof ProvenanceException
                || t instanceof IllegalArgumentException
                || t instanceof IllegalStateException;
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
