package com.di.repartition.session;

import com.di.repartition.exception.ErrorCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * {@link QuerySession} pinned to one pooled JDBC connection. Every statement gets the configured
 * query timeout; connectivity failures are raised as {@link CatalogAccessException}.
 */
@Slf4j
public class JdbcQuerySession implements QuerySession {

    private final Connection connection;
    private final NamedParameterJdbcTemplate template;
    private boolean closed;

    public JdbcQuerySession(Connection connection, int queryTimeoutSeconds) {
        this.connection = connection;
        JdbcTemplate jdbc = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
        if (queryTimeoutSeconds > 0) {
            jdbc.setQueryTimeout(queryTimeoutSeconds);
        }
        jdbc.setFetchSize(500);
        this.template = new NamedParameterJdbcTemplate(jdbc);
    }

    @Override
    public List<Map<String, Object>> query(String sql, Map<String, ?> params) {
        if (closed) {
            throw new IllegalStateException("Query session already closed");
        }
        try {
            return template.queryForList(sql, params == null ? Map.of() : params);
        } catch (DataAccessException e) {
            if (ErrorCategory.isConnectionLoss(e)) {
                throw new CatalogAccessException("Database session lost: " + e.getMostSpecificCause().getMessage(), e);
            }
            throw e;
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.close();
            log.debug("[SESSION] Connection returned to pool");
        } catch (SQLException e) {
            log.warn("[SESSION] Failed to release connection: {}", e.getMessage());
        }
    }
}
