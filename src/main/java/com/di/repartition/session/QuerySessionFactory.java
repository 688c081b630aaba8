package com.di.repartition.session;

import com.di.repartition.config.RepartitionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Hands out one session per logical operation from the catalog pool.
 * <pre>{@code
 * try (QuerySession session = sessionFactory.open()) {
 *     discoveryService.discover(session, request);
 * }
 * }</pre>
 */
@Slf4j
@Component
public class QuerySessionFactory {

    private final ObjectProvider<DataSource> dataSource;
    private final RepartitionProperties properties;

    public QuerySessionFactory(ObjectProvider<DataSource> dataSource, RepartitionProperties properties) {
        this.dataSource = dataSource;
        this.properties = properties;
    }

    /** A blank {@code repartition.database.url} counts as no database even if a pool bean exists. */
    public boolean isAvailable() {
        return properties.getDatabase().isConfigured() && dataSource.getIfAvailable() != null;
    }

    /**
     * @throws CatalogAccessException when no database is configured or no connection can be obtained
     */
    public QuerySession open() {
        if (!isAvailable()) {
            throw new CatalogAccessException("No database configured (set repartition.database.url)", null);
        }
        Connection connection = null;
        try {
            connection = dataSource.getObject().getConnection();
            connection.setReadOnly(true);
            log.debug("[SESSION] Opened catalog session");
            return new JdbcQuerySession(connection, properties.getSession().getQueryTimeoutSeconds());
        } catch (SQLException e) {
            closeQuietly(connection);
            throw new CatalogAccessException("Cannot open database session: " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(Connection connection) {
        if (connection == null) return;
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("[SESSION] Failed to release connection after open error: {}", e.getMessage());
        }
    }
}
