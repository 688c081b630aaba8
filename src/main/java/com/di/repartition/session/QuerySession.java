package com.di.repartition.session;

import java.util.List;
import java.util.Map;

/**
 * One database session owned by exactly one logical operation (a discovery run or one validation
 * run). Not safe for concurrent use; acquire with try-with-resources so it is released on every
 * exit path.
 */
public interface QuerySession extends AutoCloseable {

    /**
     * Runs a read-only query with named bind parameters ({@code :owner}, {@code :table_name}, ...).
     * Collection-valued parameters expand to IN lists.
     *
     * @return rows as column-label to value maps, keys case-insensitive
     * @throws org.springframework.dao.DataAccessException on any query failure, including timeouts
     */
    List<Map<String, Object>> query(String sql, Map<String, ?> params);

    @Override
    void close();
}
