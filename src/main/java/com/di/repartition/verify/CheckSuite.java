package com.di.repartition.verify;

import com.di.repartition.plan.model.TableMigrationPlan;
import com.di.repartition.session.CatalogRow;
import com.di.repartition.session.QuerySession;
import com.di.repartition.sql.SqlQueriesProperties;
import com.di.repartition.util.InputValidator;
import org.springframework.dao.DataAccessException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shared plumbing for the three check suites. A query failure inside a check is caught by the
 * check itself and turned into WARN or FAIL; {@link com.di.repartition.session.CatalogAccessException}
 * is never caught here and aborts the run.
 */
abstract class CheckSuite {

    protected final SqlQueriesProperties.Verify sql;
    protected final QuerySession session;

    protected CheckSuite(SqlQueriesProperties.Verify sql, QuerySession session) {
        this.sql = sql;
        this.session = session;
    }

    abstract List<CheckResult> run(TableMigrationPlan plan);

    protected CheckResult tableExists(String owner, String tableName) {
        String name = "Table Exists: " + owner + "." + tableName;
        try {
            CatalogRow row = firstRow(sql.getTableExists(), tableParams(owner, tableName));
            if (row != null && row.getLong("table_count", 0) > 0) {
                return CheckResult.pass(name, "Table " + owner + "." + tableName + " exists");
            }
            return CheckResult.fail(name, "Table " + owner + "." + tableName + " not found");
        } catch (DataAccessException e) {
            return CheckResult.fail(name, "Error checking table: " + e.getMessage());
        }
    }

    protected List<CatalogRow> rows(String query, Map<String, ?> params) {
        return session.query(query, params).stream().map(CatalogRow::of).collect(Collectors.toList());
    }

    /** First row, or null when the query returned nothing. */
    protected CatalogRow firstRow(String query, Map<String, ?> params) {
        List<Map<String, Object>> result = session.query(query, params);
        return result.isEmpty() ? null : CatalogRow.of(result.get(0));
    }

    protected Map<String, Object> tableParams(String owner, String tableName) {
        return Map.of("owner", upper(owner), "tableName", upper(tableName));
    }

    /** {@code SELECT COUNT(*)} on a table whose name is validated before being spliced in. */
    protected long rowCount(String owner, String tableName) {
        String query = String.format(sql.getRowCount(),
                InputValidator.validateSchemaName(owner), InputValidator.validateIdentifier(tableName, "Table name"));
        CatalogRow row = firstRow(query, Map.of());
        return row == null ? 0 : row.getLong("row_count", 0);
    }

    protected static String upper(String value) {
        return value == null ? null : value.trim().toUpperCase(Locale.ROOT);
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /** Insertion-ordered details map that, unlike {@code Map.of}, tolerates null values. */
    protected static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    protected static String grouped(long value) {
        return String.format(Locale.ROOT, "%,d", value);
    }
}
