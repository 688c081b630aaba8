package com.di.repartition.validation;

import com.di.repartition.plan.model.MigrationPlanDocument;
import com.di.repartition.plan.model.TableMigrationPlan;
import com.di.repartition.plan.model.TargetConfiguration;
import com.di.repartition.session.CatalogRow;
import com.di.repartition.session.QuerySession;
import com.di.repartition.sql.SqlQueriesProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks the enabled tables against the live dictionary: the table must exist, and the configured
 * partition and subpartition columns must exist with suitable types.
 */
@Slf4j
final class LiveDatabaseRules {

    private final SqlQueriesProperties.Validation sql;
    private final QuerySession session;

    LiveDatabaseRules(SqlQueriesProperties.Validation sql, QuerySession session) {
        this.sql = sql;
        this.session = session;
    }

    void apply(MigrationPlanDocument document, ValidationAccumulator acc) {
        String schema = document.getMetadata() == null ? null : document.getMetadata().effectiveSchema();
        if (schema == null || schema.isBlank()) {
            acc.error("No schema specified in metadata");
            return;
        }
        String owner = schema.toUpperCase(Locale.ROOT);
        for (TableMigrationPlan table : LogicalRules.tablesOf(document)) {
            if (table != null && table.isEnabled() && table.getTableName() != null) {
                checkTable(owner, table, acc);
            }
        }
    }

    private void checkTable(String owner, TableMigrationPlan table, ValidationAccumulator acc) {
        String tableName = table.getTableName().toUpperCase(Locale.ROOT);
        String prefix = "Table " + owner + "." + tableName;

        try {
            List<Map<String, Object>> rows = session.query(sql.getTableExists(), Map.of("owner", owner, "tableName", tableName));
            long count = rows.isEmpty() ? 0 : CatalogRow.of(rows.get(0)).getLong("table_count", 0);
            if (count == 0) {
                acc.error(prefix + ": table does not exist");
                return;
            }
        } catch (DataAccessException e) {
            acc.error(prefix + ": error checking existence: " + e.getMessage());
            return;
        }

        TargetConfiguration target = table.target();
        if (target == null) {
            return;
        }

        String partitionColumn = target.getPartitionColumn();
        if (partitionColumn != null && !partitionColumn.isBlank()) {
            try {
                CatalogRow column = columnDefinition(owner, tableName, partitionColumn);
                if (column == null) {
                    acc.error(String.format("%s: partition column '%s' does not exist", prefix, partitionColumn));
                } else {
                    String dataType = column.getString("data_type");
                    if (!isDateFamily(dataType)) {
                        acc.warn(String.format("%s: partition column '%s' type '%s' may not be suitable for interval partitioning",
                                prefix, partitionColumn, dataType));
                    }
                }
            } catch (DataAccessException e) {
                acc.error(prefix + ": error checking partition column: " + e.getMessage());
            }
        }

        String subpartitionColumn = target.getSubpartitionColumn();
        if (subpartitionColumn != null && !subpartitionColumn.isBlank()) {
            try {
                CatalogRow column = columnDefinition(owner, tableName, subpartitionColumn);
                if (column == null) {
                    acc.error(String.format("%s: subpartition column '%s' does not exist", prefix, subpartitionColumn));
                } else if ("Y".equalsIgnoreCase(column.getString("nullable"))) {
                    acc.warn(String.format("%s: subpartition column '%s' allows NULL (may cause uneven distribution)",
                            prefix, subpartitionColumn));
                }
            } catch (DataAccessException e) {
                acc.error(prefix + ": error checking subpartition column: " + e.getMessage());
            }
        }
    }

    private CatalogRow columnDefinition(String owner, String tableName, String column) {
        List<Map<String, Object>> rows = session.query(sql.getColumnDefinition(),
                Map.of("owner", owner, "tableName", tableName, "columnName", column.toUpperCase(Locale.ROOT)));
        return rows.isEmpty() ? null : CatalogRow.of(rows.get(0));
    }

    /** DATE and every TIMESTAMP variant. */
    static boolean isDateFamily(String dataType) {
        if (dataType == null) return false;
        String t = dataType.toUpperCase(Locale.ROOT);
        return t.equals("DATE") || t.startsWith("TIMESTAMP");
    }
}
