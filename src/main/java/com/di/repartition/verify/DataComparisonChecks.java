package com.di.repartition.verify;

import com.di.repartition.plan.model.PartitionType;
import com.di.repartition.plan.model.TableMigrationPlan;
import com.di.repartition.plan.model.TargetConfiguration;
import com.di.repartition.session.CatalogRow;
import com.di.repartition.session.QuerySession;
import com.di.repartition.sql.SqlQueriesProperties;
import com.di.repartition.util.InputValidator;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Compares the old and new tables row for row where it is affordable: totals, a key sample, the
 * partition column range and the newest partitions' statistics.
 */
class DataComparisonChecks extends CheckSuite {

    static final int DISTRIBUTION_LINES = 5;
    /** Oracle allows at most 1000 expressions in an IN list (ORA-01795). */
    static final int MAX_SAMPLE_SIZE = 1000;

    private final int sampleSize;

    DataComparisonChecks(SqlQueriesProperties.Verify sql, QuerySession session, int sampleSize) {
        super(sql, session);
        this.sampleSize = Math.max(1, Math.min(sampleSize, MAX_SAMPLE_SIZE));
    }

    @Override
    List<CheckResult> run(TableMigrationPlan plan) {
        TargetConfiguration target = PreMigrationChecks.targetOf(plan);
        String owner = plan.getOwner();
        String oldTable = plan.getTableName();
        String newTable = plan.newTableName();

        List<CheckResult> results = new ArrayList<>();
        results.add(totalRowCount(owner, oldTable, newTable));
        results.add(sampleData(owner, oldTable, newTable));
        if (!isBlank(target.getPartitionColumn())) {
            results.add(minMaxValues(owner, oldTable, newTable, target.getPartitionColumn()));
        }
        if (target.getPartitionType() == PartitionType.RANGE || target.getPartitionType() == PartitionType.INTERVAL) {
            results.add(partitionDistribution(owner, newTable));
        }
        return results;
    }

    private CheckResult totalRowCount(String owner, String oldTable, String newTable) {
        String name = "Total Row Count";
        try {
            long oldCount = rowCount(owner, oldTable);
            long newCount = rowCount(owner, newTable);
            if (oldCount == newCount) {
                return CheckResult.pass(name, "Row counts match: " + grouped(oldCount) + " rows", details("count", oldCount));
            }
            return CheckResult.fail(name, "Row count mismatch: Old=" + grouped(oldCount) + ", New=" + grouped(newCount),
                    details("old_count", oldCount, "new_count", newCount));
        } catch (DataAccessException | IllegalArgumentException e) {
            return CheckResult.fail(name, "Error comparing row counts: " + e.getMessage());
        }
    }

    /**
     * Samples keys of the first primary key column from the old table and counts how many exist in
     * the new one: all found passes, at least 99% warns, anything less fails.
     */
    private CheckResult sampleData(String owner, String oldTable, String newTable) {
        String name = "Sample Data Comparison";
        try {
            List<String> pkColumns = rows(sql.getPrimaryKeyColumns(), tableParams(owner, oldTable)).stream()
                    .map(r -> r.getString("column_name"))
                    .collect(Collectors.toList());
            if (pkColumns.isEmpty()) {
                return CheckResult.warn(name, "No primary key found, using ROWID for sampling");
            }

            String schema = InputValidator.validateSchemaName(owner);
            String keyColumn = InputValidator.validateColumnName(pkColumns.get(0));
            String sampleQuery = String.format(sql.getSampleKeys(),
                    keyColumn, schema, InputValidator.validateIdentifier(oldTable, "Table name"));
            List<Object> keys = session.query(sampleQuery, Map.of("sampleSize", sampleSize)).stream()
                    .map(r -> CatalogRow.of(r).raw("sample_key"))
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList());
            if (keys.isEmpty()) {
                return CheckResult.warn(name, "No data to sample");
            }

            String matchQuery = String.format(sql.getSampleMatch(),
                    schema, InputValidator.validateIdentifier(newTable, "Table name"), keyColumn);
            CatalogRow row = firstRow(matchQuery, Map.of("sampleKeys", keys));
            long matched = row == null ? 0 : row.getLong("matched", 0);
            return sampleOutcome(name, matched, keys.size());
        } catch (DataAccessException | IllegalArgumentException e) {
            return CheckResult.warn(name, "Cannot compare sample data: " + e.getMessage());
        }
    }

    static CheckResult sampleOutcome(String name, long matched, int sampled) {
        double pct = matched * 100.0 / sampled;
        String ratio = String.format(Locale.ROOT, "%d/%d rows (%.1f%%)", matched, sampled, pct);
        Map<String, Object> details = details("sample_size", sampled, "matched", matched);
        if (matched == sampled) {
            return CheckResult.pass(name, "Sample match: " + ratio, details);
        }
        if (pct >= 99.0) {
            return CheckResult.warn(name, "Sample nearly matches: " + ratio, details);
        }
        return CheckResult.fail(name, "Sample mismatch: " + ratio, details);
    }

    private CheckResult minMaxValues(String owner, String oldTable, String newTable, String column) {
        String name = "MIN/MAX Values: " + column;
        try {
            String schema = InputValidator.validateSchemaName(owner);
            String col = InputValidator.validateColumnName(column);
            CatalogRow oldRow = firstRow(String.format(sql.getMinMax(), col, schema,
                    InputValidator.validateIdentifier(oldTable, "Table name")), Map.of());
            CatalogRow newRow = firstRow(String.format(sql.getMinMax(), col, schema,
                    InputValidator.validateIdentifier(newTable, "Table name")), Map.of());

            Object oldMin = oldRow == null ? null : oldRow.raw("min_value");
            Object oldMax = oldRow == null ? null : oldRow.raw("max_value");
            Object newMin = newRow == null ? null : newRow.raw("min_value");
            Object newMax = newRow == null ? null : newRow.raw("max_value");

            if (Objects.equals(oldMin, newMin) && Objects.equals(oldMax, newMax)) {
                return CheckResult.pass(name, "MIN/MAX match: " + oldMin + " to " + oldMax,
                        details("min", String.valueOf(oldMin), "max", String.valueOf(oldMax)));
            }
            return CheckResult.fail(name,
                    "MIN/MAX mismatch: Old=[" + oldMin + ", " + oldMax + "], New=[" + newMin + ", " + newMax + "]",
                    details("old_min", String.valueOf(oldMin), "old_max", String.valueOf(oldMax),
                            "new_min", String.valueOf(newMin), "new_max", String.valueOf(newMax)));
        } catch (DataAccessException | IllegalArgumentException e) {
            return CheckResult.warn(name, "Cannot compare MIN/MAX: " + e.getMessage());
        }
    }

    private CheckResult partitionDistribution(String owner, String newTable) {
        String name = "Partition Distribution";
        try {
            List<CatalogRow> partitions = rows(sql.getPartitionDistribution(), tableParams(owner, newTable));
            if (partitions.isEmpty()) {
                return CheckResult.warn(name, "No partition statistics found");
            }
            long totalRows = partitions.stream().mapToLong(p -> p.getLong("num_rows", 0)).sum();
            String lines = partitions.stream()
                    .limit(DISTRIBUTION_LINES)
                    .map(p -> {
                        long rows = p.getLong("num_rows", 0);
                        return "  - " + p.getString("partition_name") + ": "
                                + (rows > 0 ? grouped(rows) + " rows" : "(no stats)");
                    })
                    .collect(Collectors.joining("\n"));
            return CheckResult.pass(name,
                    "Found " + partitions.size() + " partition(s), Total rows: " + grouped(totalRows) + "\n" + lines,
                    details("partition_count", partitions.size(), "total_rows", totalRows));
        } catch (DataAccessException e) {
            return CheckResult.warn(name, "Cannot check partition distribution: " + e.getMessage());
        }
    }
}
