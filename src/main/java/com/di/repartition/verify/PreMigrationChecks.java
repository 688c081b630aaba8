package com.di.repartition.verify;

import com.di.repartition.plan.model.EnvironmentProfile;
import com.di.repartition.plan.model.IntervalType;
import com.di.repartition.plan.model.PartitionType;
import com.di.repartition.plan.model.TableMigrationPlan;
import com.di.repartition.plan.model.TargetConfiguration;
import com.di.repartition.session.CatalogRow;
import com.di.repartition.session.QuerySession;
import com.di.repartition.sql.SqlQueriesProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks run against the source table before the migration scripts execute.
 */
@Slf4j
class PreMigrationChecks extends CheckSuite {

    static final String DEFAULT_TABLESPACE = "USERS";
    static final int MAX_INTERVAL_VALUE = 999;

    private final EnvironmentProfile environment;

    PreMigrationChecks(SqlQueriesProperties.Verify sql, QuerySession session, EnvironmentProfile environment) {
        super(sql, session);
        this.environment = environment;
    }

    @Override
    List<CheckResult> run(TableMigrationPlan plan) {
        TargetConfiguration target = targetOf(plan);
        List<CheckResult> results = new ArrayList<>();
        results.add(tableExists(plan.getOwner(), plan.getTableName()));
        results.add(columnsExist(plan, target));
        results.add(columnTypes(plan, target));
        results.add(tablespaceSpace(plan, target));
        results.add(tableLocks(plan.getOwner(), plan.getTableName()));
        if (target.getPartitionType() == PartitionType.INTERVAL) {
            results.add(intervalSyntax(target));
        }
        results.add(dependencies(plan.getOwner(), plan.getTableName()));
        if (plan.getCurrentState() != null && plan.getCurrentState().partitioned()) {
            results.add(existingPartitions(plan));
        }
        results.add(environmentSettings(target));
        return results;
    }

    static TargetConfiguration targetOf(TableMigrationPlan plan) {
        TargetConfiguration target = plan.target();
        return target != null ? target : TargetConfiguration.builder().partitionType(PartitionType.NONE).build();
    }

    // ------------------------------------------------------------------ //

    private CheckResult columnsExist(TableMigrationPlan plan, TargetConfiguration target) {
        String name = "Column Existence";
        Set<String> wanted = new LinkedHashSet<>();
        if (!isBlank(target.getPartitionColumn())) wanted.add(upper(target.getPartitionColumn()));
        if (!isBlank(target.getSubpartitionColumn())) wanted.add(upper(target.getSubpartitionColumn()));
        if (wanted.isEmpty()) {
            return CheckResult.pass(name, "No columns to validate");
        }

        try {
            Map<String, Object> params = Map.of(
                    "owner", upper(plan.getOwner()),
                    "tableName", upper(plan.getTableName()),
                    "columnNames", new ArrayList<>(wanted));
            Set<String> found = rows(sql.getColumnsPresent(), params).stream()
                    .map(r -> upper(r.getString("column_name")))
                    .collect(Collectors.toSet());
            List<String> missing = wanted.stream().filter(c -> !found.contains(c)).collect(Collectors.toList());
            if (!missing.isEmpty()) {
                return CheckResult.fail(name, "Missing columns: " + String.join(", ", missing),
                        details("missing_columns", missing));
            }
            return CheckResult.pass(name, "All " + wanted.size() + " columns exist");
        } catch (DataAccessException e) {
            return CheckResult.fail(name, "Error checking columns: " + e.getMessage());
        }
    }

    private CheckResult columnTypes(TableMigrationPlan plan, TargetConfiguration target) {
        String name = "Column Data Types";
        String column = target.getPartitionColumn();
        if (isBlank(column)) {
            return CheckResult.pass(name, "No partition column specified");
        }

        try {
            Map<String, Object> params = Map.of(
                    "owner", upper(plan.getOwner()),
                    "tableName", upper(plan.getTableName()),
                    "columnName", upper(column));
            CatalogRow row = firstRow(sql.getColumnType(), params);
            if (row == null) {
                return CheckResult.fail(name, "Column " + column + " not found");
            }
            String dataType = row.getString("data_type");
            if (target.getPartitionType() != PartitionType.INTERVAL) {
                return CheckResult.pass(name, "Column " + column + " type: " + dataType);
            }
            if (dataType == null || !(dataType.startsWith("DATE") || dataType.startsWith("TIMESTAMP"))) {
                return CheckResult.fail(name, "Column " + column + " has type " + dataType + ", not suitable for INTERVAL",
                        details("data_type", dataType));
            }
            return CheckResult.pass(name, "Column " + column + " type " + dataType + " is suitable");
        } catch (DataAccessException e) {
            return CheckResult.fail(name, "Error checking column type: " + e.getMessage());
        }
    }

    /** The new table needs room next to the old one: at least twice the current size. */
    private CheckResult tablespaceSpace(TableMigrationPlan plan, TargetConfiguration target) {
        String name = "Tablespace Space";
        String tablespace = isBlank(target.getTablespace()) ? DEFAULT_TABLESPACE : target.getTablespace();
        double sizeGb = plan.getCurrentState() == null ? 0.0 : plan.getCurrentState().getSizeGb();
        double requiredGb = sizeGb * 2;

        try {
            Map<String, Object> params = Map.of("tablespace", upper(tablespace));
            CatalogRow row = freeSpaceFromDba(params);
            if (row == null) {
                row = firstRow(sql.getFreeSpaceUser(), params);
            }
            if (row == null || row.getDouble("free_gb") == null) {
                return CheckResult.warn(name, "Cannot determine tablespace free space");
            }
            double freeGb = row.getDouble("free_gb");
            if (freeGb < requiredGb) {
                return CheckResult.warn(name,
                        String.format(Locale.ROOT, "Tablespace %s has %.2f GB free, but %.2f GB recommended",
                                tablespace, freeGb, requiredGb),
                        details("free_gb", freeGb, "required_gb", requiredGb));
            }
            return CheckResult.pass(name,
                    String.format(Locale.ROOT, "Tablespace %s has sufficient space: %.2f GB free", tablespace, freeGb));
        } catch (DataAccessException e) {
            return CheckResult.warn(name, "Cannot check tablespace space: " + e.getMessage());
        }
    }

    /** dba_free_space needs a grant most migration users lack; null sends the caller to user_free_space. */
    private CatalogRow freeSpaceFromDba(Map<String, Object> params) {
        try {
            return firstRow(sql.getFreeSpaceDba(), params);
        } catch (DataAccessException e) {
            log.debug("[MIGRATION-CHECK] dba_free_space not readable, falling back to user_free_space: {}", e.getMessage());
            return null;
        }
    }

    private CheckResult tableLocks(String owner, String tableName) {
        String name = "Table Locks: " + owner + "." + tableName;
        try {
            int locks = session.query(sql.getTableLocks(), tableParams(owner, tableName)).size();
            if (locks > 0) {
                return CheckResult.warn(name, "Found " + locks + " active lock(s) on table", details("lock_count", locks));
            }
            return CheckResult.pass(name, "No active locks on table");
        } catch (DataAccessException e) {
            return CheckResult.warn(name, "Cannot check locks: " + e.getMessage());
        }
    }

    CheckResult intervalSyntax(TargetConfiguration target) {
        String name = "Interval Syntax";
        IntervalType type = target.getIntervalType() != null ? target.getIntervalType() : IntervalType.MONTH;
        Integer value = target.getIntervalValue() != null ? target.getIntervalValue() : 1;
        if (value < 1 || value > MAX_INTERVAL_VALUE) {
            return CheckResult.fail(name, "Invalid interval value: " + value + ". Must be 1-" + MAX_INTERVAL_VALUE,
                    details("interval_value", value));
        }
        return CheckResult.pass(name, "Interval syntax valid: " + type + "(" + value + ")");
    }

    private CheckResult dependencies(String owner, String tableName) {
        String name = "Dependencies: " + owner + "." + tableName;
        try {
            int fks = session.query(sql.getForeignKeys(), tableParams(owner, tableName)).size();
            if (fks > 0) {
                return CheckResult.warn(name, "Found " + fks + " foreign key constraint(s). Will be disabled during migration.",
                        details("fk_count", fks));
            }
            return CheckResult.pass(name, "No foreign key dependencies");
        } catch (DataAccessException e) {
            return CheckResult.warn(name, "Cannot check dependencies: " + e.getMessage());
        }
    }

    private CheckResult existingPartitions(TableMigrationPlan plan) {
        String name = "Existing Partitions";
        try {
            CatalogRow row = firstRow(sql.getPartitionState(), tableParams(plan.getOwner(), plan.getTableName()));
            if (row == null) {
                return CheckResult.pass(name, "Table is not partitioned");
            }
            String partitionType = row.getString("partitioning_type");
            Integer partitionCount = row.getInteger("partition_count");
            String subpartitionType = row.getString("subpartitioning_type");
            if ("NONE".equalsIgnoreCase(subpartitionType)) {
                subpartitionType = null;
            }
            String interval = row.getString("interval");

            StringBuilder message = new StringBuilder("Current: ")
                    .append(partitionType).append(" partitioning, ")
                    .append(partitionCount).append(" partitions");
            if (!isBlank(subpartitionType)) message.append(", ").append(subpartitionType).append(" subpartitioning");
            if (!isBlank(interval)) message.append(", INTERVAL: ").append(interval);

            return CheckResult.pass(name, message.toString(), details(
                    "partition_count", partitionCount,
                    "partition_type", partitionType,
                    "subpartition_type", subpartitionType,
                    "interval", interval));
        } catch (DataAccessException e) {
            return CheckResult.warn(name, "Cannot check partitions: " + e.getMessage());
        }
    }

    /**
     * Re-checks the target against the environment bounds. Every bound that is breached is reported;
     * the check passes only when none is.
     */
    CheckResult environmentSettings(TargetConfiguration target) {
        String name = "Environment Settings";
        List<String> warnings = new ArrayList<>();
        Map<String, Object> findings = details();

        EnvironmentProfile.SubpartitionDefaults subDefaults = environment == null ? null : environment.getSubpartitionDefaults();
        Integer subCount = target.getSubpartitionCount();
        if (subCount != null) {
            int min = subDefaults != null && subDefaults.getMinCount() != null ? subDefaults.getMinCount() : 2;
            int max = subDefaults != null && subDefaults.getMaxCount() != null ? subDefaults.getMaxCount() : 16;
            if (subCount < min) {
                warnings.add("Subpartition count " + subCount + " below environment minimum " + min);
                findings.putAll(details("subpart_count", subCount, "min_count", min));
            } else if (subCount > max) {
                warnings.add("Subpartition count " + subCount + " above environment maximum " + max);
                findings.putAll(details("subpart_count", subCount, "max_count", max));
            }
        }

        EnvironmentProfile.ParallelDefaults parallel = environment == null ? null : environment.getParallelDefaults();
        Integer degree = target.getParallelDegree();
        if (degree != null) {
            int min = parallel != null && parallel.getMinDegree() != null ? parallel.getMinDegree() : 1;
            int max = parallel != null && parallel.getMaxDegree() != null ? parallel.getMaxDegree() : 8;
            if (degree < min) {
                warnings.add("Parallel degree " + degree + " below environment minimum " + min);
                findings.putAll(details("parallel_degree", degree, "min_degree", min));
            } else if (degree > max) {
                warnings.add("Parallel degree " + degree + " above environment maximum " + max);
                findings.putAll(details("parallel_degree", degree, "max_degree", max));
            }
        }

        String primary = environment == null ? null : environment.primaryTablespace();
        String tablespace = target.getTablespace();
        if (!isBlank(tablespace) && !isBlank(primary) && !tablespace.equalsIgnoreCase(primary)) {
            warnings.add("Tablespace " + tablespace + " differs from environment default " + primary);
            findings.putAll(details("tablespace", tablespace, "expected", primary));
        }

        if (!warnings.isEmpty()) {
            return CheckResult.warn(name, String.join("; ", warnings), findings);
        }
        String environmentName = environment == null || environment.getName() == null ? "unknown" : environment.getName();
        return CheckResult.pass(name, "Tablespace configuration matches environment: " + environmentName);
    }
}
