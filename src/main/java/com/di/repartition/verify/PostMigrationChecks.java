package com.di.repartition.verify;

import com.di.repartition.plan.model.IntervalType;
import com.di.repartition.plan.model.PartitionType;
import com.di.repartition.plan.model.SubpartitionType;
import com.di.repartition.plan.model.TableMigrationPlan;
import com.di.repartition.plan.model.TargetConfiguration;
import com.di.repartition.session.CatalogRow;
import com.di.repartition.session.QuerySession;
import com.di.repartition.sql.SqlQueriesProperties;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Checks run against the new table once the migration scripts have loaded it.
 */
class PostMigrationChecks extends CheckSuite {

    PostMigrationChecks(SqlQueriesProperties.Verify sql, QuerySession session) {
        super(sql, session);
    }

    @Override
    List<CheckResult> run(TableMigrationPlan plan) {
        TargetConfiguration target = PreMigrationChecks.targetOf(plan);
        String newTable = plan.newTableName();

        List<CheckResult> results = new ArrayList<>();
        results.add(tableExists(plan.getOwner(), newTable));
        results.add(partitionType(plan.getOwner(), newTable, target));
        if (target.getPartitionType() == PartitionType.INTERVAL) {
            results.add(intervalDefinition(plan.getOwner(), newTable, target));
        }
        if (target.getSubpartitionType() != null && target.getSubpartitionType() != SubpartitionType.NONE) {
            results.add(subpartitionConfiguration(plan.getOwner(), newTable, target));
        }
        results.add(rowCountMatch(plan.getOwner(), plan.getTableName(), newTable));
        results.add(indexesCreated(plan.getOwner(), newTable));
        results.add(constraintsEnabled(plan.getOwner(), newTable));
        return results;
    }

    private CheckResult partitionType(String owner, String newTable, TargetConfiguration target) {
        String name = "Partition Type";
        PartitionType expected = target.getPartitionType() != null ? target.getPartitionType() : PartitionType.RANGE;
        try {
            CatalogRow row = firstRow(sql.getPartitionState(), tableParams(owner, newTable));
            if (row == null) {
                return CheckResult.fail(name, "Table is not partitioned");
            }
            PartitionType actual = PartitionType.fromCatalog(row.getString("partitioning_type"), row.getString("interval"));
            if (actual == expected) {
                return CheckResult.pass(name, "Partition type is " + actual + " as expected");
            }
            return CheckResult.fail(name, "Partition type is " + actual + ", expected " + expected,
                    details("actual", actual.name(), "expected", expected.name()));
        } catch (DataAccessException | IllegalArgumentException e) {
            return CheckResult.fail(name, "Error checking partition type: " + e.getMessage());
        }
    }

    /** HOUR and DAY intervals are day-to-second (NUMTODSINTERVAL); WEEK and MONTH are year-to-month. */
    private CheckResult intervalDefinition(String owner, String newTable, TargetConfiguration target) {
        String name = "Interval Definition";
        IntervalType intervalType = target.getIntervalType() != null ? target.getIntervalType() : IntervalType.MONTH;
        String expectedFunction = intervalType.getIntervalFunction();
        try {
            CatalogRow row = firstRow(sql.getPartitionState(), tableParams(owner, newTable));
            String interval = row == null ? null : row.getString("interval");
            if (isBlank(interval)) {
                return CheckResult.fail(name, "No interval definition found");
            }
            if (interval.toUpperCase(Locale.ROOT).contains(expectedFunction)) {
                return CheckResult.pass(name, "Interval definition contains " + expectedFunction + " as expected",
                        details("actual_interval", interval));
            }
            return CheckResult.warn(name, "Interval definition may not match: " + interval,
                    details("actual_interval", interval));
        } catch (DataAccessException e) {
            return CheckResult.fail(name, "Error checking interval: " + e.getMessage());
        }
    }

    private CheckResult subpartitionConfiguration(String owner, String newTable, TargetConfiguration target) {
        String name = "Subpartition Configuration";
        String expectedType = target.getSubpartitionType().name();
        try {
            CatalogRow row = firstRow(sql.getPartitionState(), tableParams(owner, newTable));
            if (row == null) {
                return CheckResult.warn(name, "Cannot determine subpartition config");
            }
            String actualType = row.getString("subpartitioning_type");
            Integer actualCount = row.getInteger("def_subpartition_count");

            List<String> issues = new ArrayList<>();
            if (!expectedType.equalsIgnoreCase(actualType)) {
                issues.add("type is " + actualType + ", expected " + expectedType);
            }
            if (target.hashSubpartitioned() && !Objects.equals(actualCount, target.getSubpartitionCount())) {
                issues.add("count is " + actualCount + ", expected " + target.getSubpartitionCount());
            }
            if (!issues.isEmpty()) {
                return CheckResult.fail(name, "Subpartition mismatch: " + String.join("; ", issues),
                        details("actual_type", actualType, "actual_count", actualCount));
            }
            return CheckResult.pass(name, "Subpartitioning: " + actualType + " with " + actualCount + " subpartitions");
        } catch (DataAccessException e) {
            return CheckResult.fail(name, "Error checking subpartitions: " + e.getMessage());
        }
    }

    private CheckResult rowCountMatch(String owner, String oldTable, String newTable) {
        String name = "Row Count Match";
        try {
            long oldCount = rowCount(owner, oldTable);
            long newCount = rowCount(owner, newTable);
            if (oldCount == newCount) {
                return CheckResult.pass(name, "Row counts match: " + grouped(oldCount) + " rows",
                        details("old_count", oldCount, "new_count", newCount));
            }
            long diff = Math.abs(oldCount - newCount);
            double diffPct = oldCount > 0 ? diff * 100.0 / oldCount : 0.0;
            return CheckResult.fail(name,
                    String.format(Locale.ROOT, "Row count mismatch: Old=%,d, New=%,d, Diff=%,d (%.2f%%)",
                            oldCount, newCount, diff, diffPct),
                    details("old_count", oldCount, "new_count", newCount, "difference", diff, "diff_percentage", diffPct));
        } catch (DataAccessException | IllegalArgumentException e) {
            return CheckResult.fail(name, "Error comparing row counts: " + e.getMessage());
        }
    }

    private CheckResult indexesCreated(String owner, String newTable) {
        String name = "Indexes Created";
        try {
            CatalogRow row = firstRow(sql.getIndexCount(), tableParams(owner, newTable));
            long indexes = row == null ? 0 : row.getLong("index_count", 0);
            if (indexes > 0) {
                return CheckResult.pass(name, "Created " + indexes + " index(es)");
            }
            return CheckResult.warn(name, "No indexes found on new table");
        } catch (DataAccessException e) {
            return CheckResult.warn(name, "Cannot check indexes: " + e.getMessage());
        }
    }

    private CheckResult constraintsEnabled(String owner, String newTable) {
        String name = "Constraints Enabled";
        try {
            List<CatalogRow> constraints = rows(sql.getConstraints(), tableParams(owner, newTable));
            if (constraints.isEmpty()) {
                return CheckResult.warn(name, "No constraints found");
            }
            long disabled = constraints.stream().filter(c -> !"ENABLED".equalsIgnoreCase(c.getString("status"))).count();
            if (disabled > 0) {
                return CheckResult.warn(name, "Found " + disabled + " disabled constraint(s)",
                        details("disabled_count", disabled));
            }
            return CheckResult.pass(name, "All " + constraints.size() + " constraint(s) enabled");
        } catch (DataAccessException e) {
            return CheckResult.warn(name, "Cannot check constraints: " + e.getMessage());
        }
    }
}
