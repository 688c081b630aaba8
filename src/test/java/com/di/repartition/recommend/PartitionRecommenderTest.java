package com.di.repartition.recommend;

import com.di.repartition.plan.model.AvailableColumns;
import com.di.repartition.plan.model.IntervalType;
import com.di.repartition.plan.model.MigrationAction;
import com.di.repartition.plan.model.PartitionType;
import com.di.repartition.plan.model.Priority;
import com.di.repartition.plan.model.SubpartitionType;
import com.di.repartition.plan.model.TableProfile;
import com.di.repartition.plan.model.TargetConfiguration;
import com.di.repartition.support.PlanFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PartitionRecommender Tests")
class PartitionRecommenderTest {

    private static AvailableColumns columns() {
        return AvailableColumns.builder()
                .timestampColumns(List.of(PlanFixtures.column("CREATED_DATE", "DATE"), PlanFixtures.column("UPDATE_DATE", "DATE")))
                .numericColumns(List.of(PlanFixtures.column("ORDER_ID", "NUMBER")))
                .stringColumns(List.of(PlanFixtures.column("STATUS_CODE", "VARCHAR2(10)")))
                .build();
    }

    private static TableProfile.TableProfileBuilder heap(double sizeGb, long rows) {
        return TableProfile.builder()
                .isPartitioned(false)
                .partitionType(PartitionType.NONE)
                .sizeGb(sizeGb)
                .rowCount(rows)
                .indexCount(3)
                .availableColumns(columns());
    }

    // ============================================================================
    // Whole-table recommendation
    // ============================================================================

    @Test
    @DisplayName("Should recommend a daily interval with 16 hash subpartitions for a 120 GB heap table")
    void testRecommend_LargeHeapTable() {
        Recommendation rec = PartitionRecommender.recommend(heap(120, 50_000_000L).build(), PlanFixtures.environment());

        TargetConfiguration target = rec.target();
        assertEquals(PartitionType.INTERVAL, target.getPartitionType());
        assertEquals("CREATED_DATE", target.getPartitionColumn());
        assertEquals(IntervalType.DAY, target.getIntervalType());
        assertEquals(1, target.getIntervalValue());
        assertEquals(SubpartitionType.HASH, target.getSubpartitionType());
        assertEquals("ORDER_ID", target.getSubpartitionColumn());
        assertEquals(16, target.getSubpartitionCount());
        assertEquals(8, target.getParallelDegree());
        assertEquals("USERS", target.getTablespace());
        assertEquals(List.of("GD_LOB_01", "GD_LOB_02", "GD_LOB_03", "GD_LOB_04"), target.getLobTablespaces());
        assertEquals(TargetConfiguration.DEFAULT_INITIAL_PARTITION_VALUE, target.getInitialPartitionValue());

        assertEquals(Priority.HIGH, rec.settings().getPriority());
        assertEquals(17.3, rec.settings().getEstimatedHours(), 0.0001);
        assertEquals(MigrationAction.ADD_INTERVAL_HASH_PARTITIONING, rec.action());
        assertTrue(rec.enabled());
    }

    @Test
    @DisplayName("Should keep the current partition key and disable a table that is already interval-hash")
    void testRecommend_AlreadyIntervalHash() {
        TableProfile profile = heap(20, 1_000_000L)
                .isPartitioned(true)
                .partitionType(PartitionType.INTERVAL)
                .isInterval(true)
                .intervalDefinition("NUMTOYMINTERVAL(1,'MONTH')")
                .currentPartitionKey("UPDATE_DATE, REGION_ID")
                .hasSubpartitions(true)
                .subpartitionType("HASH")
                .subpartitionCount(8)
                .build();

        Recommendation rec = PartitionRecommender.recommend(profile, PlanFixtures.environment());

        assertEquals("UPDATE_DATE", rec.target().getPartitionColumn());
        assertEquals(MigrationAction.CONVERT_INTERVAL_TO_INTERVAL_HASH, rec.action());
        assertFalse(rec.enabled());
    }

    @Test
    @DisplayName("Should fall back to NONE subpartitioning when no hash key exists")
    void testRecommend_NoHashCandidate() {
        TableProfile profile = heap(2, 1000)
                .availableColumns(AvailableColumns.builder()
                        .timestampColumns(List.of(PlanFixtures.column("CREATED_DATE", "DATE")))
                        .build())
                .build();

        Recommendation rec = PartitionRecommender.recommend(profile, null);

        assertEquals(SubpartitionType.NONE, rec.target().getSubpartitionType());
        assertNull(rec.target().getSubpartitionColumn());
        assertNull(rec.target().getTablespace());
        assertTrue(rec.target().getLobTablespaces().isEmpty());
        assertFalse(rec.enabled());
    }

    // ============================================================================
    // Individual rules
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
            "150, 16", "100.01, 16", "100, 12", "60, 12", "50, 8", "11, 8", "10, 4", "1.5, 4", "1, 2", "0, 2"
    })
    @DisplayName("Should size hash subpartitions by strict size thresholds")
    void testHashSubpartitionCount(double sizeGb, int expected) {
        assertEquals(expected, PartitionRecommender.hashSubpartitionCount(sizeGb));
    }

    @ParameterizedTest
    @CsvSource({
            "150, 8", "100, 6", "51, 6", "50, 4", "10.5, 4", "10, 2", "0.2, 2"
    })
    @DisplayName("Should pick parallel degree by size")
    void testParallelDegree(double sizeGb, int expected) {
        assertEquals(expected, PartitionRecommender.parallelDegree(sizeGb));
    }

    @ParameterizedTest
    @CsvSource({
            "400000000, 10,  HOUR",
            "365000001, 10,  HOUR",
            "365000000, 10,  DAY",
            "50000000,  10,  DAY",
            "36500000,  10,  MONTH",
            "1000,      500, MONTH",
            "0,         101, DAY",
            "0,         100, MONTH"
    })
    @DisplayName("Should derive interval granularity from the daily row rate, or from size without statistics")
    void testIntervalType(long rows, double sizeGb, IntervalType expected) {
        assertEquals(expected, PartitionRecommender.intervalType(rows, sizeGb));
    }

    @ParameterizedTest
    @CsvSource({
            "0,    0, 0.1",
            "0.4,  0, 0.1",
            "8,    0, 1.0",
            "16,   2, 3.5",
            "5,    1, 1.4"
    })
    @DisplayName("Should estimate hours from size and index count")
    void testEstimatedHours(double sizeGb, int indexes, double expected) {
        assertEquals(expected, PartitionRecommender.estimatedHours(sizeGb, indexes), 0.0001);
    }

    @ParameterizedTest
    @CsvSource({
            "51, 0, HIGH", "50, 0, MEDIUM", "11, 0, MEDIUM", "2, 1, MEDIUM", "10, 0, LOW"
    })
    @DisplayName("Should rank priority by size and LOB presence")
    void testPriority(double sizeGb, int lobs, Priority expected) {
        assertEquals(expected, PartitionRecommender.priority(sizeGb, lobs));
    }

    @ParameterizedTest
    @CsvSource({
            "false, false, false, ADD_INTERVAL_HASH_PARTITIONING",
            "true,  true,  false, ADD_HASH_SUBPARTITIONS",
            "true,  true,  true,  CONVERT_INTERVAL_TO_INTERVAL_HASH",
            "true,  false, true,  CONVERT_TO_INTERVAL_HASH",
            "true,  false, false, CONVERT_TO_INTERVAL_HASH"
    })
    @DisplayName("Should choose the migration action from the current layout")
    void testMigrationAction(boolean partitioned, boolean interval, boolean subpartitioned, MigrationAction expected) {
        assertEquals(expected, PartitionRecommender.migrationAction(partitioned, interval, subpartitioned));
    }

    @Test
    @DisplayName("Should enable only tables with both key candidates that are not yet interval-hash")
    void testShouldEnable() {
        assertTrue(PartitionRecommender.shouldEnable(columns(), false, false));
        assertTrue(PartitionRecommender.shouldEnable(columns(), true, false));
        assertFalse(PartitionRecommender.shouldEnable(columns(), true, true));
        assertFalse(PartitionRecommender.shouldEnable(null, false, false));
        assertFalse(PartitionRecommender.shouldEnable(
                AvailableColumns.builder().numericColumns(List.of(PlanFixtures.column("ID", "NUMBER"))).build(), false, false));
    }
}
