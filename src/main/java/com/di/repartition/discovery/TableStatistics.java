package com.di.repartition.discovery;

/** Optimizer statistics for one table; zeros when the table was never analyzed. */
public record TableStatistics(long rowCount, long avgRowLength, long blocks, String tablespaceName) {

    public static final TableStatistics EMPTY = new TableStatistics(0, 0, 0, null);
}
