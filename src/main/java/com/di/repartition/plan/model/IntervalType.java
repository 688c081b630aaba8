package com.di.repartition.plan.model;

/**
 * Interval granularity for INTERVAL partitioning.
 */
public enum IntervalType {
    HOUR("NUMTODSINTERVAL"),
    DAY("NUMTODSINTERVAL"),
    WEEK("NUMTOYMINTERVAL"),
    MONTH("NUMTOYMINTERVAL");

    private final String intervalFunction;

    IntervalType(String intervalFunction) {
        this.intervalFunction = intervalFunction;
    }

    /** Oracle date-arithmetic function family the interval clause is expressed with. */
    public String getIntervalFunction() {
        return intervalFunction;
    }
}
