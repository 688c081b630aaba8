package com.di.repartition.verify;

/** Check suites a migration validation run can execute. */
public enum Phase {
    PRE,
    POST,
    DATA
}
