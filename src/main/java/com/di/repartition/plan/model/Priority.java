package com.di.repartition.plan.model;

public enum Priority {
    HIGH,
    MEDIUM,
    LOW
}
