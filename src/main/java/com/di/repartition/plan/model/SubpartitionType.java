package com.di.repartition.plan.model;

public enum SubpartitionType {
    HASH,
    NONE
}
