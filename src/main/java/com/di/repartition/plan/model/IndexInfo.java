package com.di.repartition.plan.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class IndexInfo {
    String indexName;
    String indexType;
    /** Comma-separated key columns in position order. */
    String columns;
    String uniqueness;
    String tablespaceName;
    String compression;
    Integer pctFree;
    Integer iniTrans;
    Integer maxTrans;
    String degree;
    /** {@code YES} or {@code NO}. */
    String partitioned;
    Boolean isReverse;
    /** LOCAL or GLOBAL; only set for partitioned indexes. */
    String locality;
}
