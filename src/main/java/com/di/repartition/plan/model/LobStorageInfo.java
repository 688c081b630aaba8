package com.di.repartition.plan.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class LobStorageInfo {
    String columnName;
    String segmentName;
    /** Tablespace with any two-digit {@code _NN} suffix removed. */
    String tablespaceName;
    /** Tablespace exactly as the catalog reports it. */
    String originalTablespace;
    String securefile;
    String compression;
    String deduplication;
    String inRow;
    Long chunk;
    String cache;
}
