package com.di.repartition.plan.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class StorageParameters {
    String compression;
    String compressFor;
    Integer pctFree;
    Integer iniTrans;
    Integer maxTrans;
    Long initialExtent;
    Long nextExtent;
    String bufferPool;
}
