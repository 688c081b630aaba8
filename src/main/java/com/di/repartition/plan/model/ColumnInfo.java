package com.di.repartition.plan.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * One column as read from {@code all_tab_columns}, with identity metadata merged in when the
 * column is an identity column.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ColumnInfo {

    @NotBlank
    String name;

    /** Oracle data type, e.g. {@code NUMBER}, {@code DATE}, {@code VARCHAR2(30)}. */
    @NotBlank
    String type;

    /** {@code Y} or {@code N}. */
    String nullable;

    Integer length;
    Integer precision;
    Integer scale;

    @JsonProperty("default")
    String defaultValue;

    Integer charLength;

    Boolean isIdentity;
    String identityGeneration;
    String identitySequence;
    Long identityStartWith;
    Long identityIncrementBy;
    BigDecimal identityMaxValue;
    BigDecimal identityMinValue;
    Long identityCacheSize;
    String identityCycleFlag;
    String identityOrderFlag;

    public boolean allowsNulls() {
        return "Y".equalsIgnoreCase(nullable) || "YES".equalsIgnoreCase(nullable);
    }
}
