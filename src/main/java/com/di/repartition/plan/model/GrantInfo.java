package com.di.repartition.plan.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** An object privilege on the table, re-granted on the new table after the swap. */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GrantInfo {
    String grantee;
    String privilege;
    String grantable;
    String grantor;
    @Builder.Default
    String grantType = "OBJECT";
}
