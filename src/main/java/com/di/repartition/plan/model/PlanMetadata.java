package com.di.repartition.plan.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Discovery run metadata. The table counts are informational: hand-pruned documents are expected
 * to disagree with them.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PlanMetadata {

    /** {@code yyyy-MM-dd HH:mm:ss}, local time of the discovery run. */
    @NotBlank
    String generatedDate;

    @NotBlank
    String sourceSchema;

    String environment;
    String sourceDatabaseService;

    @Valid
    ConnectionDetails sourceConnectionDetails;

    String discoveryCriteria;

    @PositiveOrZero
    Integer totalTablesFound;

    @PositiveOrZero
    Integer tablesSelectedForMigration;

    /** Legacy alias of {@link #sourceSchema}. */
    String schema;

    /** MD5 provenance hash written by discovery; see {@code ProvenanceVerifier}. */
    String discoveryValidationHash;

    /** Source schema, falling back to the legacy {@code schema} field. */
    public String effectiveSchema() {
        return sourceSchema != null && !sourceSchema.isBlank() ? sourceSchema : schema;
    }
}
