package com.di.repartition.plan;

import com.di.repartition.plan.model.MigrationPlanDocument;
import com.di.repartition.plan.model.PlanMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Provenance hash proving a plan document came out of a discovery run:
 * MD5 hex of {@code DISCOVERY_<generated_date>_<source_schema>_<source_database_service>}.
 */
@Slf4j
public final class ProvenanceVerifier {

    private ProvenanceVerifier() {}

    public static String compute(String generatedDate, String sourceSchema, String sourceDatabaseService) {
        String seed = "DISCOVERY_" + generatedDate + "_" + sourceSchema + "_" + sourceDatabaseService;
        return DigestUtils.md5DigestAsHex(seed.getBytes(StandardCharsets.UTF_8));
    }

    public static String compute(PlanMetadata metadata) {
        return compute(metadata.getGeneratedDate(), metadata.getSourceSchema(), metadata.getSourceDatabaseService());
    }

    /** False when the hash is absent or does not match the metadata it claims to cover. */
    public static boolean isDiscoveryGenerated(MigrationPlanDocument document) {
        if (document == null || document.getMetadata() == null) {
            return false;
        }
        PlanMetadata metadata = document.getMetadata();
        String hash = metadata.getDiscoveryValidationHash();
        if (hash == null || hash.isBlank()) {
            return false;
        }
        return hash.equalsIgnoreCase(compute(metadata));
    }

    /**
     * Gate for downstream tooling. With {@code allowOverride} the check only logs.
     *
     * @throws ProvenanceException when the document is not discovery-generated and no override is given
     */
    public static void requireDiscoveryGenerated(MigrationPlanDocument document, boolean allowOverride) {
        if (isDiscoveryGenerated(document)) {
            return;
        }
        if (allowOverride) {
            log.warn("[PLAN] Plan document is not discovery-generated; continuing because the provenance check was overridden");
            return;
        }
        throw new ProvenanceException("Plan document was not generated by schema discovery "
                + "(discovery_validation_hash missing or does not match its metadata). "
                + "Re-run discovery or explicitly override the provenance check.");
    }
}
