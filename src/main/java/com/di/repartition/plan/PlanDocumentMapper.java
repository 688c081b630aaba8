package com.di.repartition.plan;

import com.di.repartition.plan.model.MigrationPlanDocument;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes plan documents as snake_case JSON. Null fields are omitted, unknown fields are
 * ignored so hand-edited documents with extra notes still load.
 */
@Slf4j
@Component
public class PlanDocumentMapper {

    private static final ObjectMapper MAPPER = newObjectMapper();

    /** The mapper configuration shared with anything else that emits plan JSON. */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public MigrationPlanDocument read(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new PlanDocumentException("Plan document not found: " + path);
        }
        try {
            String json = Files.readString(path, StandardCharsets.UTF_8);
            MigrationPlanDocument document = fromJson(json);
            log.info("[PLAN] Loaded {} table(s) from {}", document.getTables().size(), path);
            return document;
        } catch (IOException e) {
            throw new PlanDocumentException("Cannot read plan document " + path + ": " + e.getMessage(), e);
        }
    }

    public void write(MigrationPlanDocument document, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, toJson(document), StandardCharsets.UTF_8);
            log.info("[PLAN] Wrote {} table(s) to {}", document.getTables().size(), path);
        } catch (IOException e) {
            throw new PlanDocumentException("Cannot write plan document " + path + ": " + e.getMessage(), e);
        }
    }

    public MigrationPlanDocument fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new PlanDocumentException("Plan document is empty");
        }
        try {
            MigrationPlanDocument document = MAPPER.readValue(json, MigrationPlanDocument.class);
            if (document == null) {
                throw new PlanDocumentException("Plan document is empty");
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new PlanDocumentException("Invalid plan document: " + e.getOriginalMessage(), e);
        }
    }

    public String toJson(MigrationPlanDocument document) {
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new PlanDocumentException("Cannot serialize plan document: " + e.getOriginalMessage(), e);
        }
    }
}
