package com.di.repartition.controller;

import com.di.repartition.config.RepartitionProperties;
import com.di.repartition.discovery.DiscoveryRequest;
import com.di.repartition.discovery.DiscoveryResult;
import com.di.repartition.discovery.SchemaDiscoveryService;
import com.di.repartition.plan.PlanDocumentMapper;
import com.di.repartition.plan.model.MigrationPlanDocument;
import com.di.repartition.session.QuerySession;
import com.di.repartition.session.QuerySessionFactory;
import com.di.repartition.validation.ConfigValidator;
import com.di.repartition.util.InputValidator;
import com.di.repartition.validation.ValidationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;

/**
 * Discovery and configuration validation over HTTP. {@code output} is a file name relative to
 * {@code repartition.discovery.output-directory}.
 * <ul>
 *   <li>{@code POST /api/plans/discover?schema=APP&include=ORDER*&exclude=*_TMP&environment=production&output=plan.json}</li>
 *   <li>{@code POST /api/plans/validate?checkDatabase=true} with a plan document body</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/api/plans")
@RequiredArgsConstructor
public class PlanController {

    private final SchemaDiscoveryService discoveryService;
    private final ConfigValidator configValidator;
    private final QuerySessionFactory sessionFactory;
    private final PlanDocumentMapper documentMapper;
    private final RepartitionProperties properties;

    @PostMapping(value = "/discover", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DiscoveryResult> discover(
            @RequestParam String schema,
            @RequestParam(required = false) List<String> include,
            @RequestParam(required = false) List<String> exclude,
            @RequestParam(required = false) String environment,
            @RequestParam(required = false) String output) {

        log.info("[CONTROLLER] POST /api/plans/discover schema={} include={} exclude={} environment={}",
                schema, include, exclude, environment);

        Path outputFile = output == null || output.isBlank()
                ? null
                : InputValidator.resolveWithin(properties.getDiscovery().getOutputDirectory(), output, "Output file");

        DiscoveryRequest request = DiscoveryRequest.builder()
                .schema(schema)
                .includePatterns(include == null ? List.of() : include)
                .excludePatterns(exclude == null ? List.of() : exclude)
                .environment(environment)
                .jdbcUrl(properties.getDatabase().getUrl())
                .user(properties.getDatabase().getUsername())
                .build();
        DiscoveryResult result = discoveryService.discover(request);

        if (outputFile != null) {
            documentMapper.write(result.document(), outputFile);
        }
        return ResponseEntity.ok(result);
    }

    /**
     * Validates the posted document. With {@code checkDatabase} the live tier runs on a pooled
     * session when a database is configured; without one it is skipped with a warning.
     */
    @PostMapping(value = "/validate", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ValidationOutcome> validate(
            @RequestBody MigrationPlanDocument document,
            @RequestParam(defaultValue = "false") boolean checkDatabase) {

        log.info("[CONTROLLER] POST /api/plans/validate checkDatabase={}", checkDatabase);

        if (!checkDatabase || !sessionFactory.isAvailable()) {
            return ResponseEntity.ok(configValidator.validate(document, checkDatabase));
        }
        try (QuerySession session = sessionFactory.open()) {
            return ResponseEntity.ok(configValidator.validate(document, true, session));
        }
    }
}
