package com.versionrace.api.rest;

import com.versionrace.core.model.*;
import com.versionrace.engine.config.RaceProperties;
import com.versionrace.engine.scenario.RaceScenarioRunner;
import com.versionrace.engine.scenario.ScenarioReport;
import com.versionrace.engine.scenario.ScenarioRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * REST API for running the end-to-end race scenario on demand.
 */
@RestController
@RequestMapping("/api/v1/scenarios")
public class ScenarioController {

    private final RaceScenarioRunner runner;
    private final RaceProperties properties;

    public ScenarioController(RaceScenarioRunner runner, RaceProperties properties) {
        this.runner = runner;
        this.properties = properties;
    }

    /**
     * Run the scenario. Omitted fields fall back to the configured defaults.
     */
    @PostMapping("/race")
    public ResponseEntity<ScenarioResponse> runRace(@RequestBody(required = false) RaceScenarioRequest request) {
        RaceSettings settings = properties.toSettings();
        UUID key = null;
        if (request != null) {
            settings = request.applyTo(settings);
            key = request.key();
        }
        ScenarioReport report = runner.run(new ScenarioRequest(key, settings));
        return ResponseEntity.ok(ScenarioResponse.from(report));
    }

    // ========== DTOs ==========

    public record RaceScenarioRequest(
        UUID key,
        IsolationLevel isolationLevel,
        Long holdMillis,
        HoldPlacement holdPlacement,
        Long timeoutMillis
    ) {
        RaceSettings applyTo(RaceSettings defaults) {
            RaceSettings settings = defaults;
            if (isolationLevel != null) {
                settings = settings.withIsolationLevel(isolationLevel);
            }
            if (holdMillis != null) {
                settings = settings.withHoldDuration(Duration.ofMillis(holdMillis));
            }
            if (holdPlacement != null) {
                settings = settings.withHoldPlacement(holdPlacement);
            }
            if (timeoutMillis != null) {
                settings = settings.withTimeout(Duration.ofMillis(timeoutMillis));
            }
            return settings;
        }
    }

    public record WriterResponse(
        String writer,
        WriterStatus status,
        Long firstCount,
        Long secondCount,
        String errorCode,
        String errorMessage
    ) {
        public static WriterResponse from(WriterResult result) {
            RaceOutcome outcome = result.outcome();
            return new WriterResponse(
                result.writerName(),
                result.status(),
                result.firstCount(),
                outcome != null ? outcome.secondCount() : null,
                result.error() != null ? result.error().getErrorCode() : null,
                result.error() != null ? result.error().getMessage() : null
            );
        }
    }

    public record ScenarioResponse(
        UUID key,
        IsolationLevel isolationLevel,
        boolean passed,
        boolean conflictObserved,
        long finalVersion,
        List<WriterResponse> writers,
        List<String> violations
    ) {
        public static ScenarioResponse from(ScenarioReport report) {
            return new ScenarioResponse(
                report.key(),
                report.isolationLevel(),
                report.passed(),
                report.conflictObserved(),
                report.finalVersion(),
                report.race().writers().stream().map(WriterResponse::from).toList(),
                report.violations()
            );
        }
    }
}
