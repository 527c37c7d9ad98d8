package com.versionrace.api.rest;

import com.versionrace.core.model.Deadline;
import com.versionrace.core.model.IsolationLevel;
import com.versionrace.core.model.VersionedEntity;
import com.versionrace.core.repository.EntityStore;
import com.versionrace.engine.config.RaceProperties;
import com.versionrace.engine.logging.LoggingContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API for single-row store operations.
 * Every call runs in its own transaction at the configured isolation level.
 */
@RestController
@RequestMapping("/api/v1/entities")
public class EntityController {

    private final EntityStore entityStore;
    private final RaceProperties properties;

    public EntityController(EntityStore entityStore, RaceProperties properties) {
        this.entityStore = entityStore;
        this.properties = properties;
    }

    /**
     * Create an entity at version 1. A key is generated when none is given.
     */
    @PostMapping
    public ResponseEntity<EntityResponse> create(@RequestBody(required = false) CreateEntityRequest request) {
        UUID key = request != null && request.key() != null ? request.key() : UUID.randomUUID();
        try (LoggingContext ctx = LoggingContext.forEntity(key, isolation())) {
            VersionedEntity entity = entityStore.create(key, isolation(), deadline());
            return ResponseEntity.status(HttpStatus.CREATED).body(EntityResponse.from(entity));
        }
    }

    @GetMapping("/{key}")
    public ResponseEntity<EntityResponse> read(@PathVariable UUID key) {
        try (LoggingContext ctx = LoggingContext.forEntity(key, isolation())) {
            return ResponseEntity.ok(EntityResponse.from(entityStore.read(key, isolation(), deadline())));
        }
    }

    /**
     * Conditionally advance the version. Zero affected rows is a normal answer, not an error.
     */
    @PostMapping("/{key}/advance")
    public ResponseEntity<AffectedRowsResponse> advance(
            @PathVariable UUID key,
            @RequestBody AdvanceRequest request) {

        try (LoggingContext ctx = LoggingContext.forEntity(key, isolation())) {
            int rows = entityStore.advance(key, request.expectedVersion(), isolation(), deadline());
            return ResponseEntity.ok(new AffectedRowsResponse(rows));
        }
    }

    @DeleteMapping("/{key}")
    public ResponseEntity<AffectedRowsResponse> delete(@PathVariable UUID key) {
        try (LoggingContext ctx = LoggingContext.forEntity(key, isolation())) {
            return ResponseEntity.ok(new AffectedRowsResponse(entityStore.delete(key, isolation(), deadline())));
        }
    }

    private IsolationLevel isolation() {
        return properties.getIsolationLevel();
    }

    private Deadline deadline() {
        return Deadline.after(properties.getOperationTimeout());
    }

    // ========== DTOs ==========

    public record CreateEntityRequest(UUID key) {}

    public record AdvanceRequest(long expectedVersion) {}

    public record AffectedRowsResponse(int affectedRows) {}

    public record EntityResponse(UUID key, long version) {
        public static EntityResponse from(VersionedEntity entity) {
            return new EntityResponse(entity.key(), entity.version());
        }
    }
}
