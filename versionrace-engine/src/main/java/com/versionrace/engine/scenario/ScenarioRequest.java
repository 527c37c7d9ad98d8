package com.versionrace.engine.scenario;

import com.versionrace.core.model.RaceSettings;

import java.util.Objects;
import java.util.UUID;

/**
 * Input of one end-to-end scenario run.
 * 
 * @param key Entity key to use; a random key is generated when null
 * @param settings Isolation level, hold and overall timeout
 */
public record ScenarioRequest(UUID key, RaceSettings settings) {

    public ScenarioRequest {
        Objects.requireNonNull(settings, "settings");
    }

    public static ScenarioRequest withRandomKey(RaceSettings settings) {
        return new ScenarioRequest(null, settings);
    }
}
