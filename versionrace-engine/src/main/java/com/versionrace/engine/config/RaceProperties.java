package com.versionrace.engine.config;

import com.versionrace.core.model.HoldPlacement;
import com.versionrace.core.model.IsolationLevel;
import com.versionrace.core.model.RaceSettings;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for races and store calls.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code versionrace.race} prefix.
 * </p>
 */
@ConfigurationProperties(prefix = "versionrace.race")
@Validated
public class RaceProperties {

    /**
     * Isolation level for store calls and races unless a request overrides it.
     */
    @NotNull
    private IsolationLevel isolationLevel = IsolationLevel.READ_COMMITTED;

    /**
     * Minimum time each writer keeps the rendezvous gate.
     */
    @DurationUnit(ChronoUnit.MILLIS)
    private Duration holdDuration = RaceSettings.DEFAULT_HOLD;

    /**
     * Whether writers hold inside their first transaction or after releasing it.
     */
    @NotNull
    private HoldPlacement holdPlacement = HoldPlacement.INSIDE_TRANSACTION;

    /**
     * Time limit for one race, covering both writers.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration timeout = RaceSettings.DEFAULT_TIMEOUT;

    /**
     * Time limit for a single store call, from the REST API or a scenario step.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration operationTimeout = Duration.ofSeconds(10);

    /**
     * Threads available to racing writers. A race needs two at once.
     */
    @Min(2)
    private int writerThreads = 4;

    /**
     * Race settings built from these properties.
     */
    public RaceSettings toSettings() {
        return new RaceSettings(isolationLevel, holdDuration, holdPlacement, timeout);
    }

    public IsolationLevel getIsolationLevel() {
        return isolationLevel;
    }

    public void setIsolationLevel(IsolationLevel isolationLevel) {
        this.isolationLevel = isolationLevel;
    }

    public Duration getHoldDuration() {
        return holdDuration;
    }

    public void setHoldDuration(Duration holdDuration) {
        this.holdDuration = holdDuration;
    }

    public HoldPlacement getHoldPlacement() {
        return holdPlacement;
    }

    public void setHoldPlacement(HoldPlacement holdPlacement) {
        this.holdPlacement = holdPlacement;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getOperationTimeout() {
        return operationTimeout;
    }

    public void setOperationTimeout(Duration operationTimeout) {
        this.operationTimeout = operationTimeout;
    }

    public int getWriterThreads() {
        return writerThreads;
    }

    public void setWriterThreads(int writerThreads) {
        this.writerThreads = writerThreads;
    }
}
