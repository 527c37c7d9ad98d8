package com.versionrace.engine.scenario;

import com.versionrace.core.model.*;
import com.versionrace.engine.config.RaceProperties;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.assertj.core.api.Assertions.*;

/**
 * Scenario runs against a real PostgreSQL server.
 * Skipped when no Docker daemon is available.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class PostgresRaceScenarioTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("versionrace_test")
        .withUsername("test")
        .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", postgres::getDriverClassName);
    }

    @Autowired
    private RaceScenarioRunner runner;

    @Autowired
    private RaceProperties properties;

    @Test
    @DisplayName("Read committed scenario should detect exactly one conflict on PostgreSQL")
    void testReadCommittedScenario() {
        ScenarioReport report = runner.run(ScenarioRequest.withRandomKey(properties.toSettings()));

        assertThat(report.violations()).isEmpty();
        assertThat(report.conflictObserved()).isTrue();
        assertThat(report.race().conflictCount()).isEqualTo(1);
        assertThat(report.finalVersion()).isEqualTo(3);
    }

    @Test
    @DisplayName("Hold after rollback should give the same outcome on PostgreSQL")
    void testHoldAfterRollbackScenario() {
        RaceSettings settings = properties.toSettings().withHoldPlacement(HoldPlacement.AFTER_ROLLBACK);

        ScenarioReport report = runner.run(ScenarioRequest.withRandomKey(settings));

        assertThat(report.passed()).isTrue();
        assertThat(report.finalVersion()).isEqualTo(3);
    }

    @Test
    @DisplayName("Repeatable read should still advance the version only once on PostgreSQL")
    void testRepeatableReadScenario() {
        RaceSettings settings = properties.toSettings().withIsolationLevel(IsolationLevel.REPEATABLE_READ);

        ScenarioReport report = runner.run(ScenarioRequest.withRandomKey(settings));

        // The loser sees either a zero-row update or a serialization failure
        assertThat(report.finalVersion()).isEqualTo(3);
        assertThat(report.race().successCount()).isEqualTo(1);
        assertThat(report.race().committedAdvances()).isEqualTo(1);
    }
}
