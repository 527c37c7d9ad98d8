package com.versionrace.engine.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Engine wiring.
 * 
 * Configures:
 * - Race properties binding
 * - The writer thread pool, shut down with the context
 */
@Configuration
@EnableConfigurationProperties(RaceProperties.class)
public class EngineConfiguration {

    public static final String WRITER_EXECUTOR = "raceWriterExecutor";

    @Bean(name = WRITER_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService raceWriterExecutor(RaceProperties properties) {
        AtomicInteger threadCount = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getWriterThreads(), runnable -> {
            Thread thread = new Thread(runnable, "race-writer-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
