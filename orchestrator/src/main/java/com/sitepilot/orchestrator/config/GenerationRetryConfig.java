package com.sitepilot.orchestrator.config;

import com.sitepilot.orchestrator.generation.GenerationException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j retry for the code generation service.
 *
 * Only failures the service marks as transient are retried (rate limits,
 * overload, 5xx, transport errors); client errors and cancellations
 * propagate on the first attempt.
 */
@Configuration
public class GenerationRetryConfig {

    public static final String GENERATION = "generation";

    @Bean
    public RetryRegistry retryRegistry(OrchestratorProperties properties) {
        RetryRegistry registry = RetryRegistry.of(retryConfig(properties.getGeneration()));
        registry.retry(GENERATION);
        return registry;
    }

    @Bean
    public Retry generationRetry(RetryRegistry registry) {
        return registry.retry(GENERATION);
    }

    public static RetryConfig retryConfig(OrchestratorProperties.Generation cfg) {
        return RetryConfig.custom()
                .maxAttempts(cfg.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        cfg.getInitialBackoff(), cfg.getBackoffMultiplier()))
                .retryOnException(e -> e instanceof GenerationException ge && ge.isRetryable())
                .build();
    }
}
