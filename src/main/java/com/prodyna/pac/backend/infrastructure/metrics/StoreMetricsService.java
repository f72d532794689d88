package com.prodyna.pac.backend.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for the entity stores, scraped from the Prometheus endpoint.
 *
 * Key Metrics:
 * - pac.store.operation: latency of every store operation, tagged by entity,
 *   operation and outcome (success or the error kind)
 * - pac.store.validation.violations: number of field violations rejected per entity
 *
 * @author PAC Team
 */
@Service
public class StoreMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(StoreMetricsService.class);

    private static final String METRIC_PREFIX = "pac.store.";

    public static final String OUTCOME_SUCCESS = "success";

    private final MeterRegistry meterRegistry;

    public StoreMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record one store operation.
     *
     * @param entity Entity type (e.g., "Talk")
     * @param operation Store operation (e.g., "create", "findById")
     * @param outcome "success" or the error kind of the failure
     * @param durationMs Duration in milliseconds
     */
    public void recordOperation(String entity, String operation, String outcome, long durationMs) {
        Timer.builder(METRIC_PREFIX + "operation")
                .tag("entity", entity)
                .tag("operation", operation)
                .tag("outcome", outcome)
                .description("Entity store operations")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        logger.trace("Recorded {} {} with outcome {} in {}ms", entity, operation, outcome, durationMs);
    }

    /**
     * Record the field violations of a rejected create or update.
     *
     * @param entity Entity type
     * @param violationCount Number of violated constraints
     */
    public void recordValidationFailure(String entity, int violationCount) {
        Counter.builder(METRIC_PREFIX + "validation.violations")
                .tag("entity", entity)
                .description("Field violations of rejected entities")
                .register(meterRegistry)
                .increment(violationCount);
    }
}
