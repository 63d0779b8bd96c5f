package mta.nzb.checker.service.health;

import lombok.Builder;

import java.time.Duration;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Tunables for a health check run. Built once from application properties;
 * tests build their own to pin the random source or shrink timeouts.
 *
 * @param sampleBudget  maximum segments probed per NZB, zero or less checks everything
 * @param checkTimeout  overall deadline for probing one NZB, zero or null for none
 * @param maxWorkers    cap on concurrent segment checks, zero or less derives it from provider budgets
 * @param poolEnabled   whether the shared connection pool is consulted before direct dials
 * @param randomSource  supplies the random source for each check
 */
@Builder(toBuilder = true)
public record HealthCheckOptions(
        int sampleBudget,
        Duration checkTimeout,
        int maxWorkers,
        boolean poolEnabled,
        Supplier<Random> randomSource
) {

    public static final int DEFAULT_SAMPLE_BUDGET = 3;
    public static final Duration DEFAULT_CHECK_TIMEOUT = Duration.ofSeconds(60);

    public HealthCheckOptions {
        if (checkTimeout == null || checkTimeout.isNegative()) {
            checkTimeout = Duration.ZERO;
        }
        if (randomSource == null) {
            randomSource = Random::new;
        }
    }

    public static HealthCheckOptions defaults() {
        return HealthCheckOptions.builder()
                .sampleBudget(DEFAULT_SAMPLE_BUDGET)
                .checkTimeout(DEFAULT_CHECK_TIMEOUT)
                .build();
    }

    public boolean hasDeadline() {
        return !checkTimeout.isZero();
    }
}
