package mta.nzb.checker.model.response;

import java.util.List;

/**
 * HealthCheckResult - Outcome of checking one NZB candidate.
 * healthy is true exactly when missingSegments is empty.
 */
public record HealthCheckResult(
    boolean healthy,
    HealthStatus status,
    int totalSegments,
    int checkedSegments,
    List<String> missingSegments,
    boolean sampled,
    String fileName
) {

    public HealthCheckResult {
        missingSegments = missingSegments == null ? List.of() : List.copyOf(missingSegments);
    }

    public static HealthCheckResult of(int totalSegments, int checkedSegments, List<String> missing,
                                       boolean sampled, String fileName) {
        boolean healthy = missing == null || missing.isEmpty();
        return new HealthCheckResult(
                healthy,
                healthy ? HealthStatus.HEALTHY : HealthStatus.MISSING_SEGMENTS,
                totalSegments,
                checkedSegments,
                missing,
                sampled,
                fileName
        );
    }
}
