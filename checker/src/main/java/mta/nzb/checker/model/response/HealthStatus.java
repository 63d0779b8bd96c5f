package mta.nzb.checker.model.response;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verdict of an NZB health check.
 */
public enum HealthStatus {

    HEALTHY("healthy"),
    MISSING_SEGMENTS("missing_segments");

    private final String value;

    HealthStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
