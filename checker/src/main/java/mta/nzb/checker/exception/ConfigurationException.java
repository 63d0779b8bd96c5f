package mta.nzb.checker.exception;

import lombok.Getter;

/**
 * ConfigurationException
 * Thrown when no usable Usenet provider is configured.
 * Fatal for the request and never retried. Results in an HTTP 503 response.
 */
@Getter
public class ConfigurationException extends RuntimeException {

    private final String type;

    public ConfigurationException(String message) {
        super(message);
        this.type = "NO_PROVIDERS";
    }
}
