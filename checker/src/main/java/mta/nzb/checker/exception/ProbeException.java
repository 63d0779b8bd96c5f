package mta.nzb.checker.exception;

import lombok.Getter;

/**
 * ProbeException
 * A single availability probe could not reach a verdict (timeout, connection failure,
 * unexpected server status). Absorbed by the provider fallback chain, never surfaced.
 */
@Getter
public class ProbeException extends Exception {

    private final String messageId;

    public ProbeException(String messageId, String message) {
        super(message);
        this.messageId = messageId;
    }

    public ProbeException(String messageId, String message, Throwable cause) {
        super(message, cause);
        this.messageId = messageId;
    }
}
