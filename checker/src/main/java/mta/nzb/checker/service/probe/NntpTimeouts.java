package mta.nzb.checker.service.probe;

/**
 * Socket timeouts for direct provider connections, in milliseconds.
 */
public record NntpTimeouts(int connectTimeoutMs, int readTimeoutMs) {

    public NntpTimeouts {
        if (connectTimeoutMs <= 0 || readTimeoutMs <= 0) {
            throw new IllegalArgumentException("NNTP timeouts must be positive");
        }
    }
}
