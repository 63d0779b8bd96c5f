package mta.nzb.checker.exception;

import lombok.Getter;

/**
 * NzbFetchException
 * Thrown when the NZB document cannot be downloaded: missing URL, transport failure
 * or a non-success HTTP status. The caller may retry with a different candidate.
 * Results in an HTTP 502 response.
 */
@Getter
public class NzbFetchException extends RuntimeException {

    private final String url;
    private final int httpStatus;

    public NzbFetchException(String url, String message) {
        this(url, 0, message, null);
    }

    public NzbFetchException(String url, String message, Throwable cause) {
        this(url, 0, message, cause);
    }

    public NzbFetchException(String url, int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.httpStatus = httpStatus;
    }
}
