package mta.nzb.checker.exception;

/**
 * NzbParseException
 * Thrown when an NZB payload is not well-formed XML or lists no files or segments.
 * The candidate should be discarded. Results in an HTTP 422 response.
 */
public class NzbParseException extends RuntimeException {

    public NzbParseException(String message) {
        super(message);
    }

    public NzbParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
