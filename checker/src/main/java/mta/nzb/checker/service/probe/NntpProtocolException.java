package mta.nzb.checker.service.probe;

import lombok.Getter;

import java.io.IOException;

/**
 * A provider answered with a status the current exchange does not allow
 * (refused greeting, rejected credentials, malformed reply).
 */
@Getter
public class NntpProtocolException extends IOException {

    private final int statusCode;

    public NntpProtocolException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }
}
