package mta.nzb.checker.service.nzb;

import io.github.resilience4j.retry.Retry;
import mta.nzb.checker.exception.HealthCheckCancelledException;
import mta.nzb.checker.exception.NzbFetchException;
import mta.nzb.checker.model.FetchedNzb;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.channels.ClosedByInterruptException;

/**
 * RestClientNzbFetcher
 * Downloads NZB documents over HTTP. Transport failures are retried through the
 * supplied Resilience4j Retry; any non-2xx status, including an unfollowed redirect, fails immediately.
 */
public class RestClientNzbFetcher implements NzbFetcher {

    private static final Logger logger = LoggerFactory.getLogger(RestClientNzbFetcher.class);

    private static final int MAX_ERROR_BODY_BYTES = 2048;

    private final RestClient restClient;
    private final Retry retry;

    public RestClientNzbFetcher(RestClient restClient, Retry retry) {
        this.restClient = restClient;
        this.retry = retry;
    }

    @Override
    public FetchedNzb fetch(String url, String title) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new NzbFetchException(url, "Invalid NZB download URL: " + url, e);
        }

        try {
            return retry.executeSupplier(() -> fetchOnce(uri, url, title));
        } catch (ResourceAccessException e) {
            if (isInterruption(e)) {
                throw HealthCheckCancelledException.interrupted(e);
            }
            throw new NzbFetchException(url, "Download NZB failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new NzbFetchException(url, "Download NZB failed: " + e.getMessage(), e);
        }
    }

    private FetchedNzb fetchOnce(URI uri, String url, String title) {
        if (Thread.currentThread().isInterrupted()) {
            throw HealthCheckCancelledException.interrupted(null);
        }

        ResponseEntity<byte[]> response = restClient.get()
                .uri(uri)
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), (request, errorResponse) -> {
                    byte[] body = errorResponse.getBody().readNBytes(MAX_ERROR_BODY_BYTES);
                    int status = errorResponse.getStatusCode().value();
                    throw new NzbFetchException(url, status,
                            "Download NZB failed: " + status + ": " + new String(body, StandardCharsets.UTF_8).trim(),
                            null);
                })
                .toEntity(byte[].class);

        byte[] content = response.getBody() == null ? new byte[0] : response.getBody();
        String fileName = NzbFileNames.derive(
                response.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION), url, title);

        logger.debug("Fetched NZB url={} bytes={} file={}", url, content.length, fileName);
        return new FetchedNzb(content, fileName);
    }

    private static boolean isInterruption(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ClosedByInterruptException
                    || (t instanceof InterruptedIOException && !(t instanceof SocketTimeoutException))) {
                return true;
            }
        }
        return Thread.currentThread().isInterrupted();
    }
}
