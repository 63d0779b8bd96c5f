package mta.nzb.checker.service.nzb;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import mta.nzb.checker.exception.NzbFetchException;
import mta.nzb.checker.model.FetchedNzb;
import mta.nzb.checker.support.NzbFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestClientNzbFetcherTest {

    private static final String URL = "https://indexer.example/getnzb/123";

    private MockRestServiceServer server;
    private RestClientNzbFetcher fetcher;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();

        Retry retry = Retry.of("nzb-fetch-test", RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(ResourceAccessException.class)
                .build());

        fetcher = new RestClientNzbFetcher(builder.build(), retry);
    }

    @Test
    void fetch_Success_ShouldReturnBodyAndHeaderFileName() {
        byte[] nzb = NzbFixtures.singleFile("Movie", 2);
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"Movie.2024.nzb\"");

        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(nzb, MediaType.APPLICATION_XML).headers(headers));

        FetchedNzb fetched = fetcher.fetch(URL, "Movie 2024");

        assertArrayEquals(nzb, fetched.content());
        assertEquals("Movie.2024.nzb", fetched.fileName());
        server.verify();
    }

    @Test
    void fetch_NoContentDisposition_ShouldNameFromUrl() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess(NzbFixtures.singleFile("Movie", 1), MediaType.APPLICATION_XML));

        FetchedNzb fetched = fetcher.fetch(URL, "Movie");

        assertEquals("123.nzb", fetched.fileName());
    }

    @Test
    void fetch_NotFound_ShouldThrowWithStatusAndNotRetry() {
        server.expect(ExpectedCount.once(), requestTo(URL))
                .andRespond(withStatus(HttpStatus.NOT_FOUND).body("no such release"));

        NzbFetchException ex = assertThrows(NzbFetchException.class, () -> fetcher.fetch(URL, "Movie"));

        assertEquals(404, ex.getHttpStatus());
        assertEquals(URL, ex.getUrl());
        assertTrue(ex.getMessage().contains("404"));
        assertTrue(ex.getMessage().contains("no such release"));
        server.verify();
    }

    @Test
    void fetch_UnfollowedRedirect_ShouldThrowWithStatus() {
        server.expect(ExpectedCount.once(), requestTo(URL))
                .andRespond(withStatus(HttpStatus.MOVED_PERMANENTLY)
                        .location(URI.create("https://mirror.example/getnzb/123")));

        NzbFetchException ex = assertThrows(NzbFetchException.class, () -> fetcher.fetch(URL, "Movie"));

        assertEquals(301, ex.getHttpStatus());
        assertTrue(ex.getMessage().contains("301"));
        server.verify();
    }

    @Test
    void fetch_TransportFailure_ShouldRetryThenThrow() {
        server.expect(ExpectedCount.times(2), requestTo(URL))
                .andRespond(withException(new IOException("connection reset")));

        NzbFetchException ex = assertThrows(NzbFetchException.class, () -> fetcher.fetch(URL, "Movie"));

        assertEquals(0, ex.getHttpStatus());
        assertInstanceOf(ResourceAccessException.class, ex.getCause());
        server.verify();
    }

    @Test
    void fetch_InvalidUrl_ShouldThrowFetchException() {
        assertThrows(NzbFetchException.class, () -> fetcher.fetch("http://bad host/x.nzb", "Movie"));
    }
}
