package mta.nzb.checker.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import mta.nzb.checker.pool.UsenetPoolManager;
import mta.nzb.checker.service.health.HealthCheckOptions;
import mta.nzb.checker.service.nzb.NzbFetcher;
import mta.nzb.checker.service.nzb.RestClientNzbFetcher;
import mta.nzb.checker.service.probe.DirectDialProbe;
import mta.nzb.checker.service.probe.DirectDialProbeFactory;
import mta.nzb.checker.service.probe.NntpTimeouts;
import mta.nzb.checker.service.probe.PoolBackedProbe;
import mta.nzb.checker.service.probe.ProviderProbe;
import mta.nzb.checker.service.verify.SegmentVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import javax.net.ssl.SSLSocketFactory;
import java.time.Duration;
import java.util.Optional;

/**
 * Health Check Configuration
 * Wires the NZB fetcher, the probes and the segment verifier.
 * Values come from application.properties; the pool path stays off unless
 * usenet.health.pool-enabled is set and a UsenetPoolManager bean exists.
 */
@Configuration
public class HealthCheckConfig {

    private static final Logger logger = LoggerFactory.getLogger(HealthCheckConfig.class);

    @Value("${usenet.health.sample-budget:3}")
    private int sampleBudget;

    @Value("${usenet.health.check-timeout-ms:60000}")
    private long checkTimeoutMs;

    @Value("${usenet.health.max-workers:0}")
    private int maxWorkers;

    @Value("${usenet.health.pool-enabled:false}")
    private boolean poolEnabled;

    @Value("${usenet.health.nntp.connect-timeout-ms:10000}")
    private int nntpConnectTimeoutMs;

    @Value("${usenet.health.nntp.read-timeout-ms:15000}")
    private int nntpReadTimeoutMs;

    @Value("${usenet.fetch.timeout-ms:60000}")
    private int fetchTimeoutMs;

    @Value("${usenet.fetch.max-attempts:2}")
    private int fetchMaxAttempts;

    @Value("${usenet.fetch.user-agent:nzb-health-checker/0.0.1}")
    private String userAgent;

    @Bean
    public HealthCheckOptions healthCheckOptions() {
        return HealthCheckOptions.builder()
                .sampleBudget(sampleBudget)
                .checkTimeout(Duration.ofMillis(checkTimeoutMs))
                .maxWorkers(maxWorkers)
                .poolEnabled(poolEnabled)
                .build();
    }

    @Bean
    public NntpTimeouts nntpTimeouts() {
        return new NntpTimeouts(nntpConnectTimeoutMs, nntpReadTimeoutMs);
    }

    /**
     * Each probe dials its provider with that provider's own credentials.
     */
    @Bean
    public DirectDialProbeFactory directDialProbeFactory(NntpTimeouts nntpTimeouts) {
        SSLSocketFactory sslSocketFactory = (SSLSocketFactory) SSLSocketFactory.getDefault();
        return provider -> new DirectDialProbe(provider, nntpTimeouts, sslSocketFactory);
    }

    @Bean
    public SegmentVerifier segmentVerifier(HealthCheckOptions healthCheckOptions,
                                           DirectDialProbeFactory directDialProbeFactory,
                                           Optional<UsenetPoolManager> poolManager) {
        Optional<ProviderProbe> poolProbe = Optional.empty();
        if (healthCheckOptions.poolEnabled() && poolManager.isPresent()) {
            poolProbe = Optional.of(new PoolBackedProbe(poolManager.get()));
            logger.info("Segment checks consult the shared connection pool before dialing providers");
        } else if (healthCheckOptions.poolEnabled()) {
            logger.warn("usenet.health.pool-enabled is set but no UsenetPoolManager is available; dialing providers directly");
        }
        return new SegmentVerifier(poolProbe, directDialProbeFactory, healthCheckOptions);
    }

    /**
     * Retry for NZB downloads: transport failures only, exponential backoff from 500ms.
     */
    @Bean
    public Retry nzbFetchRetry(@Autowired(required = false) RetryRegistry retryRegistry) {
        // Use provided registry or create a default one if missing
        RetryRegistry registry = (retryRegistry != null) ? retryRegistry : RetryRegistry.ofDefaults();

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, fetchMaxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(500, 2.0, 5000))
                .retryExceptions(ResourceAccessException.class)
                .build();

        Retry retry = registry.retry("nzb-fetch", retryConfig);
        retry.getEventPublisher()
                .onRetry(event -> logger.warn(
                        "NZB download retry #{}: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "Unknown error"
                ));
        return retry;
    }

    @Bean
    public RestClient nzbRestClient() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(fetchTimeoutMs);
        requestFactory.setReadTimeout(fetchTimeoutMs);

        return RestClient.builder()
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .build();
    }

    @Bean
    public NzbFetcher nzbFetcher(RestClient nzbRestClient, Retry nzbFetchRetry) {
        return new RestClientNzbFetcher(nzbRestClient, nzbFetchRetry);
    }
}
