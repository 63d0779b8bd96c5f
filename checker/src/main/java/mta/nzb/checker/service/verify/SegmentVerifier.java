package mta.nzb.checker.service.verify;

import mta.nzb.checker.exception.ArticleAbsentException;
import mta.nzb.checker.exception.ConfigurationException;
import mta.nzb.checker.exception.HealthCheckCancelledException;
import mta.nzb.checker.exception.ProbeException;
import mta.nzb.checker.model.ProviderConfig;
import mta.nzb.checker.service.health.HealthCheckOptions;
import mta.nzb.checker.service.probe.DirectDialProbeFactory;
import mta.nzb.checker.service.probe.ProviderProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SegmentVerifier - Checks segment availability across providers with bounded concurrency.
 * Per segment:
 * - the shared pool is asked first when configured; a definitive "absent everywhere" ends the check
 * - otherwise each enabled provider is dialed in configured order until one has the article
 * - a segment nobody confirms is recorded as missing
 */
public class SegmentVerifier {

    private static final Logger logger = LoggerFactory.getLogger(SegmentVerifier.class);

    private static final AtomicInteger THREAD_SEQUENCE = new AtomicInteger();

    private final Optional<ProviderProbe> poolProbe;
    private final DirectDialProbeFactory probeFactory;
    private final HealthCheckOptions options;

    public SegmentVerifier(Optional<ProviderProbe> poolProbe,
                           DirectDialProbeFactory probeFactory,
                           HealthCheckOptions options) {
        this.poolProbe = Objects.requireNonNull(poolProbe, "poolProbe");
        this.probeFactory = Objects.requireNonNull(probeFactory, "probeFactory");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Verifies every segment and returns those no provider confirmed.
     *
     * @param segmentIds bracketed message-ids to check; duplicates are checked once
     * @param groups     newsgroups the post was made to, passed through to probes
     * @param providers  configured providers, in fallback priority order
     * @return missing ids in input order, empty when all were confirmed
     * @throws ConfigurationException        if no provider is enabled
     * @throws HealthCheckCancelledException if interrupted or past the configured deadline
     */
    public List<String> verifyAll(List<String> segmentIds, List<String> groups, List<ProviderConfig> providers) {
        List<ProviderConfig> enabled = enabledProviders(providers);
        if (enabled.isEmpty()) {
            throw new ConfigurationException("No enabled usenet providers configured");
        }

        List<String> unique = segmentIds.stream()
                .filter(id -> id != null && !id.isBlank())
                .distinct()
                .toList();
        if (unique.isEmpty()) {
            return List.of();
        }

        List<ProviderSlot> slots = enabled.stream()
                .map(p -> new ProviderSlot(p, probeFactory.create(p), new Semaphore(p.connectionBudget())))
                .toList();
        List<String> articleGroups = groups == null ? List.of() : List.copyOf(groups);

        int workers = workerCount(enabled, unique.size());
        logger.debug("Verifying {} segment(s) with {} worker(s) across {} provider(s), pool={}",
                unique.size(), workers, enabled.size(), poolProbe.isPresent());

        Set<String> missing = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());
        try {
            List<Future<?>> futures = new ArrayList<>(unique.size());
            for (String segmentId : unique) {
                futures.add(executor.submit(() -> checkSegment(segmentId, articleGroups, slots, missing)));
            }
            awaitAll(futures, slots);
        } finally {
            executor.shutdownNow();
        }

        return unique.stream().filter(missing::contains).toList();
    }

    /**
     * Enabled providers with a host, in configured order.
     */
    public static List<ProviderConfig> enabledProviders(List<ProviderConfig> providers) {
        if (providers == null) {
            return List.of();
        }
        return providers.stream()
                .filter(Objects::nonNull)
                .filter(ProviderConfig::usable)
                .toList();
    }

    int workerCount(List<ProviderConfig> enabled, int segments) {
        int budget = enabled.stream().mapToInt(ProviderConfig::connectionBudget).sum();
        if (options.maxWorkers() > 0) {
            budget = Math.min(budget, options.maxWorkers());
        }
        return Math.max(1, Math.min(budget, segments));
    }

    private void checkSegment(String segmentId, List<String> groups, List<ProviderSlot> slots, Set<String> missing) {
        if (poolProbe.isPresent()) {
            ProviderProbe pool = poolProbe.get();
            try {
                if (pool.isAvailable(segmentId, groups)) {
                    logger.debug("Segment {} present via pool", segmentId);
                    return;
                }
            } catch (ArticleAbsentException e) {
                // pool answered for every provider, no direct dials
                logger.debug("Segment {} confirmed missing from all providers by pool", segmentId);
                missing.add(segmentId);
                return;
            } catch (ProbeException e) {
                logger.warn("Pool check inconclusive for segment {}, retrying with fresh connections: {}",
                        segmentId, e.getMessage());
            }
        }

        for (ProviderSlot slot : slots) {
            if (Thread.currentThread().isInterrupted()) {
                throw HealthCheckCancelledException.interrupted(null);
            }
            if (probeDirect(slot, segmentId, groups)) {
                logger.debug("Segment {} present on {}", segmentId, slot.probe().describe());
                return;
            }
        }

        logger.debug("Segment {} not confirmed by any provider", segmentId);
        missing.add(segmentId);
    }

    private boolean probeDirect(ProviderSlot slot, String segmentId, List<String> groups) {
        try {
            slot.permits().acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw HealthCheckCancelledException.interrupted(e);
        }
        try {
            return slot.probe().isAvailable(segmentId, groups);
        } catch (ProbeException e) {
            logger.warn("Segment {} check on {} failed: {}", segmentId, slot.probe().describe(), e.getMessage());
            return false;
        } finally {
            slot.permits().release();
        }
    }

    private void awaitAll(List<Future<?>> futures, List<ProviderSlot> slots) {
        long timeoutNanos = options.checkTimeout().toNanos();
        long deadline = System.nanoTime() + timeoutNanos;
        try {
            for (Future<?> future : futures) {
                if (options.hasDeadline()) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        throw new TimeoutException();
                    }
                    future.get(remaining, TimeUnit.NANOSECONDS);
                } else {
                    future.get();
                }
            }
        } catch (TimeoutException e) {
            cancelAll(futures, slots);
            throw HealthCheckCancelledException.deadlineExceeded(options.checkTimeout().toMillis());
        } catch (InterruptedException e) {
            cancelAll(futures, slots);
            Thread.currentThread().interrupt();
            throw HealthCheckCancelledException.interrupted(e);
        } catch (CancellationException e) {
            cancelAll(futures, slots);
            throw HealthCheckCancelledException.interrupted(e);
        } catch (ExecutionException e) {
            cancelAll(futures, slots);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Segment check failed", cause);
        }
    }

    private static void cancelAll(List<Future<?>> futures, List<ProviderSlot> slots) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
        // interrupts do not reach blocked socket reads
        for (ProviderSlot slot : slots) {
            slot.probe().cancelInFlight();
        }
    }

    private static ThreadFactory workerThreadFactory() {
        return r -> {
            Thread t = new Thread(r, "segment-check-" + THREAD_SEQUENCE.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record ProviderSlot(ProviderConfig provider, ProviderProbe probe, Semaphore permits) {}
}
