package mta.nzb.checker.service.health;

import mta.nzb.checker.config.ProviderSettingsSource;
import mta.nzb.checker.exception.ConfigurationException;
import mta.nzb.checker.exception.NzbFetchException;
import mta.nzb.checker.exception.NzbParseException;
import mta.nzb.checker.model.FetchedNzb;
import mta.nzb.checker.model.ParsedNzb;
import mta.nzb.checker.model.ProviderConfig;
import mta.nzb.checker.model.SamplingPlan;
import mta.nzb.checker.model.request.NzbCandidate;
import mta.nzb.checker.model.response.HealthCheckResult;
import mta.nzb.checker.service.nzb.NzbFetcher;
import mta.nzb.checker.service.nzb.NzbParser;
import mta.nzb.checker.service.sampling.SamplingPlanner;
import mta.nzb.checker.service.verify.SegmentVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * HealthCheckService
 * Entry point for NZB availability checks: fetch, parse, sample, verify, report.
 * Every call works on fresh state; nothing is cached between candidates.
 */
@Service
public class HealthCheckService {

    private static final Logger logger = LoggerFactory.getLogger(HealthCheckService.class);

    private static final int MAX_LOGGED_SUBJECTS = 10;

    private final ProviderSettingsSource providerSettings;
    private final NzbFetcher nzbFetcher;
    private final NzbParser nzbParser;
    private final SamplingPlanner samplingPlanner;
    private final SegmentVerifier segmentVerifier;
    private final HealthCheckOptions options;

    public HealthCheckService(ProviderSettingsSource providerSettings,
                              NzbFetcher nzbFetcher,
                              NzbParser nzbParser,
                              SamplingPlanner samplingPlanner,
                              SegmentVerifier segmentVerifier,
                              HealthCheckOptions options) {
        this.providerSettings = providerSettings;
        this.nzbFetcher = nzbFetcher;
        this.nzbParser = nzbParser;
        this.samplingPlanner = samplingPlanner;
        this.segmentVerifier = segmentVerifier;
        this.options = options;
    }

    /**
     * Downloads the candidate's NZB and checks whether its segments are retrievable.
     *
     * @param candidate release to check
     * @return verdict with segment counts and missing message-ids
     * @throws ConfigurationException if no enabled provider is configured
     * @throws NzbFetchException      if the NZB cannot be downloaded
     * @throws NzbParseException      if the NZB is malformed or empty
     */
    public HealthCheckResult checkHealth(NzbCandidate candidate) {
        long start = System.nanoTime();
        String url = candidate.resolveUrl();
        logger.info("Health check start title={} url={}", title(candidate), url);

        List<ProviderConfig> providers = requireEnabledProviders();

        if (url.isEmpty()) {
            throw new NzbFetchException(url, "NZB candidate '" + title(candidate) + "' is missing a download URL");
        }
        FetchedNzb nzb = nzbFetcher.fetch(url, candidate.title());

        return evaluate(candidate, providers, nzb.content(), nzb.fileName(), start);
    }

    /**
     * Checks an NZB payload that was already downloaded, e.g. during prequeue.
     *
     * @param candidate release the payload belongs to
     * @param nzb       raw NZB bytes
     * @param fileName  file name to report, may be null
     */
    public HealthCheckResult checkHealthWithNzb(NzbCandidate candidate, byte[] nzb, String fileName) {
        long start = System.nanoTime();
        logger.info("Health check start title={} url={} (prefetched=true)", title(candidate), candidate.resolveUrl());

        List<ProviderConfig> providers = requireEnabledProviders();

        if (nzb == null || nzb.length == 0) {
            throw new NzbParseException("NZB payload is empty");
        }
        return evaluate(candidate, providers, nzb, fileName, start);
    }

    private HealthCheckResult evaluate(NzbCandidate candidate, List<ProviderConfig> providers,
                                       byte[] content, String fileName, long start) {
        ParsedNzb parsed = nzbParser.parse(content);
        if (!parsed.subjects().isEmpty()) {
            logger.info("Files title={} count={} list={}",
                    title(candidate), parsed.subjects().size(), summarizeSubjects(parsed.subjects()));
        }
        if (parsed.hasArchiveHint()) {
            logger.debug("Post for title={} contains 7z archives", title(candidate));
        }

        int total = parsed.totalSegments();
        SamplingPlan plan = samplingPlanner.plan(total, options.sampleBudget(), options.randomSource().get());

        List<String> sampleIds = new ArrayList<>(plan.size());
        for (int index : plan.indices()) {
            sampleIds.add(parsed.segmentIds().get(index));
        }

        List<String> missing = segmentVerifier.verifyAll(sampleIds, new ArrayList<>(parsed.groups()), providers);

        HealthCheckResult result = HealthCheckResult.of(
                total, plan.size(), missing, plan.sampled(), fileName == null ? "" : fileName.trim());

        logger.info("Health result title={} status={} sampled={} checked={} total={} missing={} duration={} file={}",
                title(candidate),
                result.status().value(),
                result.sampled(),
                result.checkedSegments(),
                result.totalSegments(),
                result.missingSegments().size(),
                Duration.ofNanos(System.nanoTime() - start),
                result.fileName());

        return result;
    }

    private List<ProviderConfig> requireEnabledProviders() {
        List<ProviderConfig> enabled = SegmentVerifier.enabledProviders(providerSettings.providers());
        if (enabled.isEmpty()) {
            throw new ConfigurationException("No enabled usenet providers configured");
        }
        return enabled;
    }

    /**
     * Sorted, de-duplicated subjects, truncated after ten entries.
     */
    static String summarizeSubjects(Set<String> subjects) {
        TreeSet<String> unique = new TreeSet<>();
        for (String subject : subjects) {
            if (subject != null && !subject.isBlank()) {
                unique.add(subject.trim());
            }
        }
        if (unique.size() <= MAX_LOGGED_SUBJECTS) {
            return String.join(", ", unique);
        }
        List<String> summary = new ArrayList<>(unique).subList(0, MAX_LOGGED_SUBJECTS);
        return String.join(", ", summary) + ", ... (+" + (unique.size() - MAX_LOGGED_SUBJECTS) + " more)";
    }

    private static String title(NzbCandidate candidate) {
        return candidate.title() == null ? "" : candidate.title().trim();
    }
}
