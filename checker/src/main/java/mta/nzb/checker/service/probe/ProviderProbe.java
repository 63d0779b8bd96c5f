package mta.nzb.checker.service.probe;

import mta.nzb.checker.exception.ArticleAbsentException;
import mta.nzb.checker.exception.ProbeException;

import java.util.List;

/**
 * Asks whether a provider (or set of providers) holds an article, without fetching its body.
 */
public interface ProviderProbe {

    /**
     * @param messageId bracketed message-id
     * @param groups    newsgroups from the NZB, may be empty
     * @return true when the article is present, false when this probe's provider reports it absent
     * @throws ArticleAbsentException when absence is confirmed across every provider the probe covers
     * @throws ProbeException         when no verdict could be reached
     */
    boolean isAvailable(String messageId, List<String> groups) throws ProbeException;

    /**
     * Aborts probes still running for the current check, unblocking their I/O.
     * Probes that hold nothing of their own leave this as a no-op.
     */
    default void cancelInFlight() {
    }

    /**
     * Short label used in logs.
     */
    String describe();
}
