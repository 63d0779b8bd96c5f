package mta.nzb.checker.service.probe;

import mta.nzb.checker.exception.ArticleAbsentException;
import mta.nzb.checker.exception.ProbeException;
import mta.nzb.checker.pool.ArticleNotFoundInProvidersException;
import mta.nzb.checker.pool.UsenetConnectionPool;
import mta.nzb.checker.pool.UsenetPoolManager;

import java.io.IOException;
import java.util.List;

/**
 * PoolBackedProbe
 * Checks an article through the shared connection pool. Only the pool's
 * "not found in any provider" signal counts as proof of absence; every other
 * outcome is inconclusive so the caller can retry with direct connections.
 */
public class PoolBackedProbe implements ProviderProbe {

    private final UsenetPoolManager poolManager;

    public PoolBackedProbe(UsenetPoolManager poolManager) {
        this.poolManager = poolManager;
    }

    @Override
    public boolean isAvailable(String messageId, List<String> groups) throws ProbeException {
        UsenetConnectionPool pool;
        try {
            pool = poolManager.getPool();
        } catch (IOException e) {
            throw new ProbeException(messageId, "Connection pool unavailable: " + e.getMessage(), e);
        }

        int code;
        try {
            code = pool.stat(messageId, groups == null ? List.of() : groups);
        } catch (ArticleNotFoundInProvidersException e) {
            throw new ArticleAbsentException(messageId, e);
        } catch (IOException e) {
            throw new ProbeException(messageId, "Pool STAT failed: " + e.getMessage(), e);
        }

        if (code == NntpConnection.ARTICLE_EXISTS) {
            return true;
        }
        // Stale pooled connections answer with odd codes; not evidence of absence.
        throw new ProbeException(messageId, "Pool STAT returned unexpected status " + code);
    }

    @Override
    public String describe() {
        return "pool";
    }
}
