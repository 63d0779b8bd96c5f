package mta.nzb.checker.pool;

import java.io.IOException;

/**
 * Owner of the shared, multiplexed provider connection pool.
 * Implemented outside this service; health checks only read from the pool.
 */
public interface UsenetPoolManager {

    /**
     * @return the current pool
     * @throws IOException if no pool is configured or it cannot be created
     */
    UsenetConnectionPool getPool() throws IOException;
}
