package mta.nzb.checker.pool;

import java.io.IOException;
import java.util.List;

/**
 * Shared connection pool spanning every configured provider. Safe for concurrent use.
 */
public interface UsenetConnectionPool {

    /**
     * Issues STAT for a message-id, trying providers as the pool sees fit.
     *
     * @param messageId bracketed message-id
     * @param groups    newsgroups the article was posted to, may be empty
     * @return NNTP status code of the answering provider (223 when the article exists)
     * @throws ArticleNotFoundInProvidersException when every provider reported the article missing
     * @throws IOException                         on connection or timeout failures
     */
    int stat(String messageId, List<String> groups) throws ArticleNotFoundInProvidersException, IOException;
}
