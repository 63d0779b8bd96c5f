package mta.nzb.checker.pool;

/**
 * Raised by a {@link UsenetConnectionPool} once every provider has answered that an article is missing.
 */
public class ArticleNotFoundInProvidersException extends Exception {

    public ArticleNotFoundInProvidersException(String messageId) {
        super("Article " + messageId + " not found in any provider");
    }
}
