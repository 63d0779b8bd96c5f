package mta.nzb.checker.exception;

/**
 * ArticleAbsentException
 * Definitive outcome: every provider behind the probe confirmed the article does not exist.
 */
public class ArticleAbsentException extends ProbeException {

    public ArticleAbsentException(String messageId, Throwable cause) {
        super(messageId, "Article " + messageId + " not found on any provider", cause);
    }
}
