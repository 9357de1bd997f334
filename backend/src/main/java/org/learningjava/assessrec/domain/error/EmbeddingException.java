package org.learningjava.assessrec.domain.error;

/**
 * The embedding capability could not be initialized or invoked.
 */
public class EmbeddingException extends RecommenderException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
