package org.learningjava.assessrec.domain.error;

/**
 * Root of the recommender's typed failures. Unchecked: callers that can recover catch the subtype.
 */
public abstract class RecommenderException extends RuntimeException {

    protected RecommenderException(String message) {
        super(message);
    }

    protected RecommenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
