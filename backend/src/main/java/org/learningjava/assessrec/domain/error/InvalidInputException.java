package org.learningjava.assessrec.domain.error;

/**
 * The request carried neither a query nor a job-description URL.
 */
public class InvalidInputException extends RecommenderException {

    public InvalidInputException(String message) {
        super(message);
    }
}
