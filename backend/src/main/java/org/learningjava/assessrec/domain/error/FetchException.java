package org.learningjava.assessrec.domain.error;

/**
 * A job-description URL could not be fetched or parsed.
 */
public class FetchException extends RecommenderException {

    private final String url;

    public FetchException(String url, String message) {
        super(message);
        this.url = url;
    }

    public FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String url() {
        return url;
    }
}
