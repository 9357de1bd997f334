package org.learningjava.assessrec.application.port;

public interface JobDescriptionPort {
    /**
     * Fetches the page and returns its visible text, whitespace collapsed.
     *
     * @throws org.learningjava.assessrec.domain.error.FetchException if the URL is unreachable or unparsable
     */
    String fetchText(String url);
}
