package org.learningjava.assessrec.domain.model.retrieval;

import org.learningjava.assessrec.domain.model.catalog.CatalogItem;

/**
 * A catalog item retrieved for one request, with its similarity score. Never persisted.
 */
public record Candidate(CatalogItem item, double retrievalScore) {

    public static Candidate from(SearchHit hit) {
        return new Candidate(hit.item(), hit.score());
    }

    public String testType() {
        return item.testType();
    }

    public Integer durationMinutes() {
        return item.durationMinutes();
    }
}
