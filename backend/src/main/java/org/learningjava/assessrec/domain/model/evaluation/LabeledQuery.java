package org.learningjava.assessrec.domain.model.evaluation;

import java.util.Set;

/** A query with the assessment URLs judged relevant for it. */
public record LabeledQuery(String query, Set<String> relevantUrls) {

    public LabeledQuery {
        relevantUrls = relevantUrls == null ? Set.of() : Set.copyOf(relevantUrls);
    }
}
