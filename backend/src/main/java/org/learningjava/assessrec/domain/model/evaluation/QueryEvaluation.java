package org.learningjava.assessrec.domain.model.evaluation;

import java.util.List;

/**
 * Per-query outcome of an evaluation run. {@code error} is null unless the pipeline failed
 * for this query, in which case {@code predictedUrls} is empty.
 */
public record QueryEvaluation(
        String query,
        int relevantCount,
        List<String> predictedUrls,
        double recall,
        double precision,
        String error
) {
}
