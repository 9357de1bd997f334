package org.learningjava.assessrec.domain.model.evaluation;

import java.util.List;

public record EvaluationReport(
        int k,
        int queryCount,
        int failedQueries,
        double meanRecall,
        double meanPrecision,
        List<QueryEvaluation> perQuery
) {
}
