package org.learningjava.assessrec.domain.model.evaluation;

/** One row of a submission file: a query and one recommended assessment URL. */
public record Prediction(String query, String assessmentUrl) {
}
