package org.learningjava.assessrec.domain.model.recommend;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.learningjava.assessrec.domain.model.retrieval.Candidate;

/**
 * One output row of the pipeline. {@code synthetic} is true when no catalog URL backs the row.
 */
public record Recommendation(
        @JsonProperty("assessment_name") String assessmentName,
        @JsonProperty("assessment_url") String assessmentUrl,
        @JsonProperty("test_type") String testType,
        @JsonProperty("duration_minutes") Integer durationMinutes,
        @JsonProperty("category") String category,
        @JsonProperty("synthetic") boolean synthetic
) {

    public static Recommendation from(Candidate c) {
        var item = c.item();
        String name = item.name().isBlank() ? "Unknown" : item.name();
        String category = item.category().isBlank() ? null : item.category();
        String url = item.hasUrl() ? item.url() : null;
        return new Recommendation(
                name,
                url,
                item.testType(),
                item.durationMinutes(),
                category,
                url == null
        );
    }
}
