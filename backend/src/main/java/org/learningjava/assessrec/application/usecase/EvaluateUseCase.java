package org.learningjava.assessrec.application.usecase;

import org.learningjava.assessrec.application.port.LabeledQueryPort;
import org.learningjava.assessrec.domain.model.evaluation.EvaluationReport;
import org.learningjava.assessrec.domain.model.evaluation.LabeledQuery;
import org.learningjava.assessrec.domain.model.evaluation.Prediction;
import org.learningjava.assessrec.domain.model.evaluation.QueryEvaluation;
import org.learningjava.assessrec.domain.model.recommend.Recommendation;
import org.learningjava.assessrec.domain.service.metrics.RecallMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Offline evaluation over a labeled query set. One failing query never aborts the run:
 * it is logged and scored with an empty prediction.
 */
@Service
public class EvaluateUseCase {
    private static final Logger log = LoggerFactory.getLogger(EvaluateUseCase.class);

    private final RecommendUseCase recommend;
    private final LabeledQueryPort labeledQueries;

    public EvaluateUseCase(RecommendUseCase recommend, LabeledQueryPort labeledQueries) {
        this.recommend = recommend;
        this.labeledQueries = labeledQueries;
    }

    public EvaluationReport evaluate(Path labeledSet, int k) {
        return evaluate(labeledQueries.read(labeledSet), k);
    }

    public EvaluationReport evaluate(List<LabeledQuery> labeled, int k) {
        Map<String, Set<String>> relevantByQuery = new LinkedHashMap<>();
        Map<String, List<String>> predictedByQuery = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();

        int i = 0;
        for (LabeledQuery lq : labeled) {
            i++;
            log.info("[{}/{}] Processing query: {}", i, labeled.size(), abbreviate(lq.query()));
            relevantByQuery.put(lq.query(), lq.relevantUrls());
            try {
                predictedByQuery.put(lq.query(), urls(recommend.recommend(lq.query(), null, k)));
            } catch (RuntimeException e) {
                log.warn("Query failed, scoring as empty: {}", e.toString());
                predictedByQuery.put(lq.query(), List.of());
                errors.put(lq.query(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        List<QueryEvaluation> rows = new ArrayList<>(relevantByQuery.size());
        relevantByQuery.forEach((q, relevant) -> {
            List<String> predicted = predictedByQuery.get(q);
            rows.add(new QueryEvaluation(q, relevant.size(), predicted,
                    RecallMetrics.recallAtK(relevant, predicted, k),
                    RecallMetrics.precisionAtK(relevant, predicted, k),
                    errors.get(q)));
        });

        double mr = RecallMetrics.meanRecallAtK(relevantByQuery, predictedByQuery, k);
        double mp = RecallMetrics.meanPrecisionAtK(relevantByQuery, predictedByQuery, k);
        log.info("Mean Recall@{}: {}  Mean Precision@{}: {}", k, String.format(Locale.ROOT, "%.4f", mr), k, String.format(Locale.ROOT, "%.4f", mp));

        return new EvaluationReport(k, relevantByQuery.size(), errors.size(), mr, mp, rows);
    }

    /** Submission rows, one per recommended URL; failing queries contribute no rows. */
    public List<Prediction> predict(List<String> queries, int k) {
        List<Prediction> out = new ArrayList<>();
        for (String q : queries) {
            try {
                List<Recommendation> recs = recommend.recommend(q, null, k);
                if (recs.isEmpty()) log.warn("No recommendations for query: {}", abbreviate(q));
                for (Recommendation r : recs) out.add(new Prediction(q, r.assessmentUrl()));
            } catch (RuntimeException e) {
                log.warn("Error processing query '{}': {}", abbreviate(q), e.toString());
            }
        }
        log.info("Generated {} prediction rows for {} queries", out.size(), queries.size());
        return out;
    }

    private static List<String> urls(List<Recommendation> recs) {
        return recs.stream().map(Recommendation::assessmentUrl).filter(Objects::nonNull).toList();
    }

    private static String abbreviate(String s) {
        return s.length() <= 60 ? s : s.substring(0, 60) + "...";
    }
}
