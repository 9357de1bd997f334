package org.learningjava.assessrec.application.usecase;

import org.learningjava.assessrec.domain.model.query.QueryContext;
import org.learningjava.assessrec.domain.model.recommend.Recommendation;
import org.learningjava.assessrec.domain.model.retrieval.Candidate;
import org.learningjava.assessrec.domain.service.rerank.RerankEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * End-to-end pipeline: normalize input, retrieve an over-fetched pool, rerank to topK, format.
 */
@Service
public class RecommendUseCase {
    private static final Logger log = LoggerFactory.getLogger(RecommendUseCase.class);

    public static final int DEFAULT_CANDIDATE_POOL = 50;

    private final RetrieveCandidatesUseCase retrieval;
    private final RerankEngine rerank;
    private final int candidatePool;

    public RecommendUseCase(RetrieveCandidatesUseCase retrieval,
                            RerankEngine rerank,
                            @Value("${assessrec.recommend.candidate-pool:50}") int candidatePool) {
        this.retrieval = retrieval;
        this.rerank = rerank;
        this.candidatePool = candidatePool;
    }

    public List<Recommendation> recommend(String query, String jdUrl, int topK) {
        log.info("Recommendation request: query={}, jd_url={}, top_k={}",
                query != null, jdUrl != null && !jdUrl.isBlank(), topK);

        String text = retrieval.normalizeInput(query, jdUrl);

        // the pool must stay well above topK or domain balancing has nothing to choose from
        int pool = (int) Math.min(Integer.MAX_VALUE, Math.max((long) candidatePool, 5L * topK));
        List<Candidate> candidates = retrieval.retrieveCandidates(text, pool);
        if (candidates.isEmpty()) {
            log.warn("No candidates retrieved");
            return List.of();
        }

        log.info("Applying reranking heuristics");
        List<Candidate> ranked = rerank.rerank(text, candidates, topK);

        List<Recommendation> result = ranked.stream().map(Recommendation::from).toList();
        log.info("Returning {} recommendations", result.size());
        return result;
    }

    /** The constraints the pipeline would derive for this input, without retrieving anything. */
    public QueryContext explain(String query, String jdUrl) {
        String text = retrieval.normalizeInput(query, jdUrl);
        return new QueryContext(query, jdUrl, text,
                rerank.inferMaxDuration(text), rerank.inferDesiredDomains(text));
    }
}
