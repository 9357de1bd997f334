package org.learningjava.assessrec.infrastructure.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.learningjava.assessrec.application.port.CatalogIndexPort;
import org.learningjava.assessrec.application.usecase.RecommendUseCase;
import org.learningjava.assessrec.domain.model.query.DesiredDomains;
import org.learningjava.assessrec.domain.model.query.QueryContext;
import org.learningjava.assessrec.domain.model.recommend.Recommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class RecommendController {
    private static final Logger log = LoggerFactory.getLogger(RecommendController.class);

    private final RecommendUseCase recommend;
    private final CatalogIndexPort index;
    private final int defaultTopK;
    private final int minTopK;
    private final int maxTopK;

    public RecommendController(RecommendUseCase recommend,
                               CatalogIndexPort index,
                               @Value("${assessrec.recommend.default-top-k:10}") int defaultTopK,
                               @Value("${assessrec.recommend.min-top-k:1}") int minTopK,
                               @Value("${assessrec.recommend.max-top-k:10}") int maxTopK) {
        this.recommend = recommend;
        this.index = index;
        this.defaultTopK = defaultTopK;
        this.minTopK = minTopK;
        this.maxTopK = maxTopK;
    }

    @PostMapping("/recommend")
    public RecommendResponse recommend(@RequestBody RecommendRequest req) {
        int topK = clampTopK(req.topK());
        List<Recommendation> results = recommend.recommend(req.query(), req.jdUrl(), topK);

        if (results.isEmpty()) {
            log.warn("No recommendations found");
        }
        String processed = req.query() != null ? req.query() : "JD URL provided";
        return new RecommendResponse(results, processed, results.size());
    }

    @PostMapping("/recommend/explain")
    public ExplainResponse explain(@RequestBody RecommendRequest req) {
        QueryContext ctx = recommend.explain(req.query(), req.jdUrl());
        Integer maxDuration = ctx.maxDurationMinutes().isPresent() ? ctx.maxDurationMinutes().getAsInt() : null;
        return new ExplainResponse(ctx.normalizedText(), maxDuration, ctx.desiredDomains());
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        // throws IndexNotFoundException when the artifacts are missing; mapped to 503
        int size = index.size();
        return ResponseEntity.ok(new HealthResponse("ok", "API is running and index is loaded", size));
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "/health");
        endpoints.put("recommend", "/recommend");
        endpoints.put("explain", "/recommend/explain");
        endpoints.put("buildIndex", "/index/build");
        endpoints.put("evaluate", "/evaluation/run");

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("api", "Assessment Recommendation Engine");
        info.put("version", "1.0.0");
        info.put("endpoints", endpoints);
        return info;
    }

    int clampTopK(Integer requested) {
        int k = requested == null ? defaultTopK : requested;
        return Math.max(minTopK, Math.min(maxTopK, k));
    }

    // ---------- DTOs ----------
    public record RecommendRequest(
            String query,
            @JsonProperty("jd_url") @JsonAlias("jdUrl") String jdUrl,
            @JsonProperty("top_k") @JsonAlias("topK") Integer topK
    ) {
    }

    public record RecommendResponse(
            List<Recommendation> results,
            @JsonProperty("query_processed") String queryProcessed,
            int count
    ) {
    }

    public record ExplainResponse(
            @JsonProperty("normalized_text") String normalizedText,
            @JsonProperty("max_duration_minutes") Integer maxDurationMinutes,
            @JsonProperty("desired_domains") DesiredDomains desiredDomains
    ) {
    }

    public record HealthResponse(String status, String message, @JsonProperty("index_size") int indexSize) {
    }
}
