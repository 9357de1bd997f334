package org.learningjava.assessrec.infrastructure.adapter.in.web.admin;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.learningjava.assessrec.application.usecase.EvaluateUseCase;
import org.learningjava.assessrec.domain.model.evaluation.EvaluationReport;
import org.learningjava.assessrec.domain.model.evaluation.Prediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executor;

@RestController
@RequestMapping("/evaluation")
public class EvaluationController {

    private static final Logger log = LoggerFactory.getLogger(EvaluationController.class);

    private final EvaluateUseCase evaluate;
    private final JobRegistry jobs;
    private final Executor executor;

    public EvaluationController(EvaluateUseCase evaluate,
                                JobRegistry jobs,
                                @Qualifier("applicationTaskExecutor") Executor executor) {
        this.evaluate = evaluate;
        this.jobs = jobs;
        this.executor = executor;
    }

    // --- Labeled CSV (Query,Assessment_url) on the server; result lands in the job status
    @PostMapping("/run")
    public Map<String, Object> run(@RequestParam String labeledSet,
                                   @RequestParam(defaultValue = "10") int k) {
        if (labeledSet == null || labeledSet.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "labeledSet is blank");
        }
        Path path = Path.of(labeledSet);
        if (!Files.isRegularFile(path)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Labeled set not found: " + labeledSet);
        }

        String jobId = jobs.start("EVALUATION");
        jobs.update(jobId, "Evaluating " + labeledSet + " at k=" + k);

        executor.execute(() -> {
            try {
                EvaluationReport report = evaluate.evaluate(path, k);
                jobs.done(jobId, String.format(Locale.ROOT, "MR@%d=%.4f MP@%d=%.4f over %d queries (%d failed)",
                        k, report.meanRecall(), k, report.meanPrecision(),
                        report.queryCount(), report.failedQueries()), report);
            } catch (Exception e) {
                jobs.fail(jobId, e.getMessage());
                log.error("[{}] Evaluation failed: {}", jobId, e.toString(), e);
            }
        });

        return Map.of("jobId", jobId);
    }

    // --- Submission rows for unlabeled queries
    @PostMapping("/predict")
    public List<Prediction> predict(@Valid @RequestBody PredictRequest req) {
        return evaluate.predict(req.queries(), req.k() == null ? 10 : req.k());
    }

    public record PredictRequest(
            @NotEmpty List<@NotBlank String> queries,
            @Min(1) @Max(10) Integer k
    ) {
    }
}
