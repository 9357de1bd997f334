package org.learningjava.assessrec.infrastructure.adapter.in.web.admin;

import org.learningjava.assessrec.application.usecase.BuildIndexUseCase;
import org.learningjava.assessrec.domain.model.catalog.BuildReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.concurrent.Executor;

@RestController
@RequestMapping("/index")
public class IndexAdminController {

    private static final Logger log = LoggerFactory.getLogger(IndexAdminController.class);

    private final BuildIndexUseCase buildIndex;
    private final JobRegistry jobs;
    private final Executor executor;

    public IndexAdminController(BuildIndexUseCase buildIndex,
                                JobRegistry jobs,
                                @Qualifier("applicationTaskExecutor") Executor executor) {
        this.buildIndex = buildIndex;
        this.jobs = jobs;
        this.executor = executor;
    }

    // --- Rebuild from the configured catalog snapshot; searches keep using the old index until it finishes
    @PostMapping("/build")
    public Map<String, Object> build(@RequestParam(defaultValue = "false") boolean force) {
        String jobId = jobs.start("INDEX");
        jobs.update(jobId, "Building from " + buildIndex.catalogPath() + (force ? " (force)" : ""));

        executor.execute(() -> {
            try {
                log.info("[{}] Index build start (force={})", jobId, force);
                BuildReport report = buildIndex.build(force);

                String msg = report.built()
                        ? "Indexed " + report.itemCount() + " items with " + report.modelId()
                        : "Index already exists (" + report.itemCount() + " items); use force=true to rebuild";
                if (report.belowMinimum()) msg += "; below expected minimum";
                jobs.done(jobId, msg, report);
                log.info("[{}] Index build done: {}", jobId, msg);
            } catch (Exception e) {
                jobs.fail(jobId, e.getMessage());
                log.error("[{}] Index build failed: {}", jobId, e.toString(), e);
            }
        });

        return Map.of("jobId", jobId);
    }

    @GetMapping("/jobs/{id}")
    public JobRegistry.JobStatus job(@PathVariable String id) {
        JobRegistry.JobStatus status = jobs.get(id);
        if (status == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown job: " + id);
        }
        return status;
    }
}
