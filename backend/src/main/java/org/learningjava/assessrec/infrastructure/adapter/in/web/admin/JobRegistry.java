package org.learningjava.assessrec.infrastructure.adapter.in.web.admin;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory status of background admin jobs (index builds, evaluation runs).
 */
@Component
public class JobRegistry {

    public static final String DEFAULT_TYPE = "INDEX";

    public enum JobState { RUNNING, DONE, FAILED }

    public record JobStatus(
            String id,
            String type,
            JobState state,
            String message,
            Object result
    ) {}

    private final Map<String, JobStatus> jobs = new ConcurrentHashMap<>();

    public String start(String type) {
        String id = UUID.randomUUID().toString();
        jobs.put(id, new JobStatus(id, type, JobState.RUNNING, "Started", null));
        return id;
    }

    public void update(String id, String message) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = j != null ? j : fresh(id);
            return new JobStatus(id, cur.type(), JobState.RUNNING, message != null ? message : cur.message(), cur.result());
        });
    }

    public void done(String id, String message, Object result) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = j != null ? j : fresh(id);
            return new JobStatus(id, cur.type(), JobState.DONE, message != null ? message : "Done", result);
        });
    }

    public void fail(String id, String message) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = j != null ? j : fresh(id);
            return new JobStatus(id, cur.type(), JobState.FAILED, message != null ? message : "Failed", cur.result());
        });
    }

    public JobStatus get(String id) {
        return jobs.get(id);
    }

    private static JobStatus fresh(String id) {
        return new JobStatus(id, DEFAULT_TYPE, JobState.RUNNING, "Started", null);
    }
}
