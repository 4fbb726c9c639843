package org.learningjava.carbonengine.infrastructure.adapter.in.web.admin;

import org.learningjava.carbonengine.domain.model.calculation.BatchSummary;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory status of background jobs (batch recalculation, factor ingestion).
 * Only the most recent {@value #MAX_FINISHED} finished jobs are kept.
 */
@Component
public class JobRegistry {

    static final int MAX_FINISHED = 100;
    private static final String DEFAULT_TYPE = "BATCH";

    public enum JobState { RUNNING, DONE, FAILED }

    public record JobStatus(
            String id,
            String type,
            JobState state,
            String message,
            int processed,
            int total,
            BatchSummary summary,
            Instant startedAt,
            Instant finishedAt
    ) {
        boolean finished() {
            return state != JobState.RUNNING;
        }
    }

    private final Map<String, JobStatus> jobs = new ConcurrentHashMap<>();
    private final Clock clock;

    public JobRegistry() {
        this(Clock.systemUTC());
    }

    JobRegistry(Clock clock) {
        this.clock = clock;
    }

    public String start(String type, int total) {
        String id = UUID.randomUUID().toString();
        jobs.put(id, new JobStatus(id, type, JobState.RUNNING, "Started", 0, Math.max(total, 0), null,
                clock.instant(), null));
        return id;
    }

    public void update(String id, int processed, String message) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = orNew(id, j);
            return new JobStatus(id, cur.type(), JobState.RUNNING, message != null ? message : cur.message(),
                    processed, cur.total(), null, cur.startedAt(), null);
        });
    }

    public void done(String id, String message, BatchSummary summary) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = orNew(id, j);
            return new JobStatus(id, cur.type(), JobState.DONE, message != null ? message : "Done",
                    cur.total(), cur.total(), summary, cur.startedAt(), clock.instant());
        });
        evictOldFinished();
    }

    public void fail(String id, String message) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = orNew(id, j);
            return new JobStatus(id, cur.type(), JobState.FAILED, message != null ? message : "Failed",
                    cur.processed(), cur.total(), null, cur.startedAt(), clock.instant());
        });
        evictOldFinished();
    }

    public JobStatus get(String id) {
        return jobs.get(id);
    }

    int size() {
        return jobs.size();
    }

    // progress reported for an id we never started (e.g. after a restart) still gets tracked
    private JobStatus orNew(String id, JobStatus existing) {
        if (existing != null) return existing;
        return new JobStatus(id, DEFAULT_TYPE, JobState.RUNNING, "Started", 0, 0, null, clock.instant(), null);
    }

    private void evictOldFinished() {
        long finished = jobs.values().stream().filter(JobStatus::finished).count();
        if (finished <= MAX_FINISHED) return;
        jobs.values().stream()
                .filter(JobStatus::finished)
                .sorted(Comparator.comparing(JobStatus::finishedAt))
                .limit(finished - MAX_FINISHED)
                .map(JobStatus::id)
                .toList()
                .forEach(jobs::remove);
    }
}
