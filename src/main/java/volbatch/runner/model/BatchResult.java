package volbatch.runner.model;

import java.time.Duration;
import java.util.List;

/**
 * Outcomes of a whole batch, in job list order, and its wall-clock duration.
 */
public record BatchResult(
        List<JobOutcome> outcomes,
        Duration totalElapsed
) {

    public BatchResult {
        outcomes = List.copyOf(outcomes);
    }

    public int total() {
        return outcomes.size();
    }

    public long succeeded() {
        return count(JobStatus.DONE);
    }

    public long failed() {
        return count(JobStatus.FAILED);
    }

    public long skipped() {
        return count(JobStatus.SKIPPED);
    }

    private long count(JobStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }
}
