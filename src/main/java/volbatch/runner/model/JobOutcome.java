package volbatch.runner.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Terminal result of one job.
 *
 * @param jobName    module name
 * @param status     terminal status
 * @param outputFile file that received (or would have received) the tool output
 * @param elapsed    time between registration and termination, zero when skipped
 * @param exitCode   process exit code, null when the process never ran to exit
 * @param error      failure description, null on success
 */
public record JobOutcome(
        String jobName,
        JobStatus status,
        Path outputFile,
        Duration elapsed,
        Integer exitCode,
        String error
) {

    public JobOutcome {
        Objects.requireNonNull(jobName, "jobName is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(elapsed, "elapsed is required");
    }

    public static JobOutcome done(Job job, Duration elapsed) {
        return new JobOutcome(job.name(), JobStatus.DONE, job.outputFile(), elapsed, 0, null);
    }

    public static JobOutcome failed(Job job, Duration elapsed, Integer exitCode, String error) {
        return new JobOutcome(job.name(), JobStatus.FAILED, job.outputFile(), elapsed, exitCode, error);
    }

    public static JobOutcome skipped(Job job, String error) {
        return new JobOutcome(job.name(), JobStatus.SKIPPED, job.outputFile(), Duration.ZERO, null, error);
    }

    public boolean isSuccess() {
        return status == JobStatus.DONE;
    }
}
