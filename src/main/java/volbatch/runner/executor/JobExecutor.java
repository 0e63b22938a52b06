package volbatch.runner.executor;

import volbatch.runner.model.Job;
import volbatch.runner.model.JobOutcome;
import volbatch.runner.registry.RunRegistry;
import volbatch.runner.util.Durations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Runs a single job against the analysis tool.
 *
 * A job is present in the {@link RunRegistry} from the moment the tool is about
 * to start until it has terminated, whatever the outcome. Failures are returned as
 * {@link JobOutcome}s and never thrown, so one job cannot take down its siblings.
 */
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final String toolPath;
    private final Path image;
    private final CommandRunner commandRunner;
    private final RunRegistry registry;
    private final Clock clock;

    public JobExecutor(String toolPath, Path image, CommandRunner commandRunner, RunRegistry registry, Clock clock) {
        this.toolPath = Objects.requireNonNull(toolPath, "toolPath is required");
        this.image = Objects.requireNonNull(image, "image is required");
        this.commandRunner = Objects.requireNonNull(commandRunner, "commandRunner is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Build the tool invocation for a module: {@code tool -f image -r csv module}.
     */
    public static List<String> command(String toolPath, Path image, String jobName) {
        return List.of(toolPath, "-f", image.toString(), "-r", "csv", jobName);
    }

    /**
     * Execute the job synchronously.
     *
     * @param job job to run
     * @return terminal outcome
     */
    public JobOutcome execute(Job job) {
        Objects.requireNonNull(job, "job is required");

        // 1. Create or truncate the output file before anything is registered
        try {
            prepareOutput(job.outputFile());
        } catch (IOException e) {
            log.error("Error creating output file for job {}: {}", job.name(), e.toString());
            return JobOutcome.skipped(job, "cannot create " + job.outputFile() + ": " + e.getMessage());
        }

        // 2. Register and run
        Instant start = clock.instant();
        registry.record(job.name(), start);
        try {
            log.info("Running job: {}", job.name());
            int exitCode = commandRunner.run(command(toolPath, image, job.name()), job.outputFile());
            Duration elapsed = since(start);

            if (exitCode == 0) {
                log.info("    Job {} completed in {} seconds", job.name(), Durations.seconds(elapsed));
                return JobOutcome.done(job, elapsed);
            }
            log.warn("!--- Error running job {}: exit status {}", job.name(), exitCode);
            return JobOutcome.failed(job, elapsed, exitCode, "exit status " + exitCode);

        } catch (IOException e) {
            log.warn("!--- Error running job {}: {}", job.name(), e.getMessage());
            return JobOutcome.failed(job, since(start), null, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("!--- Job {} interrupted", job.name());
            return JobOutcome.failed(job, since(start), null, "interrupted");
        } finally {
            // 3. Always deregister
            registry.forget(job.name());
        }
    }

    private static void prepareOutput(Path outputFile) throws IOException {
        try (OutputStream ignored = Files.newOutputStream(outputFile)) {
            // created (or truncated) and closed; the runner reopens it for the process
        }
    }

    private Duration since(Instant start) {
        return Duration.between(start, clock.instant());
    }
}
