package volbatch.runner.core;

import volbatch.runner.config.RunnerConfig;
import volbatch.runner.executor.CommandRunner;
import volbatch.runner.executor.JobExecutor;
import volbatch.runner.executor.ProcessCommandRunner;
import volbatch.runner.model.BatchResult;
import volbatch.runner.model.Job;
import volbatch.runner.model.JobOutcome;
import volbatch.runner.monitor.StatusMonitor;
import volbatch.runner.registry.RunRegistry;
import volbatch.runner.scheduler.BoundedDispatcher;
import volbatch.runner.util.Durations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Wires registry, executor, dispatcher and status monitor together for one batch.
 *
 * Usage:
 *
 * <pre>
 * RunCoordinator coordinator = RunCoordinator.create(RunnerConfig.fromEnv());
 * BatchResult result = coordinator.run();
 * </pre>
 */
public final class RunCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RunCoordinator.class);

    private final RunnerConfig config;
    private final CommandRunner commandRunner;
    private final InputStream control;
    private final PrintStream out;
    private final Clock clock;
    private final RunRegistry registry = new RunRegistry();

    public RunCoordinator(RunnerConfig config, CommandRunner commandRunner,
            InputStream control, PrintStream out, Clock clock) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.commandRunner = Objects.requireNonNull(commandRunner, "commandRunner is required");
        this.control = Objects.requireNonNull(control, "control is required");
        this.out = Objects.requireNonNull(out, "out is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Coordinator running the real tool, listening on stdin and printing to stdout.
     */
    public static RunCoordinator create(RunnerConfig config) {
        return new RunCoordinator(config, new ProcessCommandRunner(), System.in, System.out, Clock.systemUTC());
    }

    public RunRegistry registry() {
        return registry;
    }

    /**
     * Run the whole batch and block until every job has terminated.
     *
     * @return per-job outcomes and total duration
     * @throws BatchSetupException  if the batch cannot start; no job has run
     * @throws InterruptedException if interrupted while waiting for jobs
     */
    public BatchResult run() throws BatchSetupException, InterruptedException {
        List<String> missing = config.missingSettings();
        if (!missing.isEmpty()) {
            throw new BatchSetupException("Missing required settings: " + String.join(", ", missing));
        }

        Path image = toPath(config.imagePath(), "image");
        Path outputDir = toPath(config.outputDir(), "output");
        Path modulesFile = toPath(config.modulesPath(), "modules");

        // Ensure the output directory exists
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new BatchSetupException("Error creating output directory " + outputDir + ": " + e.getMessage(), e);
        }

        List<Job> jobs = new ArrayList<>();
        for (String name : JobListReader.read(modulesFile)) {
            jobs.add(Job.of(name, image, outputDir));
        }

        int limit = config.effectiveConcurrency();
        log.info("Using up to {} concurrent jobs for {} modules", limit, jobs.size());

        Instant totalStart = clock.instant();

        new StatusMonitor(registry, control, out, clock).start();

        JobExecutor executor = new JobExecutor(config.toolPath(), image, commandRunner, registry, clock);
        List<JobOutcome> outcomes = new BoundedDispatcher(jobs, limit, executor).runAll();

        Duration total = Duration.between(totalStart, clock.instant());
        BatchResult result = new BatchResult(outcomes, total);

        out.println("All jobs completed in " + Durations.seconds(total) + " seconds.");
        out.flush();
        log.debug("Batch finished: {} done, {} failed, {} skipped",
                result.succeeded(), result.failed(), result.skipped());
        return result;
    }

    private static Path toPath(String value, String setting) throws BatchSetupException {
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            throw new BatchSetupException("Invalid " + setting + " path: " + value, e);
        }
    }
}
