package volbatch.runner.scheduler;

import volbatch.runner.executor.JobExecutor;
import volbatch.runner.model.Job;
import volbatch.runner.model.JobOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every job of a batch with at most {@code limit} executing at once.
 *
 * Jobs are admitted in list order: the dispatching thread takes a permit before
 * handing each job to a worker, and the worker gives it back when the job returns,
 * whether it succeeded or not. The limit is a hard cap independent of CPU count.
 */
public class BoundedDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BoundedDispatcher.class);

    private final List<Job> jobs;
    private final int limit;
    private final JobExecutor jobExecutor;
    private final Semaphore permits;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public BoundedDispatcher(List<Job> jobs, int limit, JobExecutor jobExecutor) {
        if (limit < 1) {
            throw new IllegalArgumentException("concurrency limit must be >= 1, got " + limit);
        }
        this.jobs = List.copyOf(Objects.requireNonNull(jobs, "jobs is required"));
        this.limit = limit;
        this.jobExecutor = Objects.requireNonNull(jobExecutor, "jobExecutor is required");
        this.permits = new Semaphore(limit, true);
    }

    public int limit() {
        return limit;
    }

    /**
     * Run all jobs and wait until every one of them has terminated.
     *
     * @return outcomes in job list order
     * @throws InterruptedException  if the dispatching thread is interrupted
     * @throws IllegalStateException if called more than once
     */
    public List<JobOutcome> runAll() throws InterruptedException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("runAll() already called");
        }

        AtomicInteger seq = new AtomicInteger();
        ExecutorService workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "job-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            List<Future<JobOutcome>> futures = new ArrayList<>(jobs.size());
            for (Job job : jobs) {
                permits.acquire();
                try {
                    futures.add(workers.submit(() -> runWithPermit(job)));
                } catch (RejectedExecutionException e) {
                    permits.release();
                    throw e;
                }
            }

            List<JobOutcome> outcomes = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(jobs.get(i), futures.get(i)));
            }
            return outcomes;
        } finally {
            shutdown(workers);
        }
    }

    private JobOutcome runWithPermit(Job job) {
        try {
            return jobExecutor.execute(job);
        } finally {
            permits.release();
        }
    }

    private static JobOutcome await(Job job, Future<JobOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Job {} crashed", job.name(), cause);
            return JobOutcome.failed(job, Duration.ZERO, null, cause.toString());
        }
    }

    private static void shutdown(ExecutorService workers) {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
                log.warn("Job workers forcefully stopped");
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
