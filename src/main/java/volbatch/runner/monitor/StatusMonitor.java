package volbatch.runner.monitor;

import volbatch.runner.model.RunningJob;
import volbatch.runner.registry.RunRegistry;
import volbatch.runner.util.Durations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Prints the in-flight jobs every time the operator enters a line on the control input.
 *
 * Read-only: it never touches job execution. Runs on a daemon thread that ends at
 * end of input or with the JVM.
 */
public final class StatusMonitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StatusMonitor.class);

    static final String HEADER = "->->->->->->->->->-> Currently running jobs <-<-<-<-<-<-<-<-<-<-";
    static final String FOOTER = "->->->->->->->->->->->->->->-> End <-<-<-<-<-<-<-<-<-<-<-<-<-<-<-";

    private final RunRegistry registry;
    private final InputStream control;
    private final PrintStream out;
    private final Clock clock;

    private volatile Thread thread;

    public StatusMonitor(RunRegistry registry, InputStream control, PrintStream out, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.control = Objects.requireNonNull(control, "control is required");
        this.out = Objects.requireNonNull(out, "out is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Start listening on a daemon thread.
     */
    public synchronized Thread start() {
        if (thread != null) {
            log.warn("Status monitor already running");
            return thread;
        }
        Thread t = new Thread(this, "status-monitor");
        t.setDaemon(true);
        t.start();
        thread = t;
        return t;
    }

    @Override
    public void run() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(control, StandardCharsets.UTF_8));
        try {
            while (reader.readLine() != null) {
                printSnapshot();
            }
            log.debug("Control input closed, status monitor stopping");
        } catch (IOException e) {
            log.debug("Control input unreadable, status monitor stopping: {}", e.getMessage());
        }
    }

    /**
     * Print the current registry snapshot.
     */
    public void printSnapshot() {
        // copy first, print after: writers are never held up by the console
        List<RunningJob> snapshot = registry.snapshot();
        String report = render(snapshot, clock.instant());
        out.print(report);
        out.flush();
    }

    static String render(List<RunningJob> snapshot, Instant now) {
        StringBuilder sb = new StringBuilder();
        sb.append(System.lineSeparator()).append(HEADER).append(System.lineSeparator());
        for (RunningJob job : snapshot) {
            sb.append("Job: ").append(job.name())
                    .append(", Runtime: ").append(Durations.seconds(job.elapsed(now)))
                    .append(" seconds").append(System.lineSeparator());
        }
        sb.append(FOOTER).append(System.lineSeparator()).append(System.lineSeparator());
        return sb.toString();
    }
}
