package volbatch.runner.registry;

import volbatch.runner.model.RunningJob;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-flight jobs keyed by name, mapped to the instant they started.
 * Written by every job worker, read by the status monitor.
 */
public class RunRegistry {

    // by job name
    private final ConcurrentHashMap<String, Instant> running = new ConcurrentHashMap<>();

    /** Insert or overwrite the start time of a job. */
    public void record(String name, Instant startedAt) {
        running.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(startedAt, "startedAt"));
    }

    /** Remove a job; no-op when absent. */
    public void forget(String name) {
        if (name != null) {
            running.remove(name);
        }
    }

    public int size() {
        return running.size();
    }

    public boolean isEmpty() {
        return running.isEmpty();
    }

    /**
     * Point-in-time copy of the in-flight jobs, oldest first.
     * Iteration order carries no meaning beyond display.
     */
    public List<RunningJob> snapshot() {
        List<RunningJob> list = new ArrayList<>(running.size());
        for (Map.Entry<String, Instant> e : running.entrySet()) {
            list.add(new RunningJob(e.getKey(), e.getValue()));
        }
        list.sort(Comparator.comparing(RunningJob::startedAt));
        return List.copyOf(list);
    }
}
