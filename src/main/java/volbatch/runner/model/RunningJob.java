package volbatch.runner.model;

import java.time.Duration;
import java.time.Instant;

/**
 * One in-flight job as seen in a registry snapshot.
 */
public record RunningJob(
        String name,
        Instant startedAt
) {

    public Duration elapsed(Instant now) {
        Duration d = Duration.between(startedAt, now);
        return d.isNegative() ? Duration.ZERO : d;
    }
}
