package volbatch.runner.util;

import java.time.Duration;
import java.util.Locale;

public final class Durations {
    private Durations() {}

    /** Seconds with two decimals, e.g. {@code 12.34}. */
    public static String seconds(Duration d) {
        return String.format(Locale.ROOT, "%.2f", d.toMillis() / 1000.0);
    }
}
