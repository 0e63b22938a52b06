package volbatch.runner.monitor;

import volbatch.runner.model.RunningJob;
import volbatch.runner.registry.RunRegistry;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatusMonitorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:30Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final RunRegistry registry = new RunRegistry();
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private static ByteArrayInputStream input(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    private String printed() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static int occurrences(String haystack, String needle) {
        int count = 0;
        for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + 1)) {
            count++;
        }
        return count;
    }

    @Test
    void renderListsEveryJobWithElapsedSeconds() {
        String report = StatusMonitor.render(List.of(
                new RunningJob("pslist", NOW.minusMillis(12_340)),
                new RunningJob("netscan", NOW.minusSeconds(2))), NOW);

        assertTrue(report.contains(StatusMonitor.HEADER));
        assertTrue(report.contains(StatusMonitor.FOOTER));
        assertTrue(report.contains("Job: pslist, Runtime: 12.34 seconds"));
        assertTrue(report.contains("Job: netscan, Runtime: 2.00 seconds"));
        assertTrue(report.indexOf(StatusMonitor.HEADER) < report.indexOf("pslist"));
        assertTrue(report.indexOf("netscan") < report.indexOf(StatusMonitor.FOOTER));
    }

    @Test
    void emptyRegistryPrintsOnlyHeaderAndFooter() {
        String report = StatusMonitor.render(List.of(), NOW);

        assertTrue(report.contains(StatusMonitor.HEADER));
        assertTrue(report.contains(StatusMonitor.FOOTER));
        assertFalse(report.contains("Job:"));
    }

    @Test
    void eachInputLinePrintsOneSnapshot() {
        registry.record("pslist", NOW.minusSeconds(5));

        new StatusMonitor(registry, input("\nanything typed\n\n"), out, CLOCK).run();

        assertEquals(3, occurrences(printed(), StatusMonitor.HEADER));
        assertEquals(3, occurrences(printed(), "Job: pslist, Runtime: 5.00 seconds"));
    }

    @Test
    void noInputNoOutput() {
        registry.record("pslist", NOW);

        new StatusMonitor(registry, input(""), out, CLOCK).run();

        assertEquals("", printed());
    }

    @Test
    void reflectsRegistryAtTimeOfRequest() {
        StatusMonitor monitor = new StatusMonitor(registry, input(""), out, CLOCK);

        registry.record("pslist", NOW.minusSeconds(1));
        monitor.printSnapshot();
        registry.forget("pslist");
        registry.record("malfind", NOW.minusSeconds(3));
        monitor.printSnapshot();

        String text = printed();
        int second = text.lastIndexOf(StatusMonitor.HEADER);
        assertTrue(text.substring(0, second).contains("pslist"));
        assertFalse(text.substring(second).contains("pslist"));
        assertTrue(text.substring(second).contains("Job: malfind, Runtime: 3.00 seconds"));
    }

    @Test
    void backgroundThreadStopsAtEndOfInput() throws Exception {
        PipedOutputStream keys = new PipedOutputStream();
        PipedInputStream control = new PipedInputStream(keys);
        registry.record("pstree", NOW.minusSeconds(1));

        Thread thread = new StatusMonitor(registry, control, out, CLOCK).start();
        assertTrue(thread.isDaemon());

        keys.write("\n".getBytes(StandardCharsets.UTF_8));
        keys.flush();
        keys.close();
        thread.join(5_000);

        assertFalse(thread.isAlive());
        assertTrue(printed().contains("Job: pstree, Runtime: 1.00 seconds"));
    }
}
