package volbatch.runner.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the newline-delimited module list. Lines are trimmed and blank ones dropped;
 * duplicates are kept in order.
 */
public final class JobListReader {

    private JobListReader() {
    }

    public static List<String> read(Path file) throws BatchSetupException {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BatchSetupException("Error reading modules file " + file + ": " + e.getMessage(), e);
        }
        return parse(lines);
    }

    static List<String> parse(List<String> lines) {
        List<String> names = new ArrayList<>(lines.size());
        for (String line : lines) {
            String name = line.strip();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }
}
