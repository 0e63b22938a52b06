package volbatch.runner.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable description of one analysis job: a module name and the file
 * that receives the tool's standard output.
 */
public final class Job {
    private final String name;
    private final Path outputFile;

    private Job(String name, Path outputFile) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.outputFile = Objects.requireNonNull(outputFile, "outputFile is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
    }

    /**
     * Create a job whose output lands at {@code {outputDir}/{imageBaseName}_{name}.csv}.
     *
     * @param name      module name passed to the tool
     * @param image     memory image path; only its last path component is used
     * @param outputDir directory holding the per-job files
     */
    public static Job of(String name, Path image, Path outputDir) {
        Objects.requireNonNull(image, "image is required");
        Objects.requireNonNull(outputDir, "outputDir is required");
        return new Job(name, outputDir.resolve(outputFileName(image, name)));
    }

    public static String outputFileName(Path image, String name) {
        Path fileName = image.getFileName();
        String base = fileName != null ? fileName.toString() : image.toString();
        return base + "_" + name + ".csv";
    }

    public String name() {
        return name;
    }

    public Path outputFile() {
        return outputFile;
    }

    // Duplicate names are independent jobs, so identity equality is kept.

    @Override
    public String toString() {
        return "Job{name='" + name + "', outputFile=" + outputFile + "}";
    }
}
