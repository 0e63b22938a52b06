package volbatch.runner.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configuration holder for a batch run.
 * Paths are kept as given; the coordinator resolves them.
 */
public final class RunnerConfig {

    public static final String ENV_TOOL = "VOLBATCH_TOOL";
    public static final String ENV_IMAGE = "VOLBATCH_IMAGE";
    public static final String ENV_MODULES = "VOLBATCH_MODULES";
    public static final String ENV_OUTPUT = "VOLBATCH_OUTPUT";
    public static final String ENV_JOBS = "VOLBATCH_JOBS";

    // Inputs
    private String toolPath;
    private String imagePath;
    private String modulesPath;
    private String outputDir;

    // Null means "derive from available processors"
    private Integer concurrency;

    private RunnerConfig() {
    }

    public static RunnerConfig defaults() {
        return new RunnerConfig();
    }

    public static RunnerConfig fromEnv() {
        return defaults().withEnv(System.getenv());
    }

    /**
     * Override settings from environment-style variables; blank values are ignored.
     */
    public RunnerConfig withEnv(Map<String, String> env) {
        String tool = env.get(ENV_TOOL);
        if (tool != null && !tool.isBlank()) {
            this.toolPath = tool;
        }

        String image = env.get(ENV_IMAGE);
        if (image != null && !image.isBlank()) {
            this.imagePath = image;
        }

        String modules = env.get(ENV_MODULES);
        if (modules != null && !modules.isBlank()) {
            this.modulesPath = modules;
        }

        String output = env.get(ENV_OUTPUT);
        if (output != null && !output.isBlank()) {
            this.outputDir = output;
        }

        String jobs = env.get(ENV_JOBS);
        if (jobs != null && !jobs.isBlank()) {
            withConcurrency(parseConcurrency(jobs, ENV_JOBS));
        }

        return this;
    }

    /**
     * Parse a concurrency value.
     *
     * @param value  raw value
     * @param source where it came from, for the error message
     * @throws IllegalArgumentException if not an integer >= 1
     */
    public static int parseConcurrency(String value, String source) {
        int n;
        try {
            n = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(source + ": not a number: " + value, e);
        }
        if (n < 1) {
            throw new IllegalArgumentException(source + ": must be >= 1, got " + n);
        }
        return n;
    }

    /** Available processors minus one, at least 1. */
    public static int defaultConcurrency() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    // Getters
    public String toolPath() {
        return toolPath;
    }

    public String imagePath() {
        return imagePath;
    }

    public String modulesPath() {
        return modulesPath;
    }

    public String outputDir() {
        return outputDir;
    }

    public Integer concurrency() {
        return concurrency;
    }

    public int effectiveConcurrency() {
        return concurrency != null ? concurrency : defaultConcurrency();
    }

    /**
     * Names of required settings that are still unset.
     */
    public List<String> missingSettings() {
        List<String> missing = new ArrayList<>();
        if (isBlank(toolPath)) missing.add("tool");
        if (isBlank(imagePath)) missing.add("image");
        if (isBlank(modulesPath)) missing.add("modules");
        if (isBlank(outputDir)) missing.add("output");
        return missing;
    }

    public boolean isComplete() {
        return missingSettings().isEmpty();
    }

    // Fluent setters
    public RunnerConfig withToolPath(String toolPath) {
        this.toolPath = toolPath;
        return this;
    }

    public RunnerConfig withImagePath(String imagePath) {
        this.imagePath = imagePath;
        return this;
    }

    public RunnerConfig withModulesPath(String modulesPath) {
        this.modulesPath = modulesPath;
        return this;
    }

    public RunnerConfig withOutputDir(String outputDir) {
        this.outputDir = outputDir;
        return this;
    }

    public RunnerConfig withConcurrency(Integer concurrency) {
        if (concurrency != null && concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, got " + concurrency);
        }
        this.concurrency = concurrency;
        return this;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "toolPath='" + toolPath + '\'' +
                ", imagePath='" + imagePath + '\'' +
                ", modulesPath='" + modulesPath + '\'' +
                ", outputDir='" + outputDir + '\'' +
                ", concurrency=" + (concurrency != null ? concurrency : "auto") +
                '}';
    }
}
