package volbatch.runner.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads run settings from an INI file.
 *
 * <pre>
 * [runner]
 * tool = /usr/local/bin/vol
 * image = /cases/host.mem
 * modules = /cases/modules.txt
 * output = /cases/out
 * jobs = 4
 * </pre>
 *
 * Keys absent from the file leave the config untouched.
 */
public final class IniConfigLoader {

    public static final String SECTION = "runner";

    private IniConfigLoader() {
    }

    /**
     * Apply the {@code [runner]} section of the file onto the given config.
     *
     * @throws IOException              if the file cannot be read or parsed
     * @throws IllegalArgumentException if {@code jobs} is not a positive integer
     */
    public static RunnerConfig apply(RunnerConfig config, Path iniFile) throws IOException {
        Ini ini = new Ini();
        // keep backslashes in Windows paths
        ini.getConfig().setEscape(false);
        ini.load(iniFile.toFile());
        Profile.Section runner = ini.get(SECTION);
        if (runner == null) {
            throw new IOException("missing [" + SECTION + "] section in " + iniFile);
        }

        String tool = opt(runner, "tool");
        if (tool != null) config.withToolPath(tool);

        String image = opt(runner, "image");
        if (image != null) config.withImagePath(image);

        String modules = opt(runner, "modules");
        if (modules != null) config.withModulesPath(modules);

        String output = opt(runner, "output");
        if (output != null) config.withOutputDir(output);

        String jobs = opt(runner, "jobs");
        if (jobs != null) config.withConcurrency(RunnerConfig.parseConcurrency(jobs, iniFile + " [runner] jobs"));

        return config;
    }

    private static String opt(Profile.Section s, String key) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
