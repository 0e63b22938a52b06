package volbatch.runner.config;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;

/**
 * Command line surface of the runner.
 * Settings are layered: defaults, then {@code -c} INI file, then environment, then flags.
 */
public final class CommandLineOptions {

    public static final String TOOL_OPT = "tool";
    public static final String IMAGE_OPT = "image";
    public static final String MODULES_OPT = "modules";
    public static final String OUTPUT_OPT = "output";
    public static final String JOBS_OPT = "jobs";
    public static final String CONFIG_OPT = "config";
    public static final String HELP_OPT = "help";

    private static final String SYNTAX = "volbatch -p <tool> -i <image> -m <modules> -o <output> [-j <n>] [-c <ini>]";
    private static final String HEADER = "Runs every module of the list against a memory image, a few at a time.\n\n";
    private static final String FOOTER = "\nPress Enter during execution to print the currently running modules.\n"
            + "Example:\n"
            + "  volbatch -p /usr/local/bin/vol -i /cases/image.dd -m modules.txt -o /cases/out/";

    private final CommandLine parsed;

    private CommandLineOptions(CommandLine parsed) {
        this.parsed = parsed;
    }

    public static Options options() {
        Options options = new Options();
        options.addOption(new Option("p", TOOL_OPT, true, "Path to the analysis executable"));
        options.addOption(new Option("i", IMAGE_OPT, true, "Path to the memory image"));
        options.addOption(new Option("m", MODULES_OPT, true, "File listing modules, one per line"));
        options.addOption(new Option("o", OUTPUT_OPT, true, "Output directory"));
        options.addOption(new Option("j", JOBS_OPT, true,
                "Modules run at once (default: available processors - 1, at least 1)"));
        options.addOption(new Option("c", CONFIG_OPT, true, "INI file with a [runner] section"));
        options.addOption(new Option("h", HELP_OPT, false, "Shows the help message"));
        return options;
    }

    public static CommandLineOptions parse(String[] args) throws ParseException {
        return new CommandLineOptions(new DefaultParser().parse(options(), args));
    }

    public boolean helpRequested() {
        return parsed.hasOption(HELP_OPT);
    }

    /**
     * Build the effective config for this command line.
     *
     * @param env environment variables
     * @throws ParseException if a value is malformed
     * @throws IOException    if the INI file cannot be read
     */
    public RunnerConfig toConfig(Map<String, String> env) throws ParseException, IOException {
        RunnerConfig config = RunnerConfig.defaults();
        try {
            if (parsed.hasOption(CONFIG_OPT)) {
                IniConfigLoader.apply(config, Path.of(parsed.getOptionValue(CONFIG_OPT)));
            }
            config.withEnv(env);

            if (parsed.hasOption(TOOL_OPT)) config.withToolPath(parsed.getOptionValue(TOOL_OPT));
            if (parsed.hasOption(IMAGE_OPT)) config.withImagePath(parsed.getOptionValue(IMAGE_OPT));
            if (parsed.hasOption(MODULES_OPT)) config.withModulesPath(parsed.getOptionValue(MODULES_OPT));
            if (parsed.hasOption(OUTPUT_OPT)) config.withOutputDir(parsed.getOptionValue(OUTPUT_OPT));
            if (parsed.hasOption(JOBS_OPT)) {
                config.withConcurrency(RunnerConfig.parseConcurrency(parsed.getOptionValue(JOBS_OPT), "-j"));
            }
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage());
        }
        return config;
    }

    public static void printHelp(PrintWriter out) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(out, HelpFormatter.DEFAULT_WIDTH, SYNTAX, HEADER, options(),
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, FOOTER);
        out.flush();
    }
}
