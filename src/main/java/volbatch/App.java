package volbatch;

import volbatch.runner.config.CommandLineOptions;
import volbatch.runner.config.RunnerConfig;
import volbatch.runner.core.BatchSetupException;
import volbatch.runner.core.RunCoordinator;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Command line entry point.
 *
 * Exits 1 when the batch cannot start, 0 once every module has run, whatever
 * the individual outcomes.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        PrintWriter err = new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8));

        RunnerConfig config;
        try {
            CommandLineOptions cli = CommandLineOptions.parse(args);
            if (cli.helpRequested()) {
                CommandLineOptions.printHelp(err);
                return 0;
            }
            config = cli.toConfig(System.getenv());
        } catch (ParseException e) {
            err.println("Failed to parse arguments: " + e.getMessage());
            CommandLineOptions.printHelp(err);
            return 1;
        } catch (IOException e) {
            log.error("Error reading configuration file: {}", e.getMessage());
            return 1;
        }

        if (!config.isComplete()) {
            err.println("All of -p, -i, -m, -o are required; missing: " + String.join(", ", config.missingSettings()));
            CommandLineOptions.printHelp(err);
            return 1;
        }

        log.debug("Starting batch with {}", config);
        try {
            RunCoordinator.create(config).run();
            return 0;
        } catch (BatchSetupException e) {
            log.error(e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for modules to finish");
            return 1;
        }
    }
}
