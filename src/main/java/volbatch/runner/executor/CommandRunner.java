package volbatch.runner.executor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs an external command to completion with its standard output sent to a file.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * Run the command and wait for it to exit.
     *
     * @param command    executable followed by its arguments
     * @param stdoutFile file receiving standard output; truncated first
     * @return process exit code
     * @throws IOException          if the process cannot be started
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    int run(List<String> command, Path stdoutFile) throws IOException, InterruptedException;
}
