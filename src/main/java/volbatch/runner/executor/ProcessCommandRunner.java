package volbatch.runner.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Standard error is discarded.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public int run(List<String> command, Path stdoutFile) throws IOException, InterruptedException {
        Process p = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.to(stdoutFile.toFile()))
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .redirectInput(ProcessBuilder.Redirect.PIPE)
                .start();
        // operator keystrokes belong to the status monitor, not the tool
        p.getOutputStream().close();
        try {
            return p.waitFor();
        } catch (InterruptedException e) {
            log.debug("Interrupted waiting for {}, destroying pid {}", command.get(0), p.pid());
            p.destroy();
            throw e;
        }
    }
}
