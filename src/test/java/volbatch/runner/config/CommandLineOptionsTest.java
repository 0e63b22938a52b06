package volbatch.runner.config;

import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineOptionsTest {

    @TempDir
    Path dir;

    @Test
    void shortFlags() throws Exception {
        RunnerConfig config = CommandLineOptions.parse(new String[] {
                "-p", "/usr/bin/vol", "-i", "/cases/img.dd", "-m", "mods.txt", "-o", "out", "-j", "2"
        }).toConfig(Map.of());

        assertEquals("/usr/bin/vol", config.toolPath());
        assertEquals("/cases/img.dd", config.imagePath());
        assertEquals("mods.txt", config.modulesPath());
        assertEquals("out", config.outputDir());
        assertEquals(2, config.concurrency());
        assertTrue(config.isComplete());
    }

    @Test
    void longFlags() throws Exception {
        RunnerConfig config = CommandLineOptions.parse(new String[] {
                "--tool", "vol", "--image", "img", "--modules", "m.txt", "--output", "o"
        }).toConfig(Map.of());

        assertTrue(config.isComplete());
        assertNull(config.concurrency());
    }

    @Test
    void layering() throws IOException, ParseException {
        Path ini = dir.resolve("run.ini");
        Files.writeString(ini, "[runner]\ntool = ini-tool\nimage = ini-image\nmodules = ini-mods\njobs = 5\n");

        RunnerConfig config = CommandLineOptions.parse(new String[] {"-c", ini.toString(), "-m", "cli-mods"})
                .toConfig(Map.of(RunnerConfig.ENV_IMAGE, "env-image", RunnerConfig.ENV_MODULES, "env-mods"));

        assertEquals("ini-tool", config.toolPath());
        assertEquals("env-image", config.imagePath());
        assertEquals("cli-mods", config.modulesPath());
        assertNull(config.outputDir());
        assertEquals(5, config.concurrency());
    }

    @Test
    void helpFlag() throws ParseException {
        assertTrue(CommandLineOptions.parse(new String[] {"-h"}).helpRequested());
        assertFalse(CommandLineOptions.parse(new String[] {"-p", "vol"}).helpRequested());
    }

    @Test
    void badJobsValueIsParseError() throws ParseException {
        CommandLineOptions cli = CommandLineOptions.parse(new String[] {"-j", "none"});

        assertThrows(ParseException.class, () -> cli.toConfig(Map.of()));
    }

    @Test
    void unknownFlagIsParseError() {
        assertThrows(ParseException.class, () -> CommandLineOptions.parse(new String[] {"--bogus"}));
    }

    @Test
    void helpTextMentionsEnterKey() {
        StringWriter sw = new StringWriter();
        CommandLineOptions.printHelp(new PrintWriter(sw));

        String help = sw.toString();
        assertTrue(help.contains("--modules"));
        assertTrue(help.contains("Press Enter"));
    }
}
