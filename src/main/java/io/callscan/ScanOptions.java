package io.callscan;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Options shared by every subcommand.
 */
public class ScanOptions {

    @Parameters(index = "0", paramLabel = "<root>",
            description = "Root directory of the Go source tree")
    Path projectPath;

    @Option(names = {"-c", "--config"},
            description = "Path to YAML configuration file")
    Path configPath;

    @Option(names = {"-v", "--verbose"},
            description = "Log debug output")
    boolean verbose = false;

    @Option(names = {"--include-tests"},
            description = "Also index _test.go files")
    boolean includeTests = false;

    @Option(names = {"--threads"},
            description = "Worker threads for parsing and resolution (default: available processors)")
    int threads = 0;

    /**
     * Builds the effective configuration: file values first, command line overrides.
     */
    ScanConfig loadConfig() throws IOException {
        if (verbose) {
            Logger logger = (Logger) LoggerFactory.getLogger("io.callscan");
            logger.setLevel(Level.DEBUG);
        }

        ScanConfig config = ScanConfig.defaults();
        if (configPath != null) {
            if (!Files.exists(configPath)) {
                throw new IOException("Config file does not exist: " + configPath);
            }
            config = ScanConfig.load(configPath);
        }
        if (includeTests) {
            config = config.withIncludeTestFiles(true);
        }
        if (threads > 0) {
            config = config.withThreads(threads);
        }
        return config;
    }

    Path projectPath() throws IOException {
        if (!Files.exists(projectPath)) {
            throw new IOException("Project path does not exist: " + projectPath);
        }
        return projectPath;
    }
}
