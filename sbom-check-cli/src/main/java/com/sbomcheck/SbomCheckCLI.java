package com.sbomcheck;

import com.sbomcheck.cli.CheckCommand;
import com.sbomcheck.cli.RulesCommand;
import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for SBOM Check.
 *
 * <p>SBOM Check validates SPDX JSON documents against the SPDX specification and a set
 * of completeness rules (suppliers, copyright text, license evidence).
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code check} - Check every SPDX JSON document in a folder</li>
 *   <li>{@code rules} - List the completeness rule stages</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Check a folder and print the results
 * sbomcheck check ./sboms --print-console
 *
 * # Also write results.json
 * sbomcheck check ./sboms --print-console --print-json
 * }</pre>
 */
@Command(
    name = "sbomcheck",
    mixinStandardHelpOptions = true,
    version = "SBOM Check 1.0.0-SNAPSHOT",
    description = "Completeness checks for SPDX Software Bill of Materials documents",
    subcommands = {
        CheckCommand.class,
        RulesCommand.class
    }
)
public class SbomCheckCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SbomCheckCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("SBOM Check - Completeness checks for SPDX documents");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'sbomcheck --help' to see available commands");
        System.out.println("Use 'sbomcheck <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        SbomCheckCLI cli = new SbomCheckCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
