package com.tgarchitect;

import ch.qos.logback.classic.Level;
import com.tgarchitect.cli.ScanCommand;
import com.tgarchitect.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for TG Architect.
 *
 * <p>TG Architect scans Terragrunt repositories and builds a graph of configurations,
 * Terraform modules and the relationships between them.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code scan} - Scan a directory and print or export the graph</li>
 *   <li>{@code validate} - Check configurations against the validation rules</li>
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
 * # Scan the live directory and write the graph as JSON
 * tgarchitect scan live -o graph.json
 *
 * # Validate with debug logging
 * tgarchitect -v validate live
 * }</pre>
 */
@Command(
    name = "tgarchitect",
    mixinStandardHelpOptions = true,
    version = "TG Architect 1.0.0-SNAPSHOT",
    description = "Terragrunt configuration graph builder",
    subcommands = {
        ScanCommand.class,
        ValidateCommand.class
    }
)
public class TgArchitectCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("TG Architect - Terragrunt configuration graph builder");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'tgarchitect --help' to see available commands");
        System.out.println("Use 'tgarchitect <command> --help' for command-specific help");
    }

    /**
     * Configures the root log level from the global options.
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
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        TgArchitectCLI cli = new TgArchitectCLI();
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
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
