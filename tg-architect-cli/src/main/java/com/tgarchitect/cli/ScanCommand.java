package com.tgarchitect.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tgarchitect.core.config.TerragruntConfig;
import com.tgarchitect.core.error.ConfigurationException;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.scanner.ScanContext;
import com.tgarchitect.core.scanner.ScanResult;
import com.tgarchitect.core.scanner.TerragruntScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to scan a Terragrunt repository into a graph.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load configuration from YAML and the environment</li>
 *   <li>Discover, parse and resolve configuration files</li>
 *   <li>Create nodes and edges, link Terraform sources</li>
 *   <li>Build the dependency graph and execution order</li>
 *   <li>Print a summary and optionally write the graph as JSON</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Scan current directory
 * tgarchitect scan
 *
 * # Scan a directory and export the graph
 * tgarchitect scan live -o graph.json --threads 8
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Scan a Terragrunt repository and build its configuration graph",
    mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Parameters(
        index = "0",
        description = "Directory to scan (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: tg-architect.yaml in the scanned directory)"
    )
    private Path configPath;

    @Option(
        names = {"-o", "--output"},
        description = "Write the graph as JSON to this file"
    )
    private Path outputFile;

    @Option(
        names = {"--scan-id"},
        description = "Scan identifier (default: random UUID)"
    )
    private String scanId;

    @Option(
        names = {"--threads"},
        description = "Parser threads (default: available processors)",
        defaultValue = "0"
    )
    private int threads;

    @Override
    public Integer call() {
        try {
            Path root = projectPath.toAbsolutePath().normalize();
            log.info("Starting scan of: {}", root);
            System.out.println("Scanning: " + root);
            System.out.println();

            TerragruntConfig config = CliConfiguration.load(root, configPath, System.getenv());
            ScanResult result = new TerragruntScanner(config).scan(new ScanContext(root, scanId, threads, null));

            printSummary(result);

            if (outputFile != null) {
                writeReport(result);
                System.out.println("✓ Wrote graph to: " + outputFile.toAbsolutePath());
            }

            if (!result.success()) {
                System.err.println("✗ Scan did not complete");
                return 1;
            }
            System.out.println();
            System.out.println("✓ Scan complete");
            return 0;

        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.err.println("✗ Invalid configuration:");
            e.getErrors().forEach(issue -> System.err.println("  - " + issue.field() + ": " + issue.message()));
            return 1;
        } catch (Exception e) {
            log.error("Scan failed", e);
            System.err.println("✗ Scan failed: " + e.getMessage());
            return 1;
        }
    }

    private void printSummary(ScanResult result) {
        System.out.println("✓ " + result.statistics().getSummary());
        System.out.println("  Errors: " + result.errors().size() + ", Warnings: " + result.warnings().size());

        if (!result.graph().executionOrder().isEmpty()) {
            System.out.println();
            System.out.println("Execution order:");
            int step = 1;
            for (String file : result.graph().executionOrder()) {
                System.out.println("  " + step++ + ". " + relativize(file));
            }
        }

        if (result.hasCycles()) {
            System.out.println();
            System.out.println("⚠ Dependency cycles:");
            result.graph().cycles().forEach(cycle -> System.out.println("  - " + cycle.message()));
        }

        if (!result.errors().isEmpty()) {
            System.out.println();
            System.out.println("Errors:");
            for (ParseError error : result.errors()) {
                System.out.println("  - " + error);
            }
        }
        if (log.isDebugEnabled()) {
            result.warnings().forEach(warning -> log.debug("Warning: {}", warning));
        }
    }

    private void writeReport(ScanResult result) throws IOException {
        Path target = outputFile.toAbsolutePath();
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        JSON_MAPPER.writeValue(target.toFile(), ScanReport.from(result));
        log.debug("Wrote scan report to {}", target);
    }

    private String relativize(String file) {
        Path root = projectPath.toAbsolutePath().normalize();
        Path path = Path.of(file);
        return path.startsWith(root) ? root.relativize(path).toString() : file;
    }
}
