package com.tgarchitect.cli;

import com.tgarchitect.core.config.TerragruntConfig;
import com.tgarchitect.core.error.ConfigurationException;
import com.tgarchitect.core.model.TerragruntFile;
import com.tgarchitect.core.scanner.ScanContext;
import com.tgarchitect.core.scanner.ScanResult;
import com.tgarchitect.core.scanner.TerragruntScanner;
import com.tgarchitect.core.validation.ValidationIssue;
import com.tgarchitect.core.validation.ValidationOptions;
import com.tgarchitect.core.validation.ValidationResult;
import com.tgarchitect.core.validation.ValidationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to validate Terragrunt configurations.
 *
 * <p>Parses and resolves every configuration under the directory, runs the validation
 * rules on each file and reports dependency cycles. Exits with 1 when any error-level
 * issue is found.
 */
@Command(
    name = "validate",
    description = "Validate Terragrunt configurations against the built-in rules",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Directory to validate (default: current directory)", defaultValue = ".")
    private Path projectPath;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: tg-architect.yaml)")
    private Path configPath;

    @Option(names = {"--disable"}, split = ",", description = "Rule ids to skip, e.g. TG030,TG032")
    private List<String> disabledRules = List.of();

    @Option(names = {"--no-best-practices"}, description = "Skip the TG03x best-practice rules")
    private boolean noBestPractices;

    @Override
    public Integer call() {
        try {
            Path root = projectPath.toAbsolutePath().normalize();
            log.info("Validating configurations under: {}", root);

            TerragruntConfig config = CliConfiguration.load(root, configPath, System.getenv());
            ScanResult scan = new TerragruntScanner(config).scan(ScanContext.of(root));
            ValidationService service = new ValidationService(ValidationOptions.defaults()
                .withBestPractices(!noBestPractices)
                .withDisabledRules(new HashSet<>(disabledRules)));

            int errors = 0;
            int warnings = 0;
            for (TerragruntFile file : scan.files()) {
                ValidationResult result = service.validate(file);
                errors += result.errorCount();
                warnings += result.warningCount();
                print(root, file, result);
            }
            ValidationResult graphResult = service.validateGraph(scan.graph());
            errors += graphResult.errorCount();
            graphResult.issues().forEach(issue -> System.out.println("  " + issue));

            System.out.println();
            System.out.println("Validated " + scan.files().size() + " files: "
                + errors + " errors, " + warnings + " warnings");
            if (errors > 0) {
                System.err.println("✗ Validation failed");
                return 1;
            }
            System.out.println("✓ Validation passed");
            return 0;

        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.err.println("✗ Invalid configuration:");
            e.getErrors().forEach(issue -> System.err.println("  - " + issue.field() + ": " + issue.message()));
            return 1;
        } catch (Exception e) {
            log.error("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }

    private static void print(Path root, TerragruntFile file, ValidationResult result) {
        if (result.issues().isEmpty()) {
            return;
        }
        Path path = Path.of(file.path());
        System.out.println(path.startsWith(root) ? root.relativize(path) : path);
        for (ValidationIssue issue : result.issues()) {
            System.out.println("  " + issue);
        }
    }
}
