package com.tgarchitect.cli;

import com.tgarchitect.TgArchitectCLI;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void validate_cleanRepository_returnsZero() throws IOException {
        write("vpc/terragrunt.hcl", """
            terraform {
              source = "../modules/vpc"
            }
            """);

        int exitCode = TgArchitectCLI.commandLine().execute("-q", "validate", tempDir.toString());

        assertThat(exitCode).isZero();
    }

    @Test
    void validate_dependencyWithoutConfigPath_returnsOne() throws IOException {
        write("app/terragrunt.hcl", """
            dependency "vpc" {
              skip_outputs = true
            }
            """);

        int exitCode = TgArchitectCLI.commandLine().execute("-q", "validate", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void validate_unknownOption_returnsUsageError() {
        int exitCode = TgArchitectCLI.commandLine().execute("validate", "--no-such-flag");

        assertThat(exitCode).isEqualTo(2);
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
