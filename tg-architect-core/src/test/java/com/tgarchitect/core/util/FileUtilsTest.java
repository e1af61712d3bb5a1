package com.tgarchitect.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void findFiles_withMatchingPattern_returnsFilesAtAnyDepth() throws IOException {
        Path unit = write("live/prod/vpc/terragrunt.hcl");
        Path root = write("terragrunt.hcl");
        write("live/prod/vpc/main.tf");

        List<Path> files = FileUtils.findFiles(tempDir, List.of("terragrunt.hcl"), List.of(), false, 0);

        assertThat(files).containsExactlyInAnyOrder(unit, root);
    }

    @Test
    void findFiles_withWildcardPattern_returnsMatchingFiles() throws IOException {
        Path hcl = write("root.hcl");
        write("readme.md");

        List<Path> files = FileUtils.findFiles(tempDir, List.of("*.hcl"), List.of(), false, 0);

        assertThat(files).containsExactly(hcl);
    }

    @Test
    void findFiles_excludedDirectory_isNotEntered() throws IOException {
        Path kept = write("live/app/terragrunt.hcl");
        write("live/app/.terragrunt-cache/x/terragrunt.hcl");
        write("node_modules/pkg/terragrunt.hcl");

        List<Path> files = FileUtils.findFiles(tempDir, List.of("terragrunt.hcl"),
            List.of(".terragrunt-cache", "node_modules"), false, 0);

        assertThat(files).containsExactly(kept);
    }

    @Test
    void findFiles_maxDepth_limitsWalk() throws IOException {
        Path shallow = write("a/terragrunt.hcl");
        write("a/b/c/terragrunt.hcl");

        List<Path> files = FileUtils.findFiles(tempDir, List.of("terragrunt.hcl"), List.of(), false, 2);

        assertThat(files).containsExactly(shallow);
    }

    @Test
    void findFiles_blankPatterns_areIgnored() throws IOException {
        write("terragrunt.hcl");

        List<Path> files = FileUtils.findFiles(tempDir, List.of(" "), List.of(""), false, 0);

        assertThat(files).isEmpty();
    }

    @Test
    void readString_usesCharset() throws IOException {
        Path file = tempDir.resolve("latin.hcl");
        Files.write(file, "region = \"é\"".getBytes(StandardCharsets.ISO_8859_1));

        assertThat(FileUtils.readString(file, StandardCharsets.ISO_8859_1)).isEqualTo("region = \"é\"");
    }

    @Test
    void getExtension_variousNames() {
        assertThat(FileUtils.getExtension(Path.of("terragrunt.hcl"))).isEqualTo("hcl");
        assertThat(FileUtils.getExtension(Path.of("archive.tar.gz"))).isEqualTo("gz");
        assertThat(FileUtils.getExtension(Path.of(".terraform"))).isEmpty();
        assertThat(FileUtils.getExtension(Path.of("Makefile"))).isEmpty();
    }

    private Path write(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "x");
        return file;
    }
}
