package com.tgarchitect.core.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TerragruntFileDetector}.
 */
class TerragruntFileDetectorTest {

    @Test
    void canParse_terragruntHcl_acceptedWithoutContent() {
        assertThat(TerragruntFileDetector.canParse(Path.of("live/prod/terragrunt.hcl"), null)).isTrue();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "root.hcl|remote_state {|true",
        "env.hcl|  include \"root\" {|true",
        "common.hcl|x = find_in_parent_folders()|true",
        "vars.hcl|region = \"eu-west-1\"|false",
        "main.tf|terraform {|false"
    })
    void canParse_otherFiles_dependOnContent(String name, String content, boolean expected) {
        assertThat(TerragruntFileDetector.canParse(Path.of(name), content)).isEqualTo(expected);
    }

    @Test
    void canParse_hclWithoutContent_isRejected() {
        assertThat(TerragruntFileDetector.canParse(Path.of("root.hcl"), null)).isFalse();
    }

    @Test
    void matchesPattern_globOnFileName() {
        assertThat(TerragruntFileDetector.matchesPattern(Path.of("a/b/env.hcl"), List.of("*.hcl"))).isTrue();
        assertThat(TerragruntFileDetector.matchesPattern(Path.of("a/b/main.tf"), List.of("terragrunt.hcl", "*.hcl")))
            .isFalse();
    }
}
