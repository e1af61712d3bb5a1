package com.tgarchitect.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link IdGenerator}.
 */
class IdGeneratorTest {

    @Test
    void generate_withSingleComponent_returnsDeterministicId() {
        String id1 = IdGenerator.generate("live/prod/vpc/terragrunt.hcl");
        String id2 = IdGenerator.generate("live/prod/vpc/terragrunt.hcl");

        assertThat(id1).isEqualTo(id2);
        assertThat(id1).hasSize(IdGenerator.ID_LENGTH);
    }

    @Test
    void generate_withMultipleComponents_joinsWithColon() {
        String id = IdGenerator.generate("scan-1", "live/prod/vpc/terragrunt.hcl");

        assertThat(id).isEqualTo(IdGenerator.generateFromString("scan-1:live/prod/vpc/terragrunt.hcl"));
    }

    @Test
    void generate_withDifferentScans_returnsDifferentIds() {
        String id1 = IdGenerator.generate("scan-1", "live/vpc/terragrunt.hcl");
        String id2 = IdGenerator.generate("scan-2", "live/vpc/terragrunt.hcl");

        assertThat(id1).isNotEqualTo(id2);
    }

    @Test
    void generate_withNullComponents_throwsException() {
        assertThatThrownBy(() -> IdGenerator.generate((String[]) null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("At least one component required");
    }

    @Test
    void generate_withEmptyArray_throwsException() {
        assertThatThrownBy(() -> IdGenerator.generate())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("At least one component required");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "\t", "\n"})
    void generateFromString_withInvalidInput_throwsException(String input) {
        assertThatThrownBy(() -> IdGenerator.generateFromString(input))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Input must not be null or blank");
    }

    @Test
    void generateFullHash_withKnownInput_returnsSha256() {
        String hash = IdGenerator.generateFullHash("abc");

        assertThat(hash)
            .hasSize(64)
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void generateFromString_isPrefixOfFullHash() {
        assertThat(IdGenerator.generateFullHash("abc")).startsWith(IdGenerator.generateFromString("abc"));
    }
}
