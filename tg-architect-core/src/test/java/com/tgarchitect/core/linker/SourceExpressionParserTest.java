package com.tgarchitect.core.linker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SourceExpressionParser}.
 */
class SourceExpressionParserTest {

    @ParameterizedTest
    @CsvSource({
        "./modules/vpc, LOCAL",
        "../../modules/vpc, LOCAL",
        "/opt/modules/vpc, LOCAL",
        "git::https://github.com/org/repo.git//modules/vpc?ref=v1.0, GIT",
        "git@github.com:org/repo.git, GIT",
        "github.com/org/repo, GIT",
        "https://example.com/org/repo.git, GIT",
        "terraform-aws-modules/vpc/aws, REGISTRY",
        "registry.terraform.io/terraform-aws-modules/vpc/aws, REGISTRY",
        "tfr:///terraform-aws-modules/vpc/aws?version=5.0.0, REGISTRY",
        "app.terraform.io/acme/vpc/aws, REGISTRY",
        "s3::https://s3-eu-west-1.amazonaws.com/bucket/vpc.zip, S3",
        "gcs::https://www.googleapis.com/storage/v1/bucket/vpc.zip, GCS",
        "https://example.com/vpc.zip, HTTP",
        "vpc, UNKNOWN"
    })
    void classify_knownShapes_returnsType(String source, SourceType expected) {
        assertThat(SourceExpressionParser.classify(source)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    void parseSource_blank_isUnknown(String source) {
        TerraformSourceExpression parsed = SourceExpressionParser.parseSource(source);

        assertThat(parsed.type()).isEqualTo(SourceType.UNKNOWN);
        assertThat(parsed.raw()).isEmpty();
    }

    @Test
    void parseSource_gitWithSubdirectoryAndRef_splitsComponents() {
        TerraformSourceExpression parsed =
            SourceExpressionParser.parseSource("git::https://github.com/org/repo.git//modules/vpc?ref=v1.0");

        assertThat(parsed.type()).isEqualTo(SourceType.GIT);
        assertThat(parsed.url()).isEqualTo("https://github.com/org/repo.git");
        assertThat(parsed.host()).isEqualTo("github.com");
        assertThat(parsed.getSubdirectory()).contains("modules/vpc");
        assertThat(parsed.getRef()).contains("v1.0");
        assertThat(parsed.versionConstraint()).isEqualTo("v1.0");
        assertThat(parsed.isExternal()).isTrue();
    }

    @Test
    void parseSource_scpStyleGit_readsHost() {
        TerraformSourceExpression parsed =
            SourceExpressionParser.parseSource("git@github.com:org/repo.git//vpc?ref=main");

        assertThat(parsed.host()).isEqualTo("github.com");
        assertThat(parsed.url()).isEqualTo("git@github.com:org/repo.git");
        assertThat(parsed.getSubdirectory()).contains("vpc");
        assertThat(parsed.getRef()).contains("main");
    }

    @Test
    void parseSource_registryWithVersion_extractsAddress() {
        TerraformSourceExpression parsed =
            SourceExpressionParser.parseSource("tfr:///terraform-aws-modules/vpc/aws?version=5.0.0");

        assertThat(parsed.type()).isEqualTo(SourceType.REGISTRY);
        assertThat(parsed.registryAddress()).isEqualTo("terraform-aws-modules/vpc/aws");
        assertThat(parsed.getVersion()).contains("5.0.0");
        assertThat(parsed.host()).isNull();
    }

    @Test
    void parseSource_privateRegistry_keepsHost() {
        TerraformSourceExpression parsed = SourceExpressionParser.parseSource("app.terraform.io/acme/vpc/aws");

        assertThat(parsed.host()).isEqualTo("app.terraform.io");
        assertThat(parsed.registryAddress()).isEqualTo("acme/vpc/aws");
    }

    @Test
    void parseSource_s3_extractsBucketAndPath() {
        TerraformSourceExpression parsed =
            SourceExpressionParser.parseSource("s3::https://s3-eu-west-1.amazonaws.com/my-bucket/modules/vpc.zip");

        assertThat(parsed.type()).isEqualTo(SourceType.S3);
        assertThat(parsed.host()).isEqualTo("s3-eu-west-1.amazonaws.com");
        assertThat(parsed.bucket()).isEqualTo("my-bucket");
        assertThat(parsed.getPath()).contains("modules/vpc.zip");
    }

    @Test
    void parseSource_gcs_extractsBucketAndPath() {
        TerraformSourceExpression parsed =
            SourceExpressionParser.parseSource("gcs::https://www.googleapis.com/storage/v1/modules-bucket/vpc.zip");

        assertThat(parsed.bucket()).isEqualTo("modules-bucket");
        assertThat(parsed.getPath()).contains("vpc.zip");
    }

    @Test
    void parseSource_localWithQuery_dropsQuery() {
        TerraformSourceExpression parsed = SourceExpressionParser.parseSource("  ../modules/vpc?ref=x ");

        assertThat(parsed.raw()).isEqualTo("../modules/vpc?ref=x");
        assertThat(parsed.getPath()).contains("../modules/vpc");
        assertThat(parsed.isExternal()).isFalse();
    }

    @Test
    void parseSource_hostWithoutScheme_splitsSubdirectory() {
        TerraformSourceExpression parsed = SourceExpressionParser.parseSource("github.com/org/repo//modules/x");

        assertThat(parsed.type()).isEqualTo(SourceType.GIT);
        assertThat(parsed.url()).isEqualTo("github.com/org/repo");
        assertThat(parsed.host()).isEqualTo("github.com");
        assertThat(parsed.getSubdirectory()).contains("modules/x");
    }
}
