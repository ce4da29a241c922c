package statemigrator.stage.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import statemigrator.exec.CommandRequest;
import statemigrator.exec.ScriptedCommandRunner;
import statemigrator.stage.StageResult;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("VerifyStage")
class VerifyStageTest {

    private static final String LOCATION = "s3://acme-tfstate/svc/terraform.tfstate";

    @TempDir
    Path workDir;

    @Test
    @DisplayName("should record the verified state location as reference")
    void shouldRecordLocation() {
        StageFixture fixture = new StageFixture(workDir);
        ScriptedCommandRunner runner = new ScriptedCommandRunner()
                .stdout("aws s3api head-object", "{\"ContentLength\": 48213, \"ContentType\": \"application/json\"}\n");

        StageResult result = fixture.execute(new VerifyStage(runner));

        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.reference()).isEqualTo(LOCATION);
        CommandRequest request = runner.requests().get(0);
        assertThat(request.argv()).containsExactly("aws", "s3api", "head-object",
                "--bucket", "acme-tfstate", "--key", "svc/terraform.tfstate",
                "--profile", "migration", "--region", "us-east-1");
    }

    @Test
    @DisplayName("should fail when the lookup returns nothing")
    void shouldFailWhenObjectMissing() {
        StageFixture fixture = new StageFixture(workDir);

        StageResult result = fixture.execute(new VerifyStage(new ScriptedCommandRunner()));

        assertThat(result.haltsPipeline()).isTrue();
        assertThat(result.message()).isEqualTo("State object not found at " + LOCATION);
        assertThat(result.reference()).isNull();
    }

    @Test
    @DisplayName("should fail when only a similarly named object exists")
    void shouldFailOnMissingExactKey() {
        StageFixture fixture = new StageFixture(workDir);
        ScriptedCommandRunner runner = new ScriptedCommandRunner()
                .fail("aws s3api head-object", "An error occurred (404) when calling the HeadObject operation: Not Found");

        StageResult result = fixture.execute(new VerifyStage(runner));

        assertThat(result.haltsPipeline()).isTrue();
        assertThat(result.message()).isEqualTo("State object not found at " + LOCATION);
    }
}
