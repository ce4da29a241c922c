package statemigrator.stage.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import statemigrator.exec.ScriptedCommandRunner;
import statemigrator.stage.StageResult;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WorkflowUpdateStage")
class WorkflowUpdateStageTest {

    @TempDir
    Path workDir;

    @Test
    @DisplayName("should inject the secret into terraform workflows only")
    void shouldInjectIntoTerraformWorkflows() throws Exception {
        StageFixture fixture = new StageFixture(workDir);
        Path plan = fixture.cloneWith(".github/workflows/plan.yml",
                "jobs:\n  plan:\n    steps:\n      - run: terraform plan\n");
        Path lint = fixture.cloneWith(".github/workflows/lint.yaml",
                "jobs:\n  lint:\n    steps:\n      - run: npm run lint\n");

        StageResult result = fixture.execute(new WorkflowUpdateStage(new ScriptedCommandRunner()));

        assertThat(result.message()).isEqualTo("Updated 1 workflow file(s)");
        assertThat(result.details()).containsExactly(".github/workflows/plan.yml");
        assertThat(StageFixture.read(plan)).contains("GITHUB_TOKEN: ${{ secrets.gh-readaccess-pat }}");
        assertThat(StageFixture.read(lint)).doesNotContain("GITHUB_TOKEN");
    }

    @Test
    @DisplayName("should succeed when the repository has no workflows")
    void shouldSucceedWithoutWorkflows() throws Exception {
        StageFixture fixture = new StageFixture(workDir);
        fixture.cloneWith("main.tf", "locals {}\n");

        StageResult result = fixture.execute(new WorkflowUpdateStage(new ScriptedCommandRunner()));

        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.message()).isEqualTo("No workflow files found");
    }
}
