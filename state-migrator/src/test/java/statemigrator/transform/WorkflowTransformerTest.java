package statemigrator.transform;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WorkflowTransformer")
class WorkflowTransformerTest {

    private final WorkflowTransformer transformer = new WorkflowTransformer("GITHUB_TOKEN", "gh-readaccess-pat");

    @Test
    @DisplayName("should add the entry to an existing top-level env map")
    void shouldAddToExistingEnv() {
        String workflow = """
                name: plan
                env:
                  AWS_REGION: us-east-1
                jobs:
                  plan:
                    steps:
                      - run: terraform plan
                """;

        TextRewrite rewrite = transformer.inject(workflow);

        assertThat(rewrite.changed()).isTrue();
        assertThat(rewrite.text()).isEqualTo("""
                name: plan
                env:
                  GITHUB_TOKEN: ${{ secrets.gh-readaccess-pat }}
                  AWS_REGION: us-east-1
                jobs:
                  plan:
                    steps:
                      - run: terraform plan
                """);
    }

    @Test
    @DisplayName("should create an env map before jobs when missing")
    void shouldCreateEnvBeforeJobs() {
        String workflow = "name: apply\non: push\njobs:\n  apply:\n    steps:\n      - run: terraform apply\n";

        TextRewrite rewrite = transformer.inject(workflow);

        assertThat(rewrite.text()).isEqualTo("name: apply\non: push\n"
                + "env:\n  GITHUB_TOKEN: ${{ secrets.gh-readaccess-pat }}\n\n"
                + "jobs:\n  apply:\n    steps:\n      - run: terraform apply\n");
    }

    @Test
    @DisplayName("should skip workflows that do not run terraform")
    void shouldSkipNonTerraformWorkflows() {
        String workflow = "name: lint\njobs:\n  lint:\n    steps:\n      - run: npm test\n";

        assertThat(transformer.needsInjection(workflow)).isFalse();
        assertThat(transformer.inject(workflow).changed()).isFalse();
    }

    @Test
    @DisplayName("should be idempotent")
    void shouldBeIdempotent() {
        String workflow = "jobs:\n  plan:\n    steps:\n      - run: terraform plan\n";
        String once = transformer.inject(workflow).text();

        TextRewrite twice = transformer.inject(once);

        assertThat(twice.changed()).isFalse();
        assertThat(twice.text()).isEqualTo(once);
    }

    @Test
    @DisplayName("should leave a flow-style env map untouched")
    void shouldLeaveFlowStyleEnv() {
        String workflow = "env: {AWS_REGION: us-east-1}\njobs:\n  plan:\n    steps:\n      - run: terraform plan\n";

        assertThat(transformer.inject(workflow).changed()).isFalse();
    }
}
