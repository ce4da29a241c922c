package statemigrator.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import statemigrator.exceptions.ValidationException;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InputValidator")
class InputValidatorTest {

    @Nested
    @DisplayName("repository names")
    class RepoNames {

        @ParameterizedTest
        @ValueSource(strings = {"network-core", "app_v2", "infra.tf", "A1"})
        @DisplayName("should accept platform-grammar names")
        void shouldAcceptValidNames(String name) {
            assertThatCode(() -> InputValidator.validateRepoName(name)).doesNotThrowAnyException();
        }

        @ParameterizedTest
        @ValueSource(strings = {"../../etc", "repo;rm -rf", "a b", "$(whoami)", "-flag", "repo`x`"})
        @DisplayName("should reject unsafe names")
        void shouldRejectUnsafeNames(String name) {
            assertThatThrownBy(() -> InputValidator.validateRepoName(name))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageStartingWith("Invalid repository");
        }

        @Test
        @DisplayName("should reject blank and overlong names")
        void shouldRejectBlankAndOverlong() {
            assertThatThrownBy(() -> InputValidator.validateRepoName(" ")).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> InputValidator.validateRepoName("a".repeat(InputValidator.MAX_NAME_LENGTH + 1)))
                    .hasMessageContaining("longer than");
        }

        @Test
        @DisplayName("should report parent-directory segments before other problems")
        void shouldReportParentSegment() {
            assertThatThrownBy(() -> InputValidator.validateRepoName("../../etc"))
                    .hasMessageContaining("parent-directory");
        }
    }

    @Nested
    @DisplayName("branch names")
    class BranchNames {

        @ParameterizedTest
        @ValueSource(strings = {"migrate-to-s3-backend", "feature/s3", "release-1.2"})
        @DisplayName("should accept ref-safe names")
        void shouldAccept(String branch) {
            assertThatCode(() -> InputValidator.validateBranchName(branch)).doesNotThrowAnyException();
        }

        @ParameterizedTest
        @ValueSource(strings = {"a..b", "-x", "x.lock", "x@{1}", "feature/", "x y"})
        @DisplayName("should reject names git would refuse")
        void shouldReject(String branch) {
            assertThatThrownBy(() -> InputValidator.validateBranchName(branch))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("paths")
    class Paths {

        @TempDir
        Path root;

        @Test
        @DisplayName("should accept a child of the working directory")
        void shouldAcceptChild() {
            assertThatCode(() -> InputValidator.validatePathWithin(root, root.resolve("network-core")))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should reject a path escaping the working directory")
        void shouldRejectEscape() {
            assertThatThrownBy(() -> InputValidator.validatePathWithin(root, root.resolve("../../etc")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("outside the working directory");
        }

        @Test
        @DisplayName("should reject the working directory itself")
        void shouldRejectRoot() {
            assertThatThrownBy(() -> InputValidator.validatePathWithin(root, root.resolve(".")))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("should reject absolute path fragments")
        void shouldRejectAbsoluteFragment() {
            assertThatThrownBy(() -> InputValidator.validatePath("/etc/passwd"))
                    .hasMessageContaining("must be relative");
        }
    }

    @Test
    @DisplayName("should reject concurrency below one and only warn above the recommendation")
    void shouldValidateBatchSize() {
        assertThatThrownBy(() -> InputValidator.validateBatchSize(0, 10))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("at least 1");
        assertThatCode(() -> InputValidator.validateBatchSize(25, 10)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should validate region and bucket formats")
    void shouldValidateRegionAndBucket() {
        assertThatCode(() -> InputValidator.validateRegion("eu-central-1")).doesNotThrowAnyException();
        assertThatCode(() -> InputValidator.validateBucket("acme-tfstate.prod")).doesNotThrowAnyException();

        assertThatThrownBy(() -> InputValidator.validateRegion("us_east_1")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> InputValidator.validateBucket("Acme_State")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> InputValidator.validateBucket("ab")).isInstanceOf(ValidationException.class);
    }
}
