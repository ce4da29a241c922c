package statemigrator.exceptions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StageException")
class StageExceptionTest {

    @Nested
    @DisplayName("constructor with message only")
    class ConstructorWithMessageOnly {

        @Test
        @DisplayName("should store message")
        void shouldStoreMessage() {
            StageException ex = new StageException("Clone failed");

            assertThat(ex.getMessage()).isEqualTo("Clone failed");
            assertThat(ex.getReason()).isEqualTo("Clone failed");
        }

        @Test
        @DisplayName("should have null context fields")
        void shouldHaveNullContext() {
            StageException ex = new StageException("Error");

            assertThat(ex.getStage()).isNull();
            assertThat(ex.getRepository()).isNull();
            assertThat(ex.getCause()).isNull();
        }
    }

    @Nested
    @DisplayName("constructor with full context")
    class ConstructorWithContext {

        @Test
        @DisplayName("should append stage and repository to the message")
        void shouldAppendContext() {
            IOException cause = new IOException("disk");
            StageException ex = new StageException("Write failed", "BackendUpdate", "svc", cause);

            assertThat(ex.getMessage()).isEqualTo("Write failed [stage=BackendUpdate] [repo=svc]");
            assertThat(ex.getReason()).isEqualTo("Write failed");
            assertThat(ex.getCause()).isSameAs(cause);
        }
    }
}
