package statemigrator.exceptions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Exception messages")
class ExceptionMessagesTest {

    @Test
    @DisplayName("timeout should name the executable and the limit")
    void timeoutMessage() {
        CommandTimeoutException ex = new CommandTimeoutException("terraform", Duration.ofMinutes(5));

        assertThat(ex).isInstanceOf(RuntimeException.class);
        assertThat(ex.getMessage()).isEqualTo("Command 'terraform' timed out after 300 s");
        assertThat(ex.getCommand()).isEqualTo("terraform");
        assertThat(ex.getTimeout()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("validation failure should name the field")
    void validationMessage() {
        ValidationException ex = new ValidationException("region", "'x' is not a region identifier");

        assertThat(ex.getField()).isEqualTo("region");
        assertThat(ex.getMessage()).isEqualTo("Invalid region: 'x' is not a region identifier");
    }

    @Test
    @DisplayName("environment failure should list failed checks")
    void environmentChecks() {
        EnvironmentException ex = new EnvironmentException("Environment check failed", List.of("tool:gh"));

        assertThat(ex.getFailedChecks()).containsExactly("tool:gh");
    }
}
