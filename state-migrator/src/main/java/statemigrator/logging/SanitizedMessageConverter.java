package statemigrator.logging;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import statemigrator.security.SecretSanitizer;

/**
 * Logback converter for {@code %sanitizedMsg}: the formatted message with secrets redacted.
 */
public class SanitizedMessageConverter extends ClassicConverter {

    @Override
    public String convert(ILoggingEvent event) {
        return SecretSanitizer.INSTANCE.sanitize(event.getFormattedMessage());
    }
}
