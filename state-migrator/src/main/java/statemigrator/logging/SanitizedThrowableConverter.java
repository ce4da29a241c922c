package statemigrator.logging;

import ch.qos.logback.classic.pattern.ThrowableProxyConverter;
import ch.qos.logback.classic.spi.IThrowableProxy;
import statemigrator.security.SecretSanitizer;

/**
 * Logback converter for {@code %sanitizedEx}. Exception messages often echo command
 * output, so the rendered stack trace is passed through the sanitizer too.
 */
public class SanitizedThrowableConverter extends ThrowableProxyConverter {

    @Override
    protected String throwableProxyToString(IThrowableProxy tp) {
        return SecretSanitizer.INSTANCE.sanitize(super.throwableProxyToString(tp));
    }
}
