package statemigrator.security;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure text filter that redacts credentials before text is logged or displayed.
 *
 * <p>Patterns are applied in a fixed order. Multi-line private key blocks go first
 * so that their body is removed as a whole; assignment-style patterns keep the key
 * name and redact only the value, so log lines stay readable.
 *
 * <h2>Redacted forms:</h2>
 * <ul>
 *   <li>PEM private key blocks</li>
 *   <li>cloud access key ids ({@code AKIA...}, {@code ASIA...})</li>
 *   <li>{@code aws_secret_access_key} assignments</li>
 *   <li>version-control tokens ({@code ghp_}, {@code gho_}, {@code ghs_}, {@code ghu_}, {@code github_pat_})</li>
 *   <li>generic {@code password=}, {@code secret=}, {@code token=} assignments</li>
 *   <li>email addresses</li>
 * </ul>
 *
 * <p>Stateless and thread-safe. The shared {@link #INSTANCE} is used by the logging
 * converters, the command runner and the pipeline.
 */
public final class SecretSanitizer {

    /** Replacement for every redacted span. */
    public static final String REDACTED = "[REDACTED]";

    public static final SecretSanitizer INSTANCE = new SecretSanitizer();

    private static final List<Rule> RULES = List.of(
            Rule.whole("-----BEGIN [A-Z ]*PRIVATE KEY-----[\\s\\S]*?(-----END [A-Z ]*PRIVATE KEY-----|\\z)"),
            Rule.whole("(?:AKIA|ASIA)[0-9A-Z]{16}"),
            Rule.valueOnly("(?i)(aws_secret_access_key\\s*[:=]\\s*[\"']?)([A-Za-z0-9/+=]{16,})"),
            Rule.whole("(?:ghp|gho|ghs|ghu|ghr)_[A-Za-z0-9]{20,}"),
            Rule.whole("github_pat_[A-Za-z0-9_]{20,}"),
            Rule.valueOnly("(?i)(\\b[a-z0-9_.-]*(?:password|passwd|secret|token)[a-z0-9_.-]*\\s*[:=]\\s*[\"']?)([^\\s\"',;]+)"),
            Rule.whole("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}")
    );

    private SecretSanitizer() {}

    /**
     * Returns {@code text} with every known secret form replaced by {@link #REDACTED}.
     *
     * @param text input text, may be null
     * @return the redacted text, or null if {@code text} was null
     */
    public String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String out = text;
        for (Rule rule : RULES) {
            out = rule.apply(out);
        }
        return out;
    }

    private static final class Rule {
        private final Pattern pattern;
        private final boolean keepPrefix;

        private Rule(String regex, boolean keepPrefix) {
            this.pattern = Pattern.compile(regex);
            this.keepPrefix = keepPrefix;
        }

        static Rule whole(String regex) {
            return new Rule(regex, false);
        }

        static Rule valueOnly(String regex) {
            return new Rule(regex, true);
        }

        String apply(String text) {
            Matcher m = pattern.matcher(text);
            if (!m.find()) {
                return text;
            }
            StringBuilder sb = new StringBuilder(text.length());
            do {
                String replacement = keepPrefix ? m.group(1) + REDACTED : REDACTED;
                m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
            } while (m.find());
            m.appendTail(sb);
            return sb.toString();
        }
    }
}
