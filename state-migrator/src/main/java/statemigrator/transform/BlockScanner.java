package statemigrator.transform;

/**
 * Finds the brace that closes a configuration block.
 *
 * <p>A depth counter over the block body, aware of the lexical forms that may contain
 * unbalanced braces: quoted strings with {@code ${...}} interpolation, heredocs, and
 * {@code #}, {@code //} and block comments.
 */
final class BlockScanner {

    private BlockScanner() {}

    /**
     * Returns the index of the brace matching the one at {@code openIndex}.
     *
     * @param text the configuration text
     * @param openIndex index of an opening brace
     * @return index of the matching closing brace, or -1 if the block is unbalanced
     */
    static int findClosingBrace(String text, int openIndex) {
        if (openIndex < 0 || openIndex >= text.length() || text.charAt(openIndex) != '{') {
            throw new IllegalArgumentException("No opening brace at index " + openIndex);
        }
        int depth = 0;
        int i = openIndex;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '"') {
                i = skipString(text, i);
                if (i < 0) return -1;
                continue;
            }
            if (c == '#' || (c == '/' && peek(text, i + 1) == '/')) {
                i = skipLine(text, i);
                continue;
            }
            if (c == '/' && peek(text, i + 1) == '*') {
                int end = text.indexOf("*/", i + 2);
                if (end < 0) return -1;
                i = end + 2;
                continue;
            }
            if (c == '<' && peek(text, i + 1) == '<') {
                int after = skipHeredoc(text, i);
                if (after > i) {
                    i = after;
                    continue;
                }
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * Returns the brace depth at {@code index}, relative to {@code from}.
     * Used to tell block-level attributes from those of nested blocks.
     */
    static int depthAt(String text, int from, int index) {
        int depth = 0;
        int i = from;
        while (i < index) {
            char c = text.charAt(i);
            if (c == '"') {
                int next = skipString(text, i);
                if (next < 0 || next > index) return depth;
                i = next;
                continue;
            }
            if (c == '#' || (c == '/' && peek(text, i + 1) == '/')) {
                i = skipLine(text, i);
                continue;
            }
            if (c == '{') depth++;
            else if (c == '}') depth--;
            i++;
        }
        return depth;
    }

    // Returns the index after the closing quote, or -1 if unterminated.
    private static int skipString(String text, int quoteIndex) {
        int i = quoteIndex + 1;
        int interpolation = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '$' && peek(text, i + 1) == '{') {
                interpolation++;
                i += 2;
                continue;
            }
            if (interpolation > 0) {
                if (c == '{') interpolation++;
                else if (c == '}') interpolation--;
                i++;
                continue;
            }
            if (c == '"') {
                return i + 1;
            }
            if (c == '\n') {
                return -1;
            }
            i++;
        }
        return -1;
    }

    private static int skipLine(String text, int i) {
        int nl = text.indexOf('\n', i);
        return nl < 0 ? text.length() : nl + 1;
    }

    // Returns the index after the heredoc terminator line, or start if not a heredoc.
    private static int skipHeredoc(String text, int start) {
        int i = start + 2;
        if (peek(text, i) == '-') i++;
        int idStart = i;
        while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
            i++;
        }
        if (i == idStart || peek(text, i) != '\n' && peek(text, i) != '\r') {
            return start;
        }
        String marker = text.substring(idStart, i);
        int lineStart = skipLine(text, i);
        while (lineStart < text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            String line = lineEnd < 0 ? text.substring(lineStart) : text.substring(lineStart, lineEnd);
            if (line.strip().equals(marker)) {
                return lineEnd < 0 ? text.length() : lineEnd;
            }
            if (lineEnd < 0) break;
            lineStart = lineEnd + 1;
        }
        return text.length();
    }

    private static char peek(String text, int i) {
        return i < text.length() ? text.charAt(i) : '\0';
    }
}
