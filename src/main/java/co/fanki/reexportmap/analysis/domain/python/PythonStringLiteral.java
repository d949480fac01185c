package co.fanki.reexportmap.analysis.domain.python;

/**
 * Decodes the raw source text of Python string literals.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PythonStringLiteral {

    /** What a string token evaluates to. */
    public enum Kind {
        /** A plain {@code str} constant. */
        TEXT,
        /** A {@code bytes} constant. */
        BYTES,
        /** An f-string, which is an expression rather than a constant. */
        FORMATTED
    }

    private PythonStringLiteral() {
    }

    /**
     * Classifies a string token by its prefix.
     *
     * @param raw the raw token text, prefix and quotes included
     * @return the literal kind
     */
    public static Kind kindOf(final String raw) {
        final String prefix = prefixOf(raw).toLowerCase();
        if (prefix.contains("f")) {
            return Kind.FORMATTED;
        }
        if (prefix.contains("b")) {
            return Kind.BYTES;
        }
        return Kind.TEXT;
    }

    /**
     * Returns the value of a string token, with escape sequences decoded
     * unless the literal is raw.
     *
     * @param raw the raw token text, prefix and quotes included
     * @return the literal value
     */
    public static String decode(final String raw) {
        final String prefix = prefixOf(raw);
        final String quoted = raw.substring(prefix.length());
        final int quoteLength = quoted.length() >= 6
                && quoted.charAt(0) == quoted.charAt(1)
                && quoted.charAt(1) == quoted.charAt(2) ? 3 : 1;
        final String body = quoted.substring(quoteLength,
                quoted.length() - quoteLength);

        if (prefix.toLowerCase().contains("r")) {
            return body;
        }
        return unescape(body, kindOf(raw) == Kind.BYTES);
    }

    private static String prefixOf(final String raw) {
        int end = 0;
        while (end < raw.length() && raw.charAt(end) != '\''
                && raw.charAt(end) != '"') {
            end++;
        }
        return raw.substring(0, end);
    }

    private static String unescape(final String body, final boolean bytes) {
        final StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            final char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }
            final char next = body.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\n' -> { }
                case '\\' -> out.append('\\');
                case '\'' -> out.append('\'');
                case '"' -> out.append('"');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'v' -> out.append('\u000B');
                case 'x' -> i = appendCodePoint(out, body, i, 2, "\\x");
                case 'u' -> i = bytes ? appendRaw(out, "\\u", i)
                        : appendCodePoint(out, body, i, 4, "\\u");
                case 'U' -> i = bytes ? appendRaw(out, "\\U", i)
                        : appendCodePoint(out, body, i, 8, "\\U");
                case 'N' -> i = bytes ? appendRaw(out, "\\N", i)
                        : appendNamed(out, body, i);
                default -> {
                    if (next >= '0' && next <= '7') {
                        int end = i;
                        while (end < body.length() && end < i + 2
                                && body.charAt(end) >= '0'
                                && body.charAt(end) <= '7') {
                            end++;
                        }
                        out.appendCodePoint(Integer.parseInt(
                                body.substring(i - 1, end), 8));
                        i = end;
                    } else {
                        out.append('\\').append(next);
                    }
                }
            }
        }
        return out.toString();
    }

    private static int appendRaw(final StringBuilder out, final String text,
            final int index) {
        out.append(text);
        return index;
    }

    /** Decodes a fixed-width hex escape; malformed ones are kept as is. */
    private static int appendCodePoint(final StringBuilder out,
            final String body, final int index, final int digits,
            final String escape) {
        if (index + digits > body.length()) {
            out.append(escape);
            return index;
        }
        int codePoint = 0;
        for (int i = index; i < index + digits; i++) {
            final int digit = Character.digit(body.charAt(i), 16);
            if (digit < 0) {
                out.append(escape);
                return index;
            }
            codePoint = codePoint * 16 + digit;
        }
        if (codePoint < 0 || codePoint > Character.MAX_CODE_POINT) {
            out.append(escape);
            return index;
        }
        out.appendCodePoint(codePoint);
        return index + digits;
    }

    private static int appendNamed(final StringBuilder out,
            final String body, final int index) {
        final int close = body.indexOf('}', index);
        if (index >= body.length() || body.charAt(index) != '{'
                || close < 0) {
            out.append("\\N");
            return index;
        }
        final String name = body.substring(index + 1, close);
        try {
            out.appendCodePoint(Character.codePointOf(name));
            return close + 1;
        } catch (final IllegalArgumentException e) {
            // unknown character name, kept as written
            out.append("\\N");
            return index;
        }
    }

}
