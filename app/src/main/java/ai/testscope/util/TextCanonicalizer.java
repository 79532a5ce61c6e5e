package ai.testscope.util;

import java.util.regex.Pattern;

/** Normalization applied to text read from files or captured from processes before it is analyzed. */
public final class TextCanonicalizer {
    private static final char BOM = '\uFEFF';
    private static final Pattern ANSI_ESCAPE = Pattern.compile("\u001B\\[[0-9;?]*[ -/]*[@-~]");

    private TextCanonicalizer() {}

    public static String stripUtf8Bom(String s) {
        return !s.isEmpty() && s.charAt(0) == BOM ? s.substring(1) : s;
    }

    /** Converts CRLF and lone CR line endings to LF. */
    public static String normalizeLineEndings(String s) {
        if (s.indexOf('\r') < 0) {
            return s;
        }
        return s.replace("\r\n", "\n").replace('\r', '\n');
    }

    /** Removes ANSI color and cursor escape sequences that runners write to terminals. */
    public static String stripAnsi(String s) {
        if (s.indexOf('\u001B') < 0) {
            return s;
        }
        return ANSI_ESCAPE.matcher(s).replaceAll("");
    }
}
