package ai.testscope.analyzer;

/** Escape-sequence handling for the contents of JavaScript string and template literals. */
final class JsStrings {
    private JsStrings() {}

    /** Cooks the raw text between a literal's delimiters. Malformed escapes keep their characters. */
    static String unescape(String raw) {
        if (raw.indexOf('\\') < 0) {
            return raw;
        }
        var sb = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c != '\\' || i + 1 >= raw.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char next = raw.charAt(i + 1);
            i += 2;
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'v' -> sb.append('\u000B');
                case '0' -> sb.append('\0');
                case '\r' -> {
                    // line continuation
                    if (i < raw.length() && raw.charAt(i) == '\n') i++;
                }
                case '\n', '\u2028', '\u2029' -> {}
                case 'x' -> {
                    if (i + 2 <= raw.length() && isHex(raw, i, i + 2)) {
                        sb.append((char) Integer.parseInt(raw.substring(i, i + 2), 16));
                        i += 2;
                    } else {
                        sb.append('x');
                    }
                }
                case 'u' -> i = appendUnicode(raw, i, sb);
                default -> sb.append(next);
            }
        }
        return sb.toString();
    }

    private static int appendUnicode(String raw, int i, StringBuilder sb) {
        if (i < raw.length() && raw.charAt(i) == '{') {
            int close = raw.indexOf('}', i);
            if (close > i + 1 && isHex(raw, i + 1, close)) {
                int cp = Integer.parseInt(raw.substring(i + 1, close), 16);
                if (Character.isValidCodePoint(cp)) {
                    sb.appendCodePoint(cp);
                    return close + 1;
                }
            }
        } else if (i + 4 <= raw.length() && isHex(raw, i, i + 4)) {
            sb.append((char) Integer.parseInt(raw.substring(i, i + 4), 16));
            return i + 4;
        }
        sb.append('u');
        return i;
    }

    private static boolean isHex(String s, int from, int to) {
        if (to - from > 6) {
            return false;
        }
        for (int k = from; k < to; k++) {
            if (Character.digit(s.charAt(k), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
