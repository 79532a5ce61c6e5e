package ai.testscope.results;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matching of runner titles against discovered names that still contain interpolation tokens ({@code $x},
 * {@code ${x}}, {@code $a.b}, {@code $#}, {@code %s}-family, {@code %#}). Tokens become non-greedy wildcards; the rest
 * of the name must match literally.
 */
public final class TitlePattern {
    static final Pattern TOKEN =
            Pattern.compile("\\$\\{[^}]*}|\\$#|\\$[A-Za-z_]\\w*(?:\\.[A-Za-z_]\\w*)*|%[sdifjoOcp#]");
    private static final Pattern DUPLICATE_SUFFIX = Pattern.compile(" \\(\\d+\\)");

    private TitlePattern() {}

    public static boolean containsToken(String name) {
        return TOKEN.matcher(name).find();
    }

    /** A name that is nothing but one token would match every title. */
    public static boolean isOnlyToken(String name) {
        return TOKEN.matcher(name.strip()).matches();
    }

    /** Anchored regex for a name: literal text quoted, each token a {@code (.*?)} group. */
    public static Pattern toRegex(String name) {
        var m = TOKEN.matcher(name);
        var sb = new StringBuilder("^");
        int last = 0;
        while (m.find()) {
            sb.append(Pattern.quote(name.substring(last, m.start())));
            sb.append("(.*?)");
            last = m.end();
        }
        sb.append(Pattern.quote(name.substring(last))).append('$');
        return Pattern.compile(sb.toString(), Pattern.DOTALL);
    }

    /** Exact equality, or a wildcard match when {@code name} contains tokens. */
    public static boolean matches(String actual, String name) {
        if (actual.equals(name)) {
            return true;
        }
        return containsToken(name) && toRegex(name).matcher(actual).matches();
    }

    /** {@code actual} is {@code expected} plus the " (n)" suffix runners add to duplicate titles. */
    public static boolean matchesWithSuffix(String actual, String expected) {
        if (!actual.startsWith(expected)) {
            return false;
        }
        Matcher suffix = DUPLICATE_SUFFIX.matcher(actual.substring(expected.length()));
        return suffix.matches();
    }
}
