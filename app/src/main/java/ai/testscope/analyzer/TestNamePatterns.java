package ai.testscope.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Builds the names and name-filter patterns a host passes to a runner to run one declaration. */
public final class TestNamePatterns {
    public static final String MATCH_ANY = "(.*?)";

    private static final Pattern INTERPOLATION = Pattern.compile("(\\$\\{?[A-Za-z0-9_]+}?|%[psdifjo#%])");
    private static final Pattern REGEX_SPECIAL = Pattern.compile("[.*+?^${}<>()|\\[\\]\\\\]");
    private static final String ESCAPED_MATCH_ANY = "\\(\\.\\*\\?\\)";
    private static final Pattern NAME_PROPERTY = Pattern.compile("(?<=\\S)\\.name\\b");
    private static final Pattern PROTOTYPE_PREFIX = Pattern.compile("\\w*\\.prototype\\.");

    private TestNamePatterns() {}

    /**
     * The space-joined name of the innermost declaration at a one-based line: a suite declared on that line or a case
     * whose span contains it. Interpolations become {@code (.*?)} wildcards.
     */
    public static Optional<String> fullTestNameAt(TestTree tree, int line) {
        return fullTestNameAt(tree.root().children(), line);
    }

    private static Optional<String> fullTestNameAt(List<TestNode> children, int line) {
        for (var node : children) {
            var span = node.span();
            if (span == null || node.kind() == TestKind.ASSERTION) {
                continue;
            }
            if (node.kind() == TestKind.SUITE && span.startLine() == line) {
                return Optional.of(cleanName(node.displayName()));
            }
            if (node.kind() == TestKind.CASE && span.containsLine(line)) {
                return Optional.of(cleanName(node.displayName()));
            }
        }
        for (var node : children) {
            var nested = fullTestNameAt(node.children(), line);
            if (nested.isPresent()) {
                return Optional.of(cleanName(node.displayName()) + " " + nested.get());
            }
        }
        return Optional.empty();
    }

    /**
     * Anchored pattern matching the full name of a node. Nodes created from a parameterized declaration use their
     * unexpanded title, so the pattern selects every row of the declaration.
     */
    public static String testNamePattern(TestNode node) {
        var parts = new ArrayList<String>();
        for (var n = node; n != null && n.kind() != TestKind.ROOT; n = n.parent()) {
            if (n != node && n.kind() != TestKind.SUITE) {
                continue;
            }
            var name = n.rawTemplate() != null ? n.rawTemplate() : n.displayName();
            if (!name.isEmpty()) {
                parts.add(0, cleanName(name));
            }
        }
        return "^" + escapeRegExp(String.join(" ", parts)) + "$";
    }

    /** Escapes regex metacharacters, keeping {@code (.*?)} wildcards intact. */
    public static String escapeRegExp(String s) {
        var escaped = REGEX_SPECIAL.matcher(s).replaceAll(m -> Matcher.quoteReplacement("\\" + m.group()));
        return escaped.replace(ESCAPED_MATCH_ANY, MATCH_ANY);
    }

    /** Replaces {@code $name}, {@code ${name}} and printf-style placeholders with {@code (.*?)}. */
    public static String resolveInterpolation(String name) {
        return INTERPOLATION.matcher(name).replaceAll(Matcher.quoteReplacement(MATCH_ANY));
    }

    /** Drops {@code .name} and {@code X.prototype.} left in names written as {@code `${Foo.prototype.bar.name}`}. */
    public static String stripPropertyArtefacts(String name) {
        var withoutName = NAME_PROPERTY.matcher(name).replaceAll("");
        return PROTOTYPE_PREFIX.matcher(withoutName).replaceAll("");
    }

    private static String cleanName(String name) {
        return stripPropertyArtefacts(resolveInterpolation(name));
    }
}
