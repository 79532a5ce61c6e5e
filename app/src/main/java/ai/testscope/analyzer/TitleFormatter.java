package ai.testscope.analyzer;

import ai.testscope.util.Json;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formats the title of one row of a parameterized declaration the way test runners print it: Node-style printf
 * specifiers, then the row index for {@code %#}, then {@code $name} / {@code ${a.b}} lookups on object rows.
 */
public final class TitleFormatter {
    private static final Pattern HAS_PRINTF = Pattern.compile("%[sdifjoOcp]");
    private static final Pattern PRINTF = Pattern.compile("%([sdifjoOcp%])");
    private static final Pattern DOLLAR =
            Pattern.compile("\\$\\{([^}]*)}|\\$(#|[A-Za-z_$][\\w$]*(?:\\.[A-Za-z_$][\\w$]*)*)");

    private static final int INSPECT_DEPTH = 2;

    private TitleFormatter() {}

    public static String format(String template, StaticValue row, int index) {
        var formatted = template;
        if (HAS_PRINTF.matcher(formatted).find()) {
            var args = row instanceof StaticValue.Arr arr ? arr.elements() : List.of(row);
            formatted = printf(formatted, args);
        }
        formatted = formatted.replace("%#", Integer.toString(index));
        if (row instanceof StaticValue.Obj obj) {
            formatted = interpolate(formatted, obj, index);
        }
        return formatted;
    }

    /** Positional substitution. Specifiers with no value left stay as written; surplus values are dropped. */
    static String printf(String template, List<StaticValue> args) {
        var m = PRINTF.matcher(template);
        var sb = new StringBuilder();
        int next = 0;
        while (m.find()) {
            char spec = m.group(1).charAt(0);
            String replacement;
            if (spec == '%') {
                replacement = "%";
            } else if (next >= args.size()) {
                replacement = m.group();
            } else {
                replacement = render(spec, args.get(next++));
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    static String render(char spec, StaticValue value) {
        return switch (spec) {
            case 's' -> value instanceof StaticValue.Str s ? s.value() : renderString(value);
            case 'd' -> JsNumbers.format(toNumber(value));
            case 'i' -> JsNumbers.format(JsNumbers.parseInt(value.toJsString().orElse("")));
            case 'f' -> JsNumbers.format(JsNumbers.parseFloat(value.toJsString().orElse("")));
            case 'j' -> value.toJson().map(Json::write).orElse("undefined");
            case 'o', 'O' -> value.inspect(INSPECT_DEPTH);
            case 'p' -> value.prettyMin();
            case 'c' -> "";
            default -> throw new IllegalArgumentException("Unknown format specifier %" + spec);
        };
    }

    // %s prints primitives with String() and inspects containers one level deep
    private static String renderString(StaticValue value) {
        if (value instanceof StaticValue.Num n && n.value() == 0 && 1 / n.value() < 0) {
            return "-0";
        }
        if (value.isPrimitive()) {
            return value.toJsString().orElseThrow();
        }
        return value.inspect(0);
    }

    private static double toNumber(StaticValue value) {
        if (value instanceof StaticValue.Num n) return n.value();
        if (value instanceof StaticValue.Bool b) return b.value() ? 1 : 0;
        if (value instanceof StaticValue.Null) return 0;
        if (value instanceof StaticValue.Str s) return JsNumbers.toNumber(s.value());
        if (value instanceof StaticValue.Arr a) {
            return a.elements().size() <= 1 ? JsNumbers.toNumber(value.toJsString().orElse("NaN")) : Double.NaN;
        }
        return Double.NaN;
    }

    /**
     * Replaces {@code $path}, {@code ${path}} and {@code $#}. A dotted path uses its longest prefix that resolves on the
     * row, leaving the rest as text, so {@code $name.} at the end of a sentence still works.
     */
    static String interpolate(String template, StaticValue.Obj row, int index) {
        var m = DOLLAR.matcher(template);
        var sb = new StringBuilder();
        while (m.find()) {
            String replacement;
            if (m.group(1) != null) {
                replacement = lookup(row, m.group(1).strip())
                        .filter(r -> r.rest().isEmpty())
                        .map(r -> render(r.value()))
                        .orElse(m.group());
            } else if ("#".equals(m.group(2))) {
                replacement = Integer.toString(index);
            } else {
                replacement = lookup(row, m.group(2))
                        .map(r -> render(r.value()) + r.rest())
                        .orElse(m.group());
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private record Lookup(StaticValue value, String rest) {}

    private static Optional<Lookup> lookup(StaticValue.Obj row, String path) {
        var segments = path.split("\\.", -1);
        StaticValue current = row;
        int resolved = 0;
        for (var segment : segments) {
            var next = current.property(segment);
            if (next.isEmpty()) {
                break;
            }
            current = next.get();
            resolved++;
        }
        if (resolved == 0) {
            return Optional.empty();
        }
        var rest = new StringBuilder();
        for (int i = resolved; i < segments.length; i++) {
            rest.append('.').append(segments[i]);
        }
        return Optional.of(new Lookup(current, rest.toString()));
    }

    private static String render(StaticValue value) {
        if (value.isPrimitive()) {
            return value.toJsString().orElseThrow();
        }
        return value.prettyMin();
    }
}
