package ai.testscope.results;

import ai.testscope.util.TextCanonicalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Converts TAP output of the Node.js test runner into a single-file {@link ResultDocument}.
 *
 * <p>Subtests are indented four spaces per level. A test point that has subtests is a suite: it is not reported itself
 * and its name becomes an ancestor title of everything nested in it. Names written as {@code suite > case} are split
 * the same way.
 */
public final class TapResultParser {
    private static final Logger logger = LogManager.getLogger(TapResultParser.class);

    private static final Pattern TEST_POINT =
            Pattern.compile("^(not )?ok\\s+(\\d+)\\s*(?:-\\s*(.+?))?(?:\\s+#\\s*(SKIP|TODO)\\b(?:\\s+(.*))?)?$",
                    Pattern.CASE_INSENSITIVE);
    private static final YAMLMapper YAML = new YAMLMapper();
    private static final Splitter LINES = Splitter.on('\n');
    private static final String NAME_SEPARATOR = " > ";
    private static final int INDENT = 4;

    private TapResultParser() {}

    private static final class TestPoint {
        final int depth;
        final String name;
        final boolean ok;
        final @Nullable String directive;
        final List<String> ancestors = new ArrayList<>();
        Map<String, String> diagnostic = Map.of();

        TestPoint(int depth, String name, boolean ok, @Nullable String directive) {
            this.depth = depth;
            this.name = name;
            this.ok = ok;
            this.directive = directive;
        }
    }

    public static ResultDocument parse(String output, String file) {
        var points = new ArrayList<TestPoint>();
        // results index after the last test point at each depth or shallower
        var since = new int[64];
        TestPoint last = null;
        List<String> diagnostic = null;

        for (var rawLine : LINES.split(TextCanonicalizer.normalizeLineEndings(output))) {
            var line = TextCanonicalizer.stripAnsi(rawLine);
            var trimmed = line.strip();
            if (diagnostic != null) {
                if (trimmed.equals("...")) {
                    if (last != null) {
                        last.diagnostic = parseDiagnostic(diagnostic);
                    }
                    diagnostic = null;
                } else {
                    diagnostic.add(line);
                }
                continue;
            }
            if (trimmed.equals("---")) {
                diagnostic = new ArrayList<>();
                continue;
            }
            var m = TEST_POINT.matcher(trimmed);
            if (!m.matches()) {
                continue;
            }
            int depth = Math.min(leadingSpaces(line) / INDENT, since.length - 1);
            var name = m.group(3) == null || m.group(3).isBlank() ? "Test " + m.group(2) : m.group(3).strip();
            var point = new TestPoint(depth, name, m.group(1) == null, m.group(4));

            var children = points.subList(since[depth], points.size());
            if (!children.isEmpty()) {
                // a point with subtests is their suite
                children.forEach(c -> c.ancestors.add(0, point.name));
                last = null;
            } else {
                points.add(point);
                last = point;
            }
            for (int d = depth; d < since.length; d++) {
                since[d] = points.size();
            }
        }
        if (diagnostic != null && last != null && !diagnostic.isEmpty()) {
            last.diagnostic = parseDiagnostic(diagnostic);
        }

        var results = points.stream().map(TapResultParser::toAssertionResult).toList();
        logger.debug("Parsed {} TAP test points for {}", results.size(), file);
        boolean failed = results.stream().anyMatch(r -> r.status() == ResultStatus.FAILED);
        var fileResult = new FileResult(file, failed ? "failed" : "passed", "", results);
        return ResultDocument.of(List.of(fileResult));
    }

    private static int leadingSpaces(String line) {
        int i = 0;
        while (i < line.length() && line.charAt(i) == ' ') {
            i++;
        }
        return i;
    }

    private static AssertionResult toAssertionResult(TestPoint point) {
        ResultStatus status;
        if ("skip".equalsIgnoreCase(point.directive)) {
            status = ResultStatus.SKIPPED;
        } else if ("todo".equalsIgnoreCase(point.directive)) {
            status = ResultStatus.TODO;
        } else {
            status = point.ok ? ResultStatus.PASSED : ResultStatus.FAILED;
        }

        var ancestors = new ArrayList<>(point.ancestors);
        String title = point.name;
        String fullName;
        if (point.name.contains(NAME_SEPARATOR)) {
            var parts = Splitter.on(NAME_SEPARATOR).splitToList(point.name);
            ancestors.addAll(parts.subList(0, parts.size() - 1));
            title = parts.get(parts.size() - 1);
            fullName = point.name;
        } else {
            var all = new ArrayList<>(ancestors);
            all.add(title);
            fullName = String.join(" ", all);
        }

        var diag = point.diagnostic;
        List<String> failureMessages = null;
        if (status == ResultStatus.FAILED && !diag.isEmpty()) {
            var messages = new ArrayList<String>();
            for (var key : List.of("error", "message", "stack")) {
                var value = diag.get(key);
                if (value != null && !value.isEmpty()) {
                    messages.add(value);
                }
            }
            if (messages.isEmpty()) {
                var raw = new StringBuilder();
                diag.forEach((k, v) -> raw.append(raw.length() == 0 ? "" : "\n").append(k).append(": ").append(v));
                messages.add(raw.toString());
            }
            failureMessages = messages;
        }

        Double duration = parseDouble(diag.get("duration_ms"));
        Location location = null;
        var line = parseInt(diag.getOrDefault("line", diag.get("at.line")));
        if (line != null) {
            var column = parseInt(diag.getOrDefault("column", diag.get("at.column")));
            location = new Location(line, column == null ? 0 : column);
        }
        return new AssertionResult(ancestors, title, fullName, status, failureMessages, location, duration);
    }

    /**
     * Reads a YAML diagnostic block into {@code key -> text}. Nested mappings are flattened with dotted keys
     * ({@code at.line}) and sequences are joined line by line. A block that is not valid YAML is kept whole as its
     * {@code message}.
     */
    static Map<String, String> parseDiagnostic(List<String> lines) {
        var text = dedent(lines);
        if (text.isBlank()) {
            return Map.of();
        }
        JsonNode tree;
        try {
            tree = YAML.readTree(text);
        } catch (JsonProcessingException e) {
            logger.debug("TAP diagnostic is not valid YAML: {}", e.getOriginalMessage());
            return Map.of("message", text.strip());
        }
        if (tree == null || !tree.isObject()) {
            return Map.of("message", text.strip());
        }
        var result = new LinkedHashMap<String, String>();
        flatten("", tree, result);
        return result;
    }

    private static void flatten(String prefix, JsonNode node, Map<String, String> out) {
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var key = prefix + field.getKey();
            var value = field.getValue();
            if (value.isObject()) {
                flatten(key + ".", value, out);
            } else {
                out.put(key, scalarText(value));
            }
        }
    }

    private static String scalarText(JsonNode value) {
        if (value.isNull()) {
            return "";
        }
        if (value.isArray()) {
            var items = new ArrayList<String>();
            value.forEach(item -> items.add(item.isValueNode() ? scalarText(item) : item.toString()));
            return String.join("\n", items);
        }
        return value.asText().stripTrailing();
    }

    private static String dedent(List<String> lines) {
        int common = Integer.MAX_VALUE;
        for (var line : lines) {
            if (!line.isBlank()) {
                common = Math.min(common, leadingSpaces(line));
            }
        }
        var sb = new StringBuilder();
        for (var line : lines) {
            sb.append(line.isBlank() ? "" : line.substring(common)).append('\n');
        }
        return sb.toString();
    }

    private static @Nullable Double parseDouble(@Nullable String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(s.strip());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring non-numeric TAP value '{}'", s);
            return null;
        }
    }

    private static @Nullable Integer parseInt(@Nullable String s) {
        var d = parseDouble(s);
        return d == null ? null : d.intValue();
    }
}
