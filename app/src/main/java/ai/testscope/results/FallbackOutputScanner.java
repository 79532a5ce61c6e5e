package ai.testscope.results;

import ai.testscope.analyzer.TestNode;
import ai.testscope.util.TextCanonicalizer;
import com.google.common.base.Splitter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Best-effort outcomes from raw runner output when no result document can be read. A node is failed when a line
 * carrying a failure marker mentions its name or the last segment of it; every other node is passed. Nothing is ever
 * reported skipped in this mode.
 */
public final class FallbackOutputScanner {
    private static final Logger logger = LogManager.getLogger(FallbackOutputScanner.class);

    private static final Splitter LINES = Splitter.on('\n');

    private final List<String> failureMarkers;

    public FallbackOutputScanner(List<String> failureMarkers) {
        this.failureMarkers = List.copyOf(failureMarkers);
    }

    public Map<TestNode, Outcome> scan(List<TestNode> leaves, String output) {
        var text = TextCanonicalizer.stripAnsi(TextCanonicalizer.normalizeLineEndings(output));
        var failureLines = LINES.splitToStream(text)
                .filter(line -> failureMarkers.stream().anyMatch(line::contains))
                .toList();

        var outcomes = new LinkedHashMap<TestNode, Outcome>();
        for (var leaf : leaves) {
            var name = leaf.displayName();
            var segment = ResultReconciler.lastSegment(leaf);
            var relevant = failureLines.stream()
                    .filter(line -> mentions(line, name) || (segment != null && mentions(line, segment)))
                    .toList();
            outcomes.put(
                    leaf,
                    relevant.isEmpty()
                            ? Outcome.passed(null)
                            : Outcome.failed(String.join("\n", relevant), null, null));
        }
        logger.debug("Fallback scan found {} failure lines for {} nodes", failureLines.size(), leaves.size());
        return outcomes;
    }

    // an empty name is contained in every line
    private static boolean mentions(String line, String name) {
        return !name.isBlank() && line.contains(name);
    }
}
