package ai.testscope.results;

import ai.testscope.TestScopeConfig;
import ai.testscope.analyzer.TestNode;
import ai.testscope.analyzer.TestTree;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Assigns each discovered case an outcome from the results of a run.
 *
 * <p>Nodes are matched in order against the results not yet taken by an earlier node, trying progressively looser
 * name comparisons and stopping at the first that finds anything. Among several candidates the one reported on the
 * node's line wins. A node whose name still holds an interpolation token and that matches several results stands for
 * all of them and receives their aggregate.
 *
 * <p>A pass keeps no state beyond its own call; reconciling the same nodes and results again gives the same outcomes.
 */
@NullMarked
public final class ResultReconciler {
    private static final Logger logger = LogManager.getLogger(ResultReconciler.class);

    private static final String DEFAULT_FAILURE = "Test failed";

    private final TestScopeConfig config;
    private final ResultDocumentReader reader;

    public ResultReconciler(TestScopeConfig config) {
        this.config = config;
        this.reader = new ResultDocumentReader(config);
    }

    public ResultReconciler() {
        this(TestScopeConfig.fromEnvironment());
    }

    public Map<TestNode, Outcome> reconcile(TestTree tree, ResultDocument document) {
        return reconcile(tree.leaves(), document);
    }

    /**
     * Reads the captured output of a run and reconciles against it; output without a readable result document is
     * scanned for failure markers instead.
     */
    public Map<TestNode, Outcome> reconcile(List<TestNode> leaves, String output) {
        var document = reader.read(output);
        if (document.isPresent()) {
            return reconcile(leaves, document.get());
        }
        logger.warn("No structured results in runner output; falling back to failure-marker scan");
        return new FallbackOutputScanner(config.failureMarkers()).scan(leaves, output);
    }

    /** One outcome per leaf, in leaf order. */
    public Map<TestNode, Outcome> reconcile(List<TestNode> leaves, ResultDocument document) {
        var results = new ArrayList<IndexedResult>();
        for (var file : document.testResults()) {
            for (var r : file.assertionResults()) {
                results.add(new IndexedResult(results.size(), file.name(), r));
            }
        }

        var record = new MatchRecord();
        var outcomes = new LinkedHashMap<TestNode, Outcome>();
        for (var leaf : leaves) {
            outcomes.put(leaf, reconcileLeaf(leaf, candidatesFor(leaf, results, record), record));
        }
        logger.debug(
                "Reconciled {} nodes against {} results, {} consumed", leaves.size(), results.size(), record.size());
        return outcomes;
    }

    private record IndexedResult(int index, @Nullable String file, AssertionResult result) {}

    private static List<IndexedResult> candidatesFor(TestNode leaf, List<IndexedResult> all, MatchRecord record) {
        var sameFile = all.stream().filter(r -> sameFile(r.file(), leaf.file())).toList();
        var pool = sameFile.isEmpty() ? all : sameFile;
        return pool.stream().filter(r -> !record.isConsumed(r.index())).toList();
    }

    static boolean sameFile(@Nullable String resultFile, String nodeFile) {
        if (resultFile == null || resultFile.isEmpty()) {
            return false;
        }
        var a = resultFile.replace('\\', '/');
        var b = nodeFile.replace('\\', '/');
        return a.equals(b) || a.endsWith("/" + b) || b.endsWith("/" + a);
    }

    private Outcome reconcileLeaf(TestNode leaf, List<IndexedResult> candidates, MatchRecord record) {
        var matches = match(leaf, candidates);
        if (matches.isEmpty() && leaf.rawTemplate() != null) {
            var rawTemplate = leaf.rawTemplate();
            matches = candidates.stream()
                    .filter(c -> TitlePattern.matches(c.result().title(), rawTemplate)
                            || TitlePattern.matches(c.result().path(), rawTemplate))
                    .limit(1)
                    .toList();
        }
        if (matches.isEmpty()) {
            logger.debug("No result for {}", leaf);
            return Outcome.skipped();
        }

        if (TitlePattern.containsToken(leaf.displayName()) && matches.size() > 1) {
            matches.forEach(m -> record.consume(m.index()));
            return aggregate(matches.stream().map(IndexedResult::result).toList());
        }

        var best = bestMatch(leaf, matches);
        record.consume(best.index());
        return outcomeOf(best.result());
    }

    private List<IndexedResult> match(TestNode leaf, List<IndexedResult> candidates) {
        var displayName = leaf.displayName();
        var qualifiedName = leaf.qualifiedName();

        if (TitlePattern.isOnlyToken(displayName)) {
            var ancestors = leaf.ancestorNames();
            return candidates.stream()
                    .filter(c -> endsWith(c.result().ancestorTitles(), ancestors))
                    .toList();
        }

        List<Predicate<AssertionResult>> rules = new ArrayList<>();
        rules.add(r -> TitlePattern.matches(r.title(), displayName)
                || TitlePattern.matchesWithSuffix(r.title(), displayName));
        var lastSegment = lastSegment(leaf);
        if (lastSegment != null) {
            rules.add(r -> TitlePattern.matches(r.title(), lastSegment));
        }
        rules.add(r -> r.fullName() != null
                && (TitlePattern.matches(r.fullName(), displayName)
                        || TitlePattern.matches(r.fullName(), qualifiedName)));
        rules.add(r -> {
            var path = r.path();
            return TitlePattern.matches(path, displayName)
                    || TitlePattern.matches(path, qualifiedName)
                    || TitlePattern.matchesWithSuffix(path, displayName)
                    || TitlePattern.matchesWithSuffix(path, qualifiedName);
        });

        for (var rule : rules) {
            var found = candidates.stream().filter(c -> rule.test(c.result())).toList();
            if (!found.isEmpty()) {
                return found;
            }
        }
        return List.of();
    }

    /**
     * The part of a name not inherited from the enclosing suite, or else its final word. Null when that adds nothing
     * to the display name or is itself only a token.
     */
    static @Nullable String lastSegment(TestNode node) {
        var name = node.displayName();
        var parent = node.parent();
        String segment = null;
        if (parent != null) {
            var prefix = parent.qualifiedName();
            if (!prefix.isEmpty() && name.startsWith(prefix + " ")) {
                segment = name.substring(prefix.length() + 1);
            }
        }
        if (segment == null) {
            int space = name.lastIndexOf(' ');
            segment = space < 0 ? name : name.substring(space + 1);
        }
        if (segment.isEmpty() || segment.equals(name) || TitlePattern.isOnlyToken(segment)) {
            return null;
        }
        return segment;
    }

    private static boolean endsWith(List<String> resultAncestors, List<String> nodeAncestors) {
        if (nodeAncestors.isEmpty()) {
            return resultAncestors.isEmpty();
        }
        if (resultAncestors.size() < nodeAncestors.size()) {
            return false;
        }
        int offset = resultAncestors.size() - nodeAncestors.size();
        return resultAncestors.subList(offset, resultAncestors.size()).equals(nodeAncestors);
    }

    private IndexedResult bestMatch(TestNode leaf, List<IndexedResult> matches) {
        var span = leaf.span();
        if (span != null && matches.size() > 1) {
            int expectedLine = span.startLine() + config.locationLineOffset();
            for (var m : matches) {
                var location = m.result().location();
                if (location != null && location.line() == expectedLine) {
                    return m;
                }
            }
        }
        return matches.get(0);
    }

    static Outcome outcomeOf(AssertionResult result) {
        return switch (result.status()) {
            case PASSED -> Outcome.passed(result.duration());
            case FAILED -> Outcome.failed(failureText(result), result.duration(), result.location());
            case SKIPPED, PENDING, TODO -> Outcome.skipped();
        };
    }

    private static String failureText(AssertionResult result) {
        var messages = result.failureMessages();
        if (messages == null || messages.isEmpty()) {
            return DEFAULT_FAILURE;
        }
        var joined = String.join("\n", messages);
        return joined.isEmpty() ? DEFAULT_FAILURE : joined;
    }

    /** Failed if any failed, else passed if any passed, else skipped; durations are summed. */
    static Outcome aggregate(List<AssertionResult> results) {
        double duration = results.stream()
                .map(AssertionResult::duration)
                .filter(d -> d != null)
                .mapToDouble(Double::doubleValue)
                .sum();
        var failed = results.stream().filter(r -> r.status() == ResultStatus.FAILED).toList();
        if (!failed.isEmpty()) {
            var text = new ArrayList<String>();
            for (int i = 0; i < failed.size(); i++) {
                var r = failed.get(i);
                var label = r.title().isEmpty() ? Integer.toString(i + 1) : r.title();
                var messages = r.failureMessages() == null || r.failureMessages().isEmpty()
                        ? List.of(DEFAULT_FAILURE)
                        : r.failureMessages();
                for (var message : messages) {
                    text.add("[" + label + "]: " + message);
                }
            }
            var location = failed.stream()
                    .map(AssertionResult::location)
                    .filter(l -> l != null)
                    .findFirst()
                    .orElse(null);
            return Outcome.failed(String.join("\n\n", text), duration, location);
        }
        if (results.stream().anyMatch(r -> r.status() == ResultStatus.PASSED)) {
            return Outcome.passed(duration);
        }
        return Outcome.skipped();
    }
}
