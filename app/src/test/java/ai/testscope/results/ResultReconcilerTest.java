package ai.testscope.results;

import static org.junit.jupiter.api.Assertions.*;

import ai.testscope.TestScopeConfig;
import ai.testscope.analyzer.Span;
import ai.testscope.analyzer.TestKind;
import ai.testscope.analyzer.TestNode;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ResultReconciler Tests")
class ResultReconcilerTest {

    private static final String FILE = "src/math.test.ts";

    private final ResultReconciler reconciler = new ResultReconciler(TestScopeConfig.defaults());

    private static TestNode node(TestNode parent, TestKind kind, String name, int line) {
        var node = parent.addChild(kind);
        node.setDisplayName(name);
        node.setSpan(new Span(line, 3, line + 2, 5));
        return node;
    }

    private static AssertionResult result(
            List<String> ancestors, String title, ResultStatus status, @Nullable Integer line) {
        var r = new AssertionResult(ancestors, title, null, status, null, null, 4.0);
        return line == null ? r : r.withLocation(line, 5);
    }

    private static ResultDocument document(String file, AssertionResult... results) {
        return ResultDocument.of(List.of(FileResult.of(file, List.of(results))));
    }

    @Test
    @DisplayName("Cases are matched by title within their suite")
    void testBasicMatching() {
        var root = TestNode.root(FILE);
        var math = node(root, TestKind.SUITE, "math", 1);
        var adds = node(math, TestKind.CASE, "adds", 2);
        var subtracts = node(math, TestKind.CASE, "subtracts", 6);
        var missing = node(math, TestKind.CASE, "divides", 10);

        var doc = document(
                "/repo/src/math.test.ts",
                result(List.of("math"), "adds", ResultStatus.PASSED, 3),
                result(List.of("math"), "subtracts", ResultStatus.FAILED, 7)
                        .withFailureMessages(List.of("Expected: 1", "Received: 2")));

        var outcomes = reconciler.reconcile(List.of(adds, subtracts, missing), doc);

        assertEquals(List.of(adds, subtracts, missing), List.copyOf(outcomes.keySet()));
        assertEquals(Outcome.passed(4.0), outcomes.get(adds));
        var failed = outcomes.get(subtracts);
        assertEquals(OutcomeStatus.FAILED, failed.status());
        assertEquals("Expected: 1\nReceived: 2", failed.failureText());
        assertEquals(new Location(7, 5), failed.failureLocation());
        assertSame(Outcome.skipped(), outcomes.get(missing));
    }

    @Test
    @DisplayName("Reconciling twice gives the same outcomes")
    void testIdempotent() {
        var root = TestNode.root(FILE);
        var a = node(root, TestKind.CASE, "a", 1);
        var b = node(root, TestKind.CASE, "b", 5);
        var doc = document(
                FILE,
                result(List.of(), "a", ResultStatus.FAILED, 2),
                result(List.of(), "b", ResultStatus.PASSED, 6));

        var first = reconciler.reconcile(List.of(a, b), doc);
        var second = reconciler.reconcile(List.of(a, b), doc);

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Results with the same title go to the node declared on the reported line")
    void testDuplicateTitlesByLine() {
        var root = TestNode.root(FILE);
        var first = node(root, TestKind.CASE, "works", 10);
        var second = node(root, TestKind.CASE, "works", 20);
        var doc = document(
                FILE,
                result(List.of(), "works", ResultStatus.FAILED, 21),
                result(List.of(), "works", ResultStatus.PASSED, 11));

        var outcomes = reconciler.reconcile(List.of(first, second), doc);

        assertEquals(OutcomeStatus.PASSED, outcomes.get(first).status());
        assertEquals(OutcomeStatus.FAILED, outcomes.get(second).status());
    }

    @Test
    @DisplayName("The line offset is configurable")
    void testLineOffset() {
        var root = TestNode.root(FILE);
        var first = node(root, TestKind.CASE, "works", 10);
        var doc = document(
                FILE,
                result(List.of(), "works", ResultStatus.FAILED, 11),
                result(List.of(), "works", ResultStatus.PASSED, 10));

        var exact = new ResultReconciler(TestScopeConfig.defaults().withLocationLineOffset(0));
        assertEquals(OutcomeStatus.PASSED, exact.reconcile(List.of(first), doc).get(first).status());
        assertEquals(OutcomeStatus.FAILED, reconciler.reconcile(List.of(first), doc).get(first).status());
    }

    @Test
    @DisplayName("A node whose name keeps a placeholder stands for every matching result")
    void testAggregation() {
        var root = TestNode.root(FILE);
        var suite = node(root, TestKind.SUITE, "cases", 1);
        var each = node(suite, TestKind.CASE, "handles $case", 2);
        var doc = document(
                FILE,
                result(List.of("cases"), "handles a", ResultStatus.PASSED, 3),
                result(List.of("cases"), "handles b", ResultStatus.FAILED, 3)
                        .withFailureMessages(List.of("boom")),
                result(List.of("cases"), "handles c", ResultStatus.PASSED, 3));

        var outcome = reconciler.reconcile(List.of(each), doc).get(each);

        assertEquals(OutcomeStatus.FAILED, outcome.status());
        assertEquals("[handles b]: boom", outcome.failureText());
        assertEquals(12.0, outcome.duration());
        assertEquals(new Location(3, 5), outcome.failureLocation());
    }

    @Test
    @DisplayName("Aggregated failures without messages are labelled and separated")
    void testAggregationMessages() {
        var outcome = ResultReconciler.aggregate(List.of(
                AssertionResult.of(List.of(), "", ResultStatus.FAILED),
                AssertionResult.of(List.of(), "second", ResultStatus.FAILED).withFailureMessages(List.of("x", "y"))));

        assertEquals("[1]: Test failed\n\n[second]: x\n\n[second]: y", outcome.failureText());
        var todo = AssertionResult.of(List.of(), "t", ResultStatus.TODO);
        assertEquals(Outcome.skipped(), ResultReconciler.aggregate(List.of(todo)));
    }

    @Test
    @DisplayName("A name that is only a placeholder matches the results of its suite")
    void testOnlyTokenName() {
        var root = TestNode.root(FILE);
        var suite = node(root, TestKind.SUITE, "params", 1);
        var each = node(suite, TestKind.CASE, "%s", 2);
        var doc = document(
                FILE,
                result(List.of("other"), "1", ResultStatus.FAILED, 9),
                result(List.of("params"), "1", ResultStatus.PASSED, 3),
                result(List.of("params"), "2", ResultStatus.PASSED, 3));

        var outcome = reconciler.reconcile(List.of(each), doc).get(each);

        assertEquals(OutcomeStatus.PASSED, outcome.status());
        assertEquals(8.0, outcome.duration());
    }

    @Test
    @DisplayName("Runner suffixes on duplicate titles are tolerated")
    void testDuplicateSuffix() {
        var root = TestNode.root(FILE);
        var leaf = node(root, TestKind.CASE, "retries", 1);
        var doc = document(FILE, result(List.of(), "retries (2)", ResultStatus.FAILED, null));

        var outcome = reconciler.reconcile(List.of(leaf), doc).get(leaf);

        assertEquals(OutcomeStatus.FAILED, outcome.status());
        assertEquals("Test failed", outcome.failureText());
    }

    @Test
    @DisplayName("A name that includes its suite still matches the runner's shorter title")
    void testPathMatching() {
        var root = TestNode.root(FILE);
        var leaf = node(root, TestKind.CASE, "login form submits", 1);
        var doc = document(FILE, result(List.of("login form"), "submits", ResultStatus.PASSED, 2));

        assertEquals(OutcomeStatus.PASSED, reconciler.reconcile(List.of(leaf), doc).get(leaf).status());
    }

    @Test
    @DisplayName("Reported full names are matched against the qualified name")
    void testFullNameMatching() {
        var root = TestNode.root(FILE);
        var suite = node(root, TestKind.SUITE, "auth", 1);
        var leaf = node(suite, TestKind.CASE, "logs in", 2);
        var doc = document(
                FILE,
                AssertionResult.of(List.of(), "auth > logs in", ResultStatus.FAILED).withFullName("auth logs in"));

        assertEquals(OutcomeStatus.FAILED, reconciler.reconcile(List.of(leaf), doc).get(leaf).status());
    }

    @Test
    @DisplayName("Rows whose formatted title differs from the runner's fall back to the raw template")
    void testRawTemplateFallback() {
        var root = TestNode.root(FILE);
        var row = node(root, TestKind.CASE, "obj { a: 1 }", 1);
        row.setRawTemplate("obj %o");
        var doc = document(FILE, result(List.of(), "obj {\"a\":1}", ResultStatus.PASSED, 2));

        assertEquals(OutcomeStatus.PASSED, reconciler.reconcile(List.of(row), doc).get(row).status());
    }

    @Test
    @DisplayName("Results from the node's own file are preferred")
    void testSameFilePreference() {
        var root = TestNode.root("src/a.test.ts");
        var leaf = node(root, TestKind.CASE, "works", 1);
        var doc = ResultDocument.of(List.of(
                FileResult.of("/repo/src/b.test.ts", List.of(result(List.of(), "works", ResultStatus.FAILED, 2))),
                FileResult.of("/repo/src/a.test.ts", List.of(result(List.of(), "works", ResultStatus.PASSED, 2)))));

        assertEquals(OutcomeStatus.PASSED, reconciler.reconcile(List.of(leaf), doc).get(leaf).status());
        assertTrue(ResultReconciler.sameFile("C:\\repo\\src\\a.test.ts", "src/a.test.ts"));
        assertFalse(ResultReconciler.sameFile("/repo/src/ba.test.ts", "a.test.ts"));
        assertFalse(ResultReconciler.sameFile(null, "a.test.ts"));
    }

    @Test
    @DisplayName("Skipped, pending and todo results give skipped outcomes")
    void testSkippedStatuses() {
        var root = TestNode.root(FILE);
        var a = node(root, TestKind.CASE, "a", 1);
        var b = node(root, TestKind.CASE, "b", 4);
        var c = node(root, TestKind.CASE, "c", 8);
        var doc = document(
                FILE,
                result(List.of(), "a", ResultStatus.SKIPPED, null),
                result(List.of(), "b", ResultStatus.PENDING, null),
                result(List.of(), "c", ResultStatus.TODO, null));

        var outcomes = reconciler.reconcile(List.of(a, b, c), doc);
        assertTrue(outcomes.values().stream().allMatch(o -> o.status() == OutcomeStatus.SKIPPED));
    }

    @Test
    @DisplayName("Raw output with a JSON report is read, other output is scanned for failure markers")
    void testReconcileOutput() {
        var root = TestNode.root(FILE);
        var math = node(root, TestKind.SUITE, "math", 1);
        var adds = node(math, TestKind.CASE, "adds", 2);
        var subtracts = node(math, TestKind.CASE, "subtracts", 6);

        var json =
                """
                {"testResults":[{"name":"src/math.test.ts","assertionResults":[
                  {"ancestorTitles":["math"],"title":"adds","status":"failed","failureMessages":["nope"]},
                  {"ancestorTitles":["math"],"title":"subtracts","status":"passed"}
                ]}]}
                """;
        var fromJson = reconciler.reconcile(List.of(adds, subtracts), "> jest --json\n" + json);
        assertEquals(OutcomeStatus.FAILED, fromJson.get(adds).status());
        assertEquals(OutcomeStatus.PASSED, fromJson.get(subtracts).status());

        var text =
                """
                FAIL  src/math.test.ts
                  \u001B[31m●\u001B[39m math › subtracts
                    Expected: 1
                """;
        var scanned = reconciler.reconcile(List.of(adds, subtracts), text);
        assertEquals(OutcomeStatus.PASSED, scanned.get(adds).status());
        assertEquals(OutcomeStatus.FAILED, scanned.get(subtracts).status());
        assertEquals("  ● math › subtracts", scanned.get(subtracts).failureText());
    }
}
