package ai.testscope.results;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Result model Tests")
class ResultModelTest {

    @Test
    @DisplayName("Runner status strings map leniently")
    void testStatusMapping() {
        assertEquals(ResultStatus.PASSED, ResultStatus.fromJson("passed"));
        assertEquals(ResultStatus.PASSED, ResultStatus.fromJson("PASS"));
        assertEquals(ResultStatus.FAILED, ResultStatus.fromJson("fail"));
        assertEquals(ResultStatus.PENDING, ResultStatus.fromJson("pending"));
        assertEquals(ResultStatus.TODO, ResultStatus.fromJson("todo"));
        assertEquals(ResultStatus.SKIPPED, ResultStatus.fromJson("disabled"));
        assertEquals(ResultStatus.SKIPPED, ResultStatus.fromJson(null));
        assertEquals("failed", ResultStatus.FAILED.jsonValue());
    }

    @Test
    @DisplayName("Missing fields of a result get neutral values")
    void testResultDefaults() {
        var result = new AssertionResult(null, null, null, null, null, null, null);

        assertEquals(List.of(), result.ancestorTitles());
        assertEquals("", result.title());
        assertEquals(ResultStatus.SKIPPED, result.status());
        assertEquals("", result.path());
        assertEquals("a b c", AssertionResult.of(List.of("a", "b"), "c", ResultStatus.PASSED).path());
    }

    @Test
    @DisplayName("Summary counters are derived from the results")
    void testComputedSummary() {
        var document = ResultDocument.of(List.of(
                FileResult.of(
                        "a.test.ts",
                        List.of(
                                AssertionResult.of(List.of(), "a", ResultStatus.PASSED),
                                AssertionResult.of(List.of(), "b", ResultStatus.FAILED))),
                FileResult.of(
                        "b.test.ts",
                        List.of(
                                AssertionResult.of(List.of(), "c", ResultStatus.SKIPPED),
                                AssertionResult.of(List.of(), "d", ResultStatus.TODO)))));

        assertEquals(1, document.numFailedTests());
        assertEquals(1, document.numPassedTests());
        assertEquals(2, document.numPendingTests());
        assertEquals(4, document.numTotalTests());
        assertEquals(1, document.numFailedTestSuites());
        assertEquals(1, document.numPassedTestSuites());
        assertEquals(2, document.numTotalTestSuites());
        assertEquals(Boolean.FALSE, document.success());
        assertEquals(4, document.allAssertionResults().size());
    }

    @Test
    @DisplayName("Normalising keeps reported counters and fills in success")
    void testNormalized() {
        var reported = new ResultDocument(0, 2, 0, 0, 0, 0, 0, 2, null, null);

        var normalized = reported.normalized();
        assertEquals(Boolean.FALSE, normalized.success());
        assertEquals(2, normalized.numFailedTests());
        assertEquals(List.of(), normalized.testResults());

        var explicit = new ResultDocument(0, 0, 0, 0, 0, 0, 0, 0, Boolean.FALSE, List.of());
        assertSame(explicit, explicit.normalized());
    }

    @Test
    @DisplayName("Outcomes carry failure details only when failed")
    void testOutcomes() {
        var failed = Outcome.failed("boom", 2.0, new Location(3, 1));

        assertEquals(OutcomeStatus.FAILED, failed.status());
        assertEquals(new Location(3, 1), failed.failureLocation());
        assertNull(Outcome.passed(1.0).failureText());
        assertSame(Outcome.skipped(), Outcome.skipped());
        assertNull(Outcome.skipped().duration());
    }
}
