package ai.testscope.results;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A structured runner report: {@code { testResults: [ { assertionResults: [...] } ] }} plus Jest's optional summary
 * counters. Reports from runners that omit the counters deserialize with zeros and a null {@code success}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResultDocument(
        int numFailedTestSuites,
        int numFailedTests,
        int numPassedTestSuites,
        int numPassedTests,
        int numPendingTestSuites,
        int numPendingTests,
        int numTotalTestSuites,
        int numTotalTests,
        @Nullable Boolean success,
        List<FileResult> testResults) {

    public ResultDocument {
        testResults = testResults == null ? List.of() : List.copyOf(testResults);
    }

    public static ResultDocument of(List<FileResult> testResults) {
        return new ResultDocument(0, 0, 0, 0, 0, 0, 0, 0, null, testResults).withComputedSummary();
    }

    /** All assertion results of all files, in report order. */
    public List<AssertionResult> allAssertionResults() {
        return testResults.stream().flatMap(f -> f.assertionResults().stream()).toList();
    }

    /**
     * Fills in what Vitest-style reports leave out: missing counters stay zero and a missing {@code success} becomes
     * {@code numFailedTests == 0}.
     */
    public ResultDocument normalized() {
        if (success != null) {
            return this;
        }
        return new ResultDocument(
                numFailedTestSuites,
                numFailedTests,
                numPassedTestSuites,
                numPassedTests,
                numPendingTestSuites,
                numPendingTests,
                numTotalTestSuites,
                numTotalTests,
                numFailedTests == 0,
                testResults);
    }

    /**
     * Returns a copy whose counters are derived from the assertion results, used for reports that carry no summary.
     */
    public ResultDocument withComputedSummary() {
        int failed = 0;
        int passed = 0;
        int pending = 0;
        int failedFiles = 0;
        for (var file : testResults) {
            boolean fileFailed = false;
            for (var r : file.assertionResults()) {
                switch (r.status()) {
                    case PASSED -> passed++;
                    case FAILED -> {
                        failed++;
                        fileFailed = true;
                    }
                    default -> pending++;
                }
            }
            if (fileFailed) {
                failedFiles++;
            }
        }
        int files = testResults.size();
        return new ResultDocument(
                failedFiles,
                failed,
                files - failedFiles,
                passed,
                0,
                pending,
                files,
                failed + passed + pending,
                success != null ? success : failed == 0,
                testResults);
    }
}
