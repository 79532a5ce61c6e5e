package ai.testscope.results;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** The results of one test file within a run. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileResult(
        @Nullable String name,
        @Nullable String status,
        @Nullable String message,
        List<AssertionResult> assertionResults) {

    public FileResult {
        assertionResults = assertionResults == null ? List.of() : List.copyOf(assertionResults);
    }

    public static FileResult of(String name, List<AssertionResult> assertionResults) {
        return new FileResult(name, null, null, assertionResults);
    }
}
