package ai.testscope.results;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * One reported outcome for a single executed test, in the shape emitted by {@code --json} runner reporters.
 *
 * @param ancestorTitles enclosing suite titles, outermost first; never null
 * @param title the test's own title
 * @param fullName ancestors and title joined by the runner, if reported
 * @param failureMessages messages of a failed test, if any
 * @param location the declaring statement's one-based position, if the runner reports it
 * @param duration run time in milliseconds, if reported
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssertionResult(
        List<String> ancestorTitles,
        String title,
        @Nullable String fullName,
        ResultStatus status,
        @Nullable List<String> failureMessages,
        @Nullable Location location,
        @Nullable Double duration) {

    public AssertionResult {
        ancestorTitles = ancestorTitles == null ? List.of() : List.copyOf(ancestorTitles);
        title = title == null ? "" : title;
        status = status == null ? ResultStatus.SKIPPED : status;
    }

    public static AssertionResult of(List<String> ancestorTitles, String title, ResultStatus status) {
        return new AssertionResult(ancestorTitles, title, null, status, null, null, null);
    }

    public AssertionResult withLocation(int line, int column) {
        return new AssertionResult(
                ancestorTitles, title, fullName, status, failureMessages, new Location(line, column), duration);
    }

    public AssertionResult withFailureMessages(List<String> messages) {
        return new AssertionResult(ancestorTitles, title, fullName, status, messages, location, duration);
    }

    public AssertionResult withFullName(String name) {
        return new AssertionResult(ancestorTitles, title, name, status, failureMessages, location, duration);
    }

    /** Ancestor titles and title joined by single spaces. */
    public String path() {
        if (ancestorTitles.isEmpty()) {
            return title;
        }
        return String.join(" ", ancestorTitles) + " " + title;
    }
}
