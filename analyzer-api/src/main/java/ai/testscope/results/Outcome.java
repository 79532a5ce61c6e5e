package ai.testscope.results;

import org.jetbrains.annotations.Nullable;

/**
 * Reconciled result for one discovered test node.
 *
 * @param failureText message shown for a failed node; null unless {@code status} is {@link OutcomeStatus#FAILED}
 * @param duration summed run time in milliseconds when the runner reported one
 * @param failureLocation where the runner located the first failure, if it did
 */
public record Outcome(
        OutcomeStatus status,
        @Nullable String failureText,
        @Nullable Double duration,
        @Nullable Location failureLocation) {

    private static final Outcome SKIPPED = new Outcome(OutcomeStatus.SKIPPED, null, null, null);

    public static Outcome passed(@Nullable Double duration) {
        return new Outcome(OutcomeStatus.PASSED, null, duration, null);
    }

    public static Outcome failed(String failureText, @Nullable Double duration, @Nullable Location location) {
        return new Outcome(OutcomeStatus.FAILED, failureText, duration, location);
    }

    public static Outcome skipped() {
        return SKIPPED;
    }
}
