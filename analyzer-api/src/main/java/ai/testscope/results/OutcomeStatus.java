package ai.testscope.results;

/** Final status assigned to a discovered test node after reconciliation. */
public enum OutcomeStatus {
    PASSED,
    FAILED,
    SKIPPED
}
