package ai.testscope.analyzer;

/** Kind of a node in a discovered test tree. */
public enum TestKind {
    /** The per-file root; exactly one per tree, never has a span. */
    ROOT,
    /** A grouping declaration such as {@code describe(...)}. */
    SUITE,
    /** A single test declaration such as {@code it(...)} or {@code test(...)}. */
    CASE,
    /** An {@code expect(...)} statement, kept for navigation only. */
    ASSERTION
}
