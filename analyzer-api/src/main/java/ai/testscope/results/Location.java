package ai.testscope.results;

/** One-based line and column reported by a runner for a test's declaring statement. */
public record Location(int line, int column) {}
