package ai.testscope.results;

import java.util.BitSet;

/** Result indices already assigned to a node during one reconciliation pass. */
final class MatchRecord {
    private final BitSet consumed = new BitSet();

    boolean isConsumed(int index) {
        return consumed.get(index);
    }

    void consume(int index) {
        consumed.set(index);
    }

    int size() {
        return consumed.cardinality();
    }
}
