package ai.testscope.analyzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The complete set of declarations discovered in one file: a single {@link TestKind#ROOT} node plus flat indexes of the
 * suites, cases and assertions in discovery order.
 */
public final class TestTree {
    private final String file;
    private final TestNode root;
    private final List<TestNode> suites = new ArrayList<>();
    private final List<TestNode> cases = new ArrayList<>();
    private final List<TestNode> assertions = new ArrayList<>();

    public TestTree(String file) {
        this.file = file;
        this.root = TestNode.root(file);
    }

    public String file() {
        return file;
    }

    public TestNode root() {
        return root;
    }

    /** Records a node created under this tree's root in the matching index. */
    public void register(TestNode node) {
        switch (node.kind()) {
            case SUITE -> suites.add(node);
            case CASE -> cases.add(node);
            case ASSERTION -> assertions.add(node);
            case ROOT -> throw new IllegalArgumentException("root nodes are not registered");
        }
    }

    public List<TestNode> suites() {
        return Collections.unmodifiableList(suites);
    }

    public List<TestNode> cases() {
        return Collections.unmodifiableList(cases);
    }

    public List<TestNode> assertions() {
        return Collections.unmodifiableList(assertions);
    }

    /** The case nodes in source order; these are the nodes reconciliation assigns outcomes to. */
    public List<TestNode> leaves() {
        return root.filter(n -> n.kind() == TestKind.CASE);
    }

    public boolean isEmpty() {
        return root.children().isEmpty();
    }
}
