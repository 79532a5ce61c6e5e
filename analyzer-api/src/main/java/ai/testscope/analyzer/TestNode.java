package ai.testscope.analyzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;

/**
 * One test declaration discovered in a source file.
 *
 * <p>Nodes are created through {@link #addChild(TestKind)} while a file is walked and are not mutated after the walk
 * finishes; a changed file produces a brand-new tree. Equality is identity: two declarations with the same name in the
 * same file are distinct nodes.
 */
public final class TestNode {
    private final TestKind kind;
    private final String file;
    private final @Nullable TestNode parent;
    private final List<TestNode> children = new ArrayList<>();

    private String displayName = "";
    private @Nullable Span span;
    private @Nullable Span nameSpan;
    private @Nullable String modifier;
    private @Nullable String rawTemplate;

    private TestNode(TestKind kind, String file, @Nullable TestNode parent) {
        this.kind = kind;
        this.file = file;
        this.parent = parent;
    }

    /** Creates the root node of a file's tree. */
    public static TestNode root(String file) {
        return new TestNode(TestKind.ROOT, file, null);
    }

    /**
     * Appends a new child. Children keep insertion order, which is source order.
     *
     * @throws IllegalArgumentException if {@code kind} is {@link TestKind#ROOT}
     */
    public TestNode addChild(TestKind kind) {
        if (kind == TestKind.ROOT) {
            throw new IllegalArgumentException("unexpected child node kind: " + kind);
        }
        var child = new TestNode(kind, file, this);
        children.add(child);
        return child;
    }

    public TestKind kind() {
        return kind;
    }

    public String file() {
        return file;
    }

    public @Nullable TestNode parent() {
        return parent;
    }

    public List<TestNode> children() {
        return Collections.unmodifiableList(children);
    }

    public String displayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public @Nullable Span span() {
        return span;
    }

    public void setSpan(@Nullable Span span) {
        this.span = span;
    }

    /** Range of the name argument's text, without its quotes. */
    public @Nullable Span nameSpan() {
        return nameSpan;
    }

    public void setNameSpan(@Nullable Span nameSpan) {
        this.nameSpan = nameSpan;
    }

    /** Last property of the declaring callee, e.g. {@code only} for {@code it.only(...)}. */
    public @Nullable String modifier() {
        return modifier;
    }

    public void setModifier(@Nullable String modifier) {
        this.modifier = modifier;
    }

    /** The unexpanded title of a node produced from a parameterized declaration. */
    public @Nullable String rawTemplate() {
        return rawTemplate;
    }

    public void setRawTemplate(@Nullable String rawTemplate) {
        this.rawTemplate = rawTemplate;
    }

    /** Display names of the enclosing suites, outermost first. The root contributes nothing. */
    public List<String> ancestorNames() {
        var names = new ArrayList<String>();
        for (var p = parent; p != null; p = p.parent) {
            if (p.kind == TestKind.SUITE) {
                names.add(0, p.displayName);
            }
        }
        return names;
    }

    /** Enclosing suite names and this node's name joined with single spaces, skipping empty names. */
    public String qualifiedName() {
        var parts = new ArrayList<String>(ancestorNames());
        parts.add(displayName);
        parts.removeIf(String::isEmpty);
        return String.join(" ", parts);
    }

    /** Depth-first, pre-order collection of descendants matching {@code predicate}; this node is not tested. */
    public List<TestNode> filter(Predicate<TestNode> predicate) {
        var result = new ArrayList<TestNode>();
        collect(this, predicate, result);
        return result;
    }

    private static void collect(TestNode node, Predicate<TestNode> predicate, List<TestNode> result) {
        for (var child : node.children) {
            if (predicate.test(child)) {
                result.add(child);
            }
            collect(child, predicate, result);
        }
    }

    @Override
    public String toString() {
        return "TestNode[" + kind + " '" + displayName + "'" + (span == null ? "" : " @" + span) + "]";
    }
}
