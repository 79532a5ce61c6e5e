package ai.testscope.analyzer;

import static ai.testscope.analyzer.typescript.TypeScriptTreeSitterNodeTypes.*;

import ai.testscope.TestScopeConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Classifies a call by its callee's root identifier and member chain, e.g. {@code describe}, {@code it.only},
 * {@code test.describe.parallel}, {@code it.each(table)}, {@code Deno.test} or {@code expect(x).toBe}.
 */
public final class CallShapeClassifier {
    private static final String EACH = "each";
    private static final String DESCRIBE = "describe";
    private static final String STEP = "step";
    private static final String EXPECT = "expect";

    private static final Set<String> PLAYWRIGHT_SUITE_MEMBERS =
            Set.of(DESCRIBE, "only", "skip", "parallel", "serial", "fixme", "fail", EACH);

    private static final Set<String> CASE_HOOK_MEMBERS = Set.of(
            "beforeEach",
            "afterEach",
            "beforeAll",
            "afterAll",
            "use",
            "extend",
            "setTimeout",
            "slow",
            "info",
            "configure");

    private final SourceContent source;
    private final Set<String> suiteNames;
    private final Set<String> caseNames;

    public CallShapeClassifier(SourceContent source, TestScopeConfig config) {
        this.source = source;
        this.suiteNames = config.suiteNames();
        this.caseNames = config.caseNames();
    }

    /** The member chain of a callee: root identifier plus property names, root first. */
    record CalleeChain(String root, List<String> properties) {
        @Nullable
        String lastProperty() {
            return properties.isEmpty() ? null : properties.get(properties.size() - 1);
        }
    }

    public CallShape classify(TSNode call) {
        var callee = AstNodes.field(call, FIELD_FUNCTION);
        if (callee == null) {
            return CallShape.UNRECOGNIZED;
        }

        // it.each(table)(title, fn): the callee is itself a call on an `.each` member
        if (CALL_EXPRESSION.equals(callee.getType())) {
            var inner = AstNodes.field(callee, FIELD_FUNCTION);
            var innerChain = inner == null ? null : chainOf(inner, false);
            if (innerChain != null && EACH.equals(innerChain.lastProperty())) {
                var shape = classifyChain(innerChain);
                if (shape instanceof CallShape.Suite) {
                    return new CallShape.SuiteEach(EACH);
                }
                if (shape instanceof CallShape.Case) {
                    return new CallShape.CaseEach(EACH);
                }
                return shape;
            }
        }

        var chain = chainOf(callee, false);
        if (chain != null) {
            return classifyChain(chain);
        }
        var assertionChain = chainOf(callee, true);
        if (assertionChain != null && EXPECT.equals(assertionChain.root())) {
            return new CallShape.Assertion(assertionChain.lastProperty());
        }
        return CallShape.UNRECOGNIZED;
    }

    private CallShape classifyChain(CalleeChain chain) {
        var root = chain.root();
        var props = chain.properties();
        var last = chain.lastProperty();

        if (EXPECT.equals(root)) {
            return new CallShape.Assertion(last);
        }
        if (suiteNames.contains(root)) {
            return new CallShape.Suite(last);
        }
        if ("test".equals(root) && props.contains(DESCRIBE)) {
            // test.describe(...), test.describe.only(...), but not test.describe.configure(...)
            if (last != null && PLAYWRIGHT_SUITE_MEMBERS.contains(last)) {
                return new CallShape.Suite(DESCRIBE.equals(last) ? null : last);
            }
            return CallShape.UNRECOGNIZED;
        }
        if (caseNames.contains(root)) {
            if (STEP.equals(last)) {
                return new CallShape.Ignored(last);
            }
            if (last != null && CASE_HOOK_MEMBERS.contains(last)) {
                return CallShape.UNRECOGNIZED;
            }
            return new CallShape.Case(last);
        }
        if ("Deno".equals(root) && !props.isEmpty() && "test".equals(props.get(0))) {
            return new CallShape.Case(props.size() > 1 ? last : null);
        }
        return CallShape.UNRECOGNIZED;
    }

    /**
     * Walks a callee down to its root identifier. Calls inside the chain are only crossed when {@code throughCalls}
     * is set, as needed for {@code expect(x).not.toBe(y)}.
     */
    private @Nullable CalleeChain chainOf(TSNode callee, boolean throughCalls) {
        var properties = new ArrayList<String>();
        var node = AstNodes.unwrap(callee);
        while (true) {
            switch (node.getType()) {
                case IDENTIFIER -> {
                    Collections.reverse(properties);
                    return new CalleeChain(source.substringFrom(node), properties);
                }
                case MEMBER_EXPRESSION -> {
                    var property = AstNodes.field(node, FIELD_PROPERTY);
                    var object = AstNodes.field(node, FIELD_OBJECT);
                    if (property == null || object == null) {
                        return null;
                    }
                    properties.add(source.substringFrom(property));
                    node = AstNodes.unwrap(object);
                }
                case CALL_EXPRESSION -> {
                    var function = throughCalls ? AstNodes.field(node, FIELD_FUNCTION) : null;
                    if (function == null) {
                        return null;
                    }
                    node = AstNodes.unwrap(function);
                }
                default -> {
                    return null;
                }
            }
        }
    }
}
