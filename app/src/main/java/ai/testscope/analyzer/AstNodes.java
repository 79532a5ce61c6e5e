package ai.testscope.analyzer;

import static ai.testscope.analyzer.typescript.TypeScriptTreeSitterNodeTypes.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Traversal helpers over tree-sitter nodes shared by the resolver, the walker and the expander. */
public final class AstNodes {
    private static final Set<String> FUNCTION_TYPES =
            Set.of(ARROW_FUNCTION, FUNCTION_EXPRESSION, FUNCTION, GENERATOR_FUNCTION);

    private static final Set<String> TRANSPARENT_WRAPPERS =
            Set.of(PARENTHESIZED_EXPRESSION, AS_EXPRESSION, SATISFIES_EXPRESSION, NON_NULL_EXPRESSION, TYPE_ASSERTION);

    private AstNodes() {}

    /** Tree-sitter returns null-nodes rather than null for absent children; both count as absent. */
    public static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    public static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    /** Named children other than comments, in source order. */
    public static List<TSNode> namedChildren(TSNode node) {
        var result = new ArrayList<TSNode>();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (isPresent(child) && !COMMENT.equals(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    public static @Nullable TSNode firstNamedChild(TSNode node) {
        var children = namedChildren(node);
        return children.isEmpty() ? null : children.get(0);
    }

    public static boolean isFunction(@Nullable TSNode node) {
        return isPresent(node) && FUNCTION_TYPES.contains(node.getType());
    }

    /** Strips wrappers that do not change an expression's value: parentheses and TypeScript type assertions. */
    public static TSNode unwrap(TSNode node) {
        var current = node;
        while (TRANSPARENT_WRAPPERS.contains(current.getType())) {
            // <T>x puts the type first, so the expression is the last named child
            var children = namedChildren(current);
            if (children.isEmpty()) {
                return current;
            }
            current = TYPE_ASSERTION.equals(current.getType()) ? children.get(children.size() - 1) : children.get(0);
        }
        return current;
    }

    /** The expression arguments of a call, with comments skipped. */
    public static List<TSNode> arguments(TSNode call) {
        var args = field(call, FIELD_ARGUMENTS);
        if (args == null || !ARGUMENTS.equals(args.getType())) {
            return List.of();
        }
        return namedChildren(args);
    }

    /** Recursively finds the first node matching the given predicate, in pre-order. */
    public static @Nullable TSNode findNodeRecursive(@Nullable TSNode rootNode, Predicate<TSNode> predicate) {
        if (!isPresent(rootNode)) {
            return null;
        }
        if (predicate.test(rootNode)) {
            return rootNode;
        }
        for (int i = 0; i < rootNode.getChildCount(); i++) {
            var result = findNodeRecursive(rootNode.getChild(i), predicate);
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    /** Names bound by a parameter or declaration pattern: identifiers, object and array patterns, defaults, rest. */
    public static List<TSNode> boundIdentifiers(TSNode pattern) {
        var result = new ArrayList<TSNode>();
        collectBound(pattern, result);
        return result;
    }

    private static void collectBound(TSNode node, List<TSNode> out) {
        switch (node.getType()) {
            case IDENTIFIER, SHORTHAND_PROPERTY_IDENTIFIER_PATTERN -> out.add(node);
            case REQUIRED_PARAMETER, OPTIONAL_PARAMETER -> {
                var pattern = field(node, FIELD_PATTERN);
                if (pattern != null) collectBound(pattern, out);
            }
            case PAIR_PATTERN -> {
                var value = field(node, FIELD_VALUE);
                if (value != null) collectBound(value, out);
            }
            case ASSIGNMENT_PATTERN, OBJECT_ASSIGNMENT_PATTERN -> {
                var left = field(node, FIELD_LEFT);
                if (left != null) collectBound(left, out);
            }
            case OBJECT_PATTERN, ARRAY_PATTERN, REST_PATTERN, FORMAL_PARAMETERS -> {
                for (var child : namedChildren(node)) {
                    collectBound(child, out);
                }
            }
            default -> {}
        }
    }

    /** The parameter nodes of a function: a lone arrow parameter or the entries of its parameter list. */
    public static List<TSNode> parameters(TSNode function) {
        var single = field(function, FIELD_PARAMETER);
        if (single != null) {
            return List.of(single);
        }
        var params = field(function, FIELD_PARAMETERS);
        if (params == null) {
            return List.of();
        }
        var result = new ArrayList<TSNode>();
        for (var p : namedChildren(params)) {
            // TypeScript wraps each entry; plain JavaScript lists the patterns directly
            if (REQUIRED_PARAMETER.equals(p.getType()) || OPTIONAL_PARAMETER.equals(p.getType())) {
                var pattern = field(p, FIELD_PATTERN);
                if (pattern != null) result.add(pattern);
            } else {
                result.add(p);
            }
        }
        return result;
    }
}
