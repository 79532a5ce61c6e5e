package ai.testscope.analyzer;

import static ai.testscope.analyzer.typescript.TypeScriptTreeSitterNodeTypes.*;

import ai.testscope.TestScopeConfig;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Recursive descent over one parsed file that records suites, cases and assertions in a {@link TestTree}.
 *
 * <p>Each block gets its own {@link ScopeBindings}, extended statement by statement, so names resolve against the
 * constants declared before them in the same or an enclosing block. Calls that are not declarations still have their
 * function arguments walked, which is how declarations inside hooks and custom wrappers surface.
 */
public final class TestTreeWalker {
    private static final Logger logger = LogManager.getLogger(TestTreeWalker.class);

    private final SourceContent source;
    private final TestTree tree;
    private final ConstantResolver resolver;
    private final DeclarationBinder binder;
    private final CallShapeClassifier classifier;
    private final ParameterizedExpander expander;

    private TestTreeWalker(String file, SourceContent source, TestScopeConfig config) {
        this.source = source;
        this.tree = new TestTree(file);
        this.resolver = new ConstantResolver(source);
        this.binder = new DeclarationBinder(source, resolver);
        this.classifier = new CallShapeClassifier(source, config);
        this.expander = new ParameterizedExpander(source, resolver, binder, this);
    }

    /** Builds the tree of a file from its parsed {@code program} node. */
    public static TestTree walk(String file, TSNode program, SourceContent source, TestScopeConfig config) {
        var walker = new TestTreeWalker(file, source, config);
        walker.walkBlock(program, walker.tree.root(), ScopeBindings.empty());
        logger.debug(
                "Walked {}: {} suites, {} cases, {} assertions",
                file,
                walker.tree.suites().size(),
                walker.tree.cases().size(),
                walker.tree.assertions().size());
        return walker.tree;
    }

    private void walkBlock(TSNode block, TestNode parent, ScopeBindings inherited) {
        var scope = inherited;
        for (var statement : statements(block)) {
            scope = binder.bind(statement, scope);
            walkStatement(statement, parent, scope);
        }
    }

    private static List<TSNode> statements(TSNode block) {
        if (PROGRAM.equals(block.getType()) || STATEMENT_BLOCK.equals(block.getType())) {
            return AstNodes.namedChildren(block);
        }
        // expression-bodied arrow function
        return List.of(block);
    }

    /** Walks a function's body in a scope where its parameters hide outer bindings of the same names. */
    void walkFunction(TSNode function, TestNode parent, ScopeBindings scope) {
        var inner = scope;
        for (var param : AstNodes.parameters(function)) {
            inner = binder.unbind(param, inner);
        }
        walkBody(function, parent, inner);
    }

    /** Walks a function's body with exactly the given scope. */
    void walkBody(TSNode function, TestNode parent, ScopeBindings scope) {
        var body = AstNodes.field(function, FIELD_BODY);
        if (body != null) {
            walkBlock(body, parent, scope);
        }
    }

    TestNode newNode(TestNode parent, TestKind kind) {
        var node = parent.addChild(kind);
        tree.register(node);
        return node;
    }

    private void walkStatement(TSNode statement, TestNode parent, ScopeBindings scope) {
        var call = headCall(statement);
        if (call != null) {
            walkCall(statement, call, parent, scope);
            return;
        }
        switch (statement.getType()) {
            case LEXICAL_DECLARATION, VARIABLE_DECLARATION -> {
                for (var declarator : AstNodes.namedChildren(statement)) {
                    var value = VARIABLE_DECLARATOR.equals(declarator.getType())
                            ? AstNodes.field(declarator, FIELD_VALUE)
                            : null;
                    if (value != null && AstNodes.isFunction(AstNodes.unwrap(value))) {
                        walkFunction(AstNodes.unwrap(value), parent, scope);
                    }
                }
            }
            case EXPORT_STATEMENT -> {
                var declaration = AstNodes.field(statement, FIELD_DECLARATION);
                if (declaration != null) {
                    walkStatement(declaration, parent, scope);
                }
            }
            case EXPRESSION_STATEMENT -> {
                var expression = AstNodes.firstNamedChild(statement);
                if (expression != null && ASSIGNMENT_EXPRESSION.equals(expression.getType())) {
                    var right = AstNodes.field(expression, FIELD_RIGHT);
                    if (right != null && AstNodes.isFunction(AstNodes.unwrap(right))) {
                        walkFunction(AstNodes.unwrap(right), parent, scope);
                    }
                }
            }
            case RETURN_STATEMENT -> {
                var returned = AstNodes.firstNamedChild(statement);
                if (returned != null && CALL_EXPRESSION.equals(AstNodes.unwrap(returned).getType())) {
                    walkFunctionArguments(AstNodes.unwrap(returned), parent, scope);
                }
            }
            default -> {}
        }
    }

    /** The call a statement consists of, looking through {@code await} and parentheses. */
    private static @Nullable TSNode headCall(TSNode statement) {
        var expression = EXPRESSION_STATEMENT.equals(statement.getType())
                ? AstNodes.firstNamedChild(statement)
                : statement;
        if (expression == null) {
            return null;
        }
        expression = AstNodes.unwrap(expression);
        if (AWAIT_EXPRESSION.equals(expression.getType())) {
            var awaited = AstNodes.firstNamedChild(expression);
            if (awaited == null) {
                return null;
            }
            expression = AstNodes.unwrap(awaited);
        }
        return CALL_EXPRESSION.equals(expression.getType()) ? expression : null;
    }

    private void walkCall(TSNode statement, TSNode call, TestNode parent, ScopeBindings scope) {
        var shape = classifier.classify(call);
        TestNode child = null;
        boolean walkArguments = true;

        if (shape instanceof CallShape.Ignored) {
            return;
        } else if (shape instanceof CallShape.Suite) {
            child = declare(TestKind.SUITE, shape, statement, call, parent, scope);
        } else if (shape instanceof CallShape.Case) {
            child = declare(TestKind.CASE, shape, statement, call, parent, scope);
        } else if (shape instanceof CallShape.Assertion) {
            child = newNode(parent, TestKind.ASSERTION);
            child.setSpan(source.spanOf(statement));
            child.setModifier(shape.modifier());
        } else if (shape instanceof CallShape.SuiteEach || shape instanceof CallShape.CaseEach) {
            var kind = shape instanceof CallShape.SuiteEach ? TestKind.SUITE : TestKind.CASE;
            var expansion = expander.expand(statement, call, kind, parent, scope);
            child = expansion.first();
            // expanded suite rows were walked per row; an empty table leaves nothing to attach a body to
            walkArguments = !expansion.expanded() || (kind == TestKind.CASE && child != null);
        }

        if (walkArguments) {
            walkFunctionArguments(call, child != null ? child : parent, scope);
        }
    }

    private void walkFunctionArguments(TSNode call, TestNode parent, ScopeBindings scope) {
        for (var argument : AstNodes.arguments(call)) {
            var function = AstNodes.unwrap(argument);
            if (AstNodes.isFunction(function)) {
                walkFunction(function, parent, scope);
            }
        }
    }

    private TestNode declare(
            TestKind kind, CallShape shape, TSNode statement, TSNode call, TestNode parent, ScopeBindings scope) {
        var node = newNode(parent, kind);
        node.setSpan(source.spanOf(statement));
        node.setModifier(shape.modifier());

        var args = AstNodes.arguments(call);
        if (args.isEmpty()) {
            return node;
        }
        var nameArg = args.get(0);
        node.setDisplayName(displayName(nameArg, kind, scope));
        node.setNameSpan(nameSpanOf(source.spanOf(nameArg)));

        var unwrapped = AstNodes.unwrap(nameArg);
        if (TEMPLATE_STRING.equals(unwrapped.getType()) && scope.insideExpandedRow()) {
            node.setRawTemplate(templateText(unwrapped));
        }
        return node;
    }

    private String displayName(TSNode nameArg, TestKind kind, ScopeBindings scope) {
        var value = resolver.resolve(nameArg, scope);
        if (value.isPresent() && value.get() instanceof StaticValue.Str str) {
            return str.value();
        }
        var unwrapped = AstNodes.unwrap(nameArg);
        if (kind == TestKind.CASE) {
            // Deno.test({ name, fn }) and Deno.test(function name() {})
            var optionName = value.flatMap(v -> v.property("name")).orElse(null);
            if (optionName instanceof StaticValue.Str str) {
                return str.value();
            }
            var functionName = AstNodes.isFunction(unwrapped) ? AstNodes.field(unwrapped, FIELD_NAME) : null;
            if (functionName != null) {
                return source.substringFrom(functionName);
            }
        }
        if (TEMPLATE_STRING.equals(unwrapped.getType())) {
            return templateText(unwrapped);
        }
        return source.substringFrom(nameArg);
    }

    private String templateText(TSNode template) {
        return source.substringFromBytes(template.getStartByte() + 1, template.getEndByte() - 1);
    }

    /** The span of a name argument's text, excluding its opening and closing delimiters. */
    static Span nameSpanOf(Span argument) {
        return new Span(
                argument.startLine(), argument.startColumn() + 1, argument.endLine(), argument.endColumn() - 1);
    }
}
