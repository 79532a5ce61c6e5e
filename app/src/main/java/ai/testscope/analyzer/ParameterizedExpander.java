package ai.testscope.analyzer;

import static ai.testscope.analyzer.typescript.TypeScriptTreeSitterNodeTypes.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Turns {@code describe.each(table)(title, fn)} and {@code it.each(table)(title, fn)} into one node per table row when
 * both the table and the title template are statically known.
 */
final class ParameterizedExpander {
    private static final Logger logger = LogManager.getLogger(ParameterizedExpander.class);

    private static final String EACH = "each";

    /**
     * Nodes created for one declaration.
     *
     * @param expanded false when the declaration could not be expanded and a single placeholder node was created
     */
    record Expansion(List<TestNode> nodes, boolean expanded) {
        @Nullable
        TestNode first() {
            return nodes.isEmpty() ? null : nodes.get(0);
        }
    }

    private final SourceContent source;
    private final ConstantResolver resolver;
    private final DeclarationBinder binder;
    private final TestTreeWalker walker;

    ParameterizedExpander(
            SourceContent source, ConstantResolver resolver, DeclarationBinder binder, TestTreeWalker walker) {
        this.source = source;
        this.resolver = resolver;
        this.binder = binder;
        this.walker = walker;
    }

    /**
     * Expands the declaration whose outer call is {@code call}. Suite rows are walked here, each with the callback's
     * parameters bound to the row; case callbacks are left to the caller.
     */
    Expansion expand(TSNode statement, TSNode call, TestKind kind, TestNode parent, ScopeBindings scope) {
        var args = AstNodes.arguments(call);
        var titleNode = args.isEmpty() ? null : args.get(0);
        var callback = args.size() > 1 && AstNodes.isFunction(args.get(1)) ? args.get(1) : null;

        var table = table(call, scope);
        var template = titleNode == null ? Optional.<String>empty() : titleTemplate(titleNode, scope);
        if (table.isEmpty() || template.isEmpty()) {
            logger.debug(
                    "Declining expansion at line {}: table {}, title {}",
                    source.lineAt(statement.getStartByte()),
                    table.isPresent() ? "resolved" : "unresolved",
                    template.isPresent() ? "resolved" : "unresolved");
            return new Expansion(List.of(declined(statement, titleNode, kind, parent, scope)), false);
        }

        var rows = table.get().elements();
        var span = source.spanOf(statement);
        var nodes = new ArrayList<TestNode>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            var row = rows.get(i);
            var node = walker.newNode(parent, kind);
            node.setDisplayName(TitleFormatter.format(template.get(), row, i));
            node.setSpan(span);
            node.setModifier(EACH);
            node.setRawTemplate(template.get());
            nodes.add(node);
            if (kind == TestKind.SUITE && callback != null) {
                var rowScope = bindParameters(callback, row, scope).markExpandedRow();
                walker.walkBody(callback, node, rowScope);
            }
        }
        logger.debug("Expanded {} rows of '{}'", rows.size(), template.get());
        return new Expansion(nodes, true);
    }

    private Optional<StaticValue.Arr> table(TSNode call, ScopeBindings scope) {
        var eachCall = AstNodes.field(call, FIELD_FUNCTION);
        if (eachCall == null || !CALL_EXPRESSION.equals(eachCall.getType())) {
            return Optional.empty();
        }
        var eachArgs = AstNodes.arguments(eachCall);
        if (eachArgs.isEmpty()) {
            return Optional.empty();
        }
        return resolver.resolve(eachArgs.get(0), scope)
                .filter(StaticValue.Arr.class::isInstance)
                .map(StaticValue.Arr.class::cast);
    }

    /** A string literal or a template literal without interpolation. */
    private Optional<String> titleTemplate(TSNode titleNode, ScopeBindings scope) {
        var node = AstNodes.unwrap(titleNode);
        if (STRING.equals(node.getType())
                || (TEMPLATE_STRING.equals(node.getType()) && ConstantResolver.isPlainTemplate(node))) {
            return resolver.resolveString(node, scope);
        }
        return Optional.empty();
    }

    private TestNode declined(
            TSNode statement, @Nullable TSNode titleNode, TestKind kind, TestNode parent, ScopeBindings scope) {
        var node = walker.newNode(parent, kind);
        node.setSpan(source.spanOf(statement));
        node.setModifier(EACH);
        if (titleNode != null) {
            node.setDisplayName(resolver.resolvePartially(titleNode, scope));
            node.setNameSpan(TestTreeWalker.nameSpanOf(source.spanOf(titleNode)));
        }
        return node;
    }

    /**
     * A single parameter receives the whole row; several parameters take an array row positionally. Parameters left
     * without a value hide any outer binding of the same name.
     */
    private ScopeBindings bindParameters(TSNode callback, StaticValue row, ScopeBindings scope) {
        var params = AstNodes.parameters(callback);
        var result = scope;
        for (var param : params) {
            result = binder.unbind(param, result);
        }
        if (params.size() == 1) {
            return binder.bindPattern(params.get(0), row, result);
        }
        if (params.size() > 1 && row instanceof StaticValue.Arr arr) {
            for (int i = 0; i < params.size() && i < arr.elements().size(); i++) {
                result = binder.bindPattern(params.get(i), arr.elements().get(i), result);
            }
        }
        return result;
    }
}
