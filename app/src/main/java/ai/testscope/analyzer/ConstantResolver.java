package ai.testscope.analyzer;

import static ai.testscope.analyzer.typescript.TypeScriptTreeSitterNodeTypes.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Optional;
import org.treesitter.TSNode;

/**
 * Evaluates the expressions test titles and data tables are usually written with: literals, templates, array and object
 * literals, member access into them, identifiers bound to such values and string concatenation.
 *
 * <p>Anything that would need execution (calls, conditionals, arithmetic) is unresolvable and yields an empty result.
 * The resolver never guesses a value.
 */
public final class ConstantResolver {
    private final SourceContent source;

    public ConstantResolver(SourceContent source) {
        this.source = source;
    }

    public Optional<StaticValue> resolve(TSNode expression, ScopeBindings scope) {
        var node = AstNodes.unwrap(expression);
        return switch (node.getType()) {
            case STRING -> Optional.of(StaticValue.str(cookString(node)));
            case TEMPLATE_STRING -> resolveTemplate(node, scope);
            case NUMBER -> {
                var d = JsNumbers.parseLiteral(source.substringFrom(node));
                yield d.isPresent() ? Optional.of(StaticValue.num(d.getAsDouble())) : Optional.empty();
            }
            case TRUE -> Optional.of(new StaticValue.Bool(true));
            case FALSE -> Optional.of(new StaticValue.Bool(false));
            case NULL -> Optional.of(StaticValue.NULL);
            case UNARY_EXPRESSION -> resolveSignedNumber(node);
            case IDENTIFIER -> scope.lookup(source.substringFrom(node));
            case ARRAY -> resolveArray(node, scope);
            case OBJECT -> resolveObject(node, scope);
            case MEMBER_EXPRESSION -> resolveMember(node, scope);
            case SUBSCRIPT_EXPRESSION -> resolveSubscript(node, scope);
            case BINARY_EXPRESSION -> resolveConcatenation(node, scope);
            default -> Optional.empty();
        };
    }

    /** Convenience for callers that only accept a string. */
    public Optional<String> resolveString(TSNode expression, ScopeBindings scope) {
        return resolve(expression, scope)
                .flatMap(v -> v instanceof StaticValue.Str s ? Optional.of(s.value()) : Optional.empty());
    }

    /**
     * Renders a template literal's content, substituting the interpolations that resolve and keeping the others
     * verbatim as {@code ${expr}}. Other expressions resolve normally, falling back to their source text.
     */
    public String resolvePartially(TSNode expression, ScopeBindings scope) {
        var node = AstNodes.unwrap(expression);
        if (!TEMPLATE_STRING.equals(node.getType())) {
            return resolve(node, scope).flatMap(StaticValue::toJsString).orElseGet(() -> source.substringFrom(node));
        }
        var sb = new StringBuilder();
        int cursor = node.getStartByte() + 1;
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (!TEMPLATE_SUBSTITUTION.equals(child.getType())) {
                continue;
            }
            sb.append(cookTemplateSegment(cursor, child.getStartByte()));
            var inner = AstNodes.firstNamedChild(child);
            var value = inner == null
                    ? Optional.<String>empty()
                    : resolve(inner, scope).flatMap(StaticValue::toJsString);
            sb.append(value.orElseGet(() -> source.substringFrom(child)));
            cursor = child.getEndByte();
        }
        sb.append(cookTemplateSegment(cursor, node.getEndByte() - 1));
        return sb.toString();
    }

    /** Whether a template literal has no {@code ${...}} interpolation. */
    public static boolean isPlainTemplate(TSNode node) {
        for (int i = 0; i < node.getChildCount(); i++) {
            if (TEMPLATE_SUBSTITUTION.equals(node.getChild(i).getType())) {
                return false;
            }
        }
        return true;
    }

    private Optional<StaticValue> resolveTemplate(TSNode node, ScopeBindings scope) {
        var sb = new StringBuilder();
        int cursor = node.getStartByte() + 1;
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (!TEMPLATE_SUBSTITUTION.equals(child.getType())) {
                continue;
            }
            sb.append(cookTemplateSegment(cursor, child.getStartByte()));
            var inner = AstNodes.firstNamedChild(child);
            if (inner == null) {
                return Optional.empty();
            }
            var value = resolve(inner, scope).flatMap(StaticValue::toJsString);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            sb.append(value.get());
            cursor = child.getEndByte();
        }
        sb.append(cookTemplateSegment(cursor, node.getEndByte() - 1));
        return Optional.of(StaticValue.str(sb.toString()));
    }

    private String cookTemplateSegment(int startByte, int endByte) {
        if (endByte <= startByte) {
            return "";
        }
        return JsStrings.unescape(source.substringFromBytes(startByte, endByte));
    }

    private String cookString(TSNode node) {
        var text = source.substringFrom(node);
        if (text.length() < 2) {
            return "";
        }
        return JsStrings.unescape(text.substring(1, text.length() - 1));
    }

    // -1 and +1 in data tables are literals to the reader, even though the grammar sees an operator
    private Optional<StaticValue> resolveSignedNumber(TSNode node) {
        var argument = AstNodes.field(node, FIELD_ARGUMENT);
        var operator = AstNodes.field(node, FIELD_OPERATOR);
        if (argument == null || operator == null || !NUMBER.equals(argument.getType())) {
            return Optional.empty();
        }
        var op = source.substringFrom(operator);
        var d = JsNumbers.parseLiteral(source.substringFrom(argument));
        if (d.isEmpty()) {
            return Optional.empty();
        }
        return switch (op) {
            case "-" -> Optional.of(StaticValue.num(-d.getAsDouble()));
            case "+" -> Optional.of(StaticValue.num(d.getAsDouble()));
            default -> Optional.empty();
        };
    }

    private Optional<StaticValue> resolveArray(TSNode node, ScopeBindings scope) {
        if (hasHole(node)) {
            return Optional.empty();
        }
        var elements = new ArrayList<StaticValue>();
        for (var child : AstNodes.namedChildren(node)) {
            if (SPREAD_ELEMENT.equals(child.getType())) {
                var inner = AstNodes.firstNamedChild(child);
                var spread = inner == null ? Optional.<StaticValue>empty() : resolve(inner, scope);
                if (spread.isPresent() && spread.get() instanceof StaticValue.Arr arr) {
                    elements.addAll(arr.elements());
                } else if (spread.isPresent() && spread.get() instanceof StaticValue.Str str) {
                    str.value()
                            .codePoints()
                            .forEach(cp -> elements.add(StaticValue.str(new String(Character.toChars(cp)))));
                } else {
                    return Optional.empty();
                }
                continue;
            }
            var value = resolve(child, scope);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            elements.add(value.get());
        }
        return Optional.of(new StaticValue.Arr(elements));
    }

    // [a, , b] reads as undefined in the middle, which has no static value here
    private static boolean hasHole(TSNode array) {
        boolean expectingElement = true;
        for (int i = 0; i < array.getChildCount(); i++) {
            var type = array.getChild(i).getType();
            if (",".equals(type)) {
                if (expectingElement) {
                    return true;
                }
                expectingElement = true;
            } else if (!"[".equals(type) && !"]".equals(type) && !COMMENT.equals(type)) {
                expectingElement = false;
            }
        }
        return false;
    }

    private Optional<StaticValue> resolveObject(TSNode node, ScopeBindings scope) {
        var properties = new LinkedHashMap<String, StaticValue>();
        for (var child : AstNodes.namedChildren(node)) {
            switch (child.getType()) {
                case PAIR -> {
                    var key = AstNodes.field(child, FIELD_KEY);
                    var valueNode = AstNodes.field(child, FIELD_VALUE);
                    if (key == null || valueNode == null) {
                        continue;
                    }
                    var name = propertyKey(key);
                    var value = resolve(valueNode, scope);
                    if (name.isPresent() && value.isPresent()) {
                        properties.put(name.get(), value.get());
                    }
                }
                case SHORTHAND_PROPERTY_IDENTIFIER -> {
                    var name = source.substringFrom(child);
                    scope.lookup(name).ifPresent(v -> properties.put(name, v));
                }
                case SPREAD_ELEMENT -> {
                    var inner = AstNodes.firstNamedChild(child);
                    var spread = inner == null ? Optional.<StaticValue>empty() : resolve(inner, scope);
                    if (spread.isEmpty()) {
                        return Optional.empty();
                    }
                    if (spread.get() instanceof StaticValue.Obj obj) {
                        properties.putAll(obj.properties());
                    } else if (spread.get() instanceof StaticValue.Arr arr) {
                        for (int i = 0; i < arr.elements().size(); i++) {
                            properties.put(Integer.toString(i), arr.elements().get(i));
                        }
                    }
                }
                case METHOD_DEFINITION -> {
                    var key = AstNodes.field(child, FIELD_NAME);
                    if (key != null) {
                        propertyKey(key).ifPresent(k -> properties.put(k, new StaticValue.FunctionRef(k)));
                    }
                }
                default -> {}
            }
        }
        return Optional.of(new StaticValue.Obj(properties));
    }

    private Optional<String> propertyKey(TSNode key) {
        return switch (key.getType()) {
            case PROPERTY_IDENTIFIER, IDENTIFIER -> Optional.of(source.substringFrom(key));
            case STRING -> Optional.of(cookString(key));
            case NUMBER -> {
                var d = JsNumbers.parseLiteral(source.substringFrom(key));
                yield d.isPresent() ? Optional.of(JsNumbers.format(d.getAsDouble())) : Optional.empty();
            }
            // computed keys are skipped rather than evaluated
            default -> Optional.empty();
        };
    }

    private Optional<StaticValue> resolveMember(TSNode node, ScopeBindings scope) {
        var object = AstNodes.field(node, FIELD_OBJECT);
        var property = AstNodes.field(node, FIELD_PROPERTY);
        if (object == null || property == null || PRIVATE_PROPERTY_IDENTIFIER.equals(property.getType())) {
            return Optional.empty();
        }
        var target = resolve(object, scope);
        return target.flatMap(t -> t.property(source.substringFrom(property)));
    }

    private Optional<StaticValue> resolveSubscript(TSNode node, ScopeBindings scope) {
        var object = AstNodes.field(node, FIELD_OBJECT);
        var index = AstNodes.field(node, FIELD_INDEX);
        if (object == null || index == null) {
            return Optional.empty();
        }
        var key = resolve(index, scope).filter(StaticValue::isPrimitive).flatMap(StaticValue::toJsString);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return resolve(object, scope).flatMap(t -> t.property(key.get()));
    }

    private Optional<StaticValue> resolveConcatenation(TSNode node, ScopeBindings scope) {
        var operator = AstNodes.field(node, FIELD_OPERATOR);
        if (operator == null || !"+".equals(source.substringFrom(operator))) {
            return Optional.empty();
        }
        var leftNode = AstNodes.field(node, FIELD_LEFT);
        var rightNode = AstNodes.field(node, FIELD_RIGHT);
        if (leftNode == null || rightNode == null) {
            return Optional.empty();
        }
        var left = resolve(leftNode, scope);
        var right = resolve(rightNode, scope);
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        if (!(left.get() instanceof StaticValue.Str) && !(right.get() instanceof StaticValue.Str)) {
            return Optional.empty();
        }
        var l = left.get().toJsString();
        var r = right.get().toJsString();
        if (l.isEmpty() || r.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(StaticValue.str(l.get() + r.get()));
    }
}
