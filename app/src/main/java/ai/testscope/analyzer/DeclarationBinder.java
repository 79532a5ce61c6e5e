package ai.testscope.analyzer;

import static ai.testscope.analyzer.typescript.TypeScriptTreeSitterNodeTypes.*;

import java.util.HashSet;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

/**
 * Extends a scope with the names a statement declares. A name whose value cannot be known is removed, so an inner
 * declaration always hides an outer constant of the same name.
 */
final class DeclarationBinder {
    private static final Logger logger = LogManager.getLogger(DeclarationBinder.class);

    private final SourceContent source;
    private final ConstantResolver resolver;

    DeclarationBinder(SourceContent source, ConstantResolver resolver) {
        this.source = source;
        this.resolver = resolver;
    }

    ScopeBindings bind(TSNode statement, ScopeBindings scope) {
        return switch (statement.getType()) {
            case EXPORT_STATEMENT -> {
                var declaration = AstNodes.field(statement, FIELD_DECLARATION);
                yield declaration == null ? scope : bind(declaration, scope);
            }
            case CLASS_DECLARATION, ABSTRACT_CLASS_DECLARATION -> bindClass(statement, scope);
            case FUNCTION_DECLARATION, GENERATOR_FUNCTION_DECLARATION -> {
                var name = AstNodes.field(statement, FIELD_NAME);
                yield name == null ? scope : scope.with(source.substringFrom(name), functionRef(name));
            }
            case LEXICAL_DECLARATION, VARIABLE_DECLARATION -> bindVariables(statement, scope);
            default -> scope;
        };
    }

    private StaticValue functionRef(TSNode name) {
        return new StaticValue.FunctionRef(source.substringFrom(name));
    }

    private ScopeBindings bindClass(TSNode declaration, ScopeBindings scope) {
        var name = AstNodes.field(declaration, FIELD_NAME);
        if (name == null) {
            return scope;
        }
        var instanceMethods = new HashSet<String>();
        var staticMethods = new HashSet<String>();
        var body = AstNodes.field(declaration, FIELD_BODY);
        if (body != null) {
            for (var member : AstNodes.namedChildren(body)) {
                if (!METHOD_DEFINITION.equals(member.getType())) {
                    continue;
                }
                var methodName = AstNodes.field(member, FIELD_NAME);
                if (methodName == null || COMPUTED_PROPERTY_NAME.equals(methodName.getType())) {
                    continue;
                }
                (isStatic(member) ? staticMethods : instanceMethods).add(source.substringFrom(methodName));
            }
        }
        var className = source.substringFrom(name);
        return scope.with(className, new StaticValue.ClassRef(className, instanceMethods, staticMethods));
    }

    private static boolean isStatic(TSNode member) {
        for (int i = 0; i < member.getChildCount(); i++) {
            if ("static".equals(member.getChild(i).getType())) {
                return true;
            }
        }
        return false;
    }

    private ScopeBindings bindVariables(TSNode declaration, ScopeBindings scope) {
        var result = scope;
        for (var declarator : AstNodes.namedChildren(declaration)) {
            if (!VARIABLE_DECLARATOR.equals(declarator.getType())) {
                continue;
            }
            var name = AstNodes.field(declarator, FIELD_NAME);
            if (name == null) {
                continue;
            }
            var valueNode = AstNodes.field(declarator, FIELD_VALUE);
            Optional<StaticValue> value;
            if (valueNode == null) {
                value = Optional.empty();
            } else if (AstNodes.isFunction(valueNode) && IDENTIFIER.equals(name.getType())) {
                value = Optional.of(functionRef(name));
            } else {
                value = resolver.resolve(valueNode, result);
            }
            result = value.isPresent() ? bindPattern(name, value.get(), result) : unbind(name, result);
        }
        return result;
    }

    /** Binds the names of a declaration or parameter pattern against a known value. */
    ScopeBindings bindPattern(TSNode pattern, StaticValue value, ScopeBindings scope) {
        switch (pattern.getType()) {
            case IDENTIFIER, SHORTHAND_PROPERTY_IDENTIFIER_PATTERN -> {
                return scope.with(source.substringFrom(pattern), value);
            }
            case ASSIGNMENT_PATTERN -> {
                var left = AstNodes.field(pattern, FIELD_LEFT);
                return left == null ? scope : bindPattern(left, value, scope);
            }
            case OBJECT_PATTERN -> {
                var result = scope;
                for (var entry : AstNodes.namedChildren(pattern)) {
                    result = bindObjectEntry(entry, value, result);
                }
                return result;
            }
            case ARRAY_PATTERN -> {
                if (!(value instanceof StaticValue.Arr arr)) {
                    return unbind(pattern, scope);
                }
                var result = scope;
                // holes have no node of their own, so positions come from the separating commas
                int position = 0;
                for (int c = 0; c < pattern.getChildCount(); c++) {
                    var element = pattern.getChild(c);
                    if (",".equals(element.getType())) {
                        position++;
                        continue;
                    }
                    if (!element.isNamed() || COMMENT.equals(element.getType())) {
                        continue;
                    }
                    if (REST_PATTERN.equals(element.getType())) {
                        var size = arr.elements().size();
                        var rest = arr.elements().subList(Math.min(position, size), size);
                        var target = AstNodes.firstNamedChild(element);
                        if (target != null) {
                            result = bindPattern(target, new StaticValue.Arr(rest), result);
                        }
                        break;
                    }
                    result = position < arr.elements().size()
                            ? bindPattern(element, arr.elements().get(position), result)
                            : bindDefaultOrUnbind(element, result);
                }
                return result;
            }
            default -> {
                logger.trace("Unsupported binding pattern {}", pattern.getType());
                return unbind(pattern, scope);
            }
        }
    }

    private ScopeBindings bindObjectEntry(TSNode entry, StaticValue value, ScopeBindings scope) {
        switch (entry.getType()) {
            case SHORTHAND_PROPERTY_IDENTIFIER_PATTERN -> {
                var name = source.substringFrom(entry);
                return value.property(name).map(v -> scope.with(name, v)).orElseGet(() -> scope.without(name));
            }
            case OBJECT_ASSIGNMENT_PATTERN -> {
                // { a = 1 }: the property if present, else the default
                var left = AstNodes.field(entry, FIELD_LEFT);
                if (left == null) {
                    return scope;
                }
                var name = source.substringFrom(left);
                var property = value.property(name);
                if (property.isPresent()) {
                    return bindPattern(left, property.get(), scope);
                }
                return bindDefaultOrUnbind(entry, scope);
            }
            case PAIR_PATTERN -> {
                var key = AstNodes.field(entry, FIELD_KEY);
                var target = AstNodes.field(entry, FIELD_VALUE);
                if (key == null || target == null) {
                    return scope;
                }
                var keyName = STRING.equals(key.getType())
                        ? resolver.resolveString(key, scope).orElse("")
                        : source.substringFrom(key);
                var property = COMPUTED_PROPERTY_NAME.equals(key.getType())
                        ? Optional.<StaticValue>empty()
                        : value.property(keyName);
                return property.map(p -> bindPattern(target, p, scope))
                        .orElseGet(() -> bindDefaultOrUnbind(target, scope));
            }
            default -> {
                return unbind(entry, scope);
            }
        }
    }

    private ScopeBindings bindDefaultOrUnbind(TSNode element, ScopeBindings scope) {
        if (ASSIGNMENT_PATTERN.equals(element.getType()) || OBJECT_ASSIGNMENT_PATTERN.equals(element.getType())) {
            var left = AstNodes.field(element, FIELD_LEFT);
            var right = AstNodes.field(element, FIELD_RIGHT);
            if (left != null && right != null) {
                var fallback = resolver.resolve(right, scope);
                if (fallback.isPresent()) {
                    return bindPattern(left, fallback.get(), scope);
                }
            }
        }
        return unbind(element, scope);
    }

    ScopeBindings unbind(TSNode pattern, ScopeBindings scope) {
        var names = AstNodes.boundIdentifiers(pattern).stream().map(source::substringFrom).toList();
        return scope.withoutAll(names);
    }
}
