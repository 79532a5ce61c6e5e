package ai.testscope.analyzer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A value known without executing the program. Only the shapes that test titles and data tables are built from are
 * modeled; anything else is unresolvable and never represented here.
 */
public sealed interface StaticValue {

    record Str(String value) implements StaticValue {}

    record Num(double value) implements StaticValue {}

    record Bool(boolean value) implements StaticValue {}

    record Null() implements StaticValue {}

    record Arr(List<StaticValue> elements) implements StaticValue {
        public Arr {
            elements = List.copyOf(elements);
        }
    }

    /** Object literal; property order is insertion order. */
    record Obj(Map<String, StaticValue> properties) implements StaticValue {
        public Obj {
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }
    }

    /** A declared class, usable through {@code .name}, its static methods and its prototype's methods. */
    record ClassRef(String name, Set<String> instanceMethods, Set<String> staticMethods) implements StaticValue {
        public ClassRef {
            instanceMethods = Set.copyOf(instanceMethods);
            staticMethods = Set.copyOf(staticMethods);
        }
    }

    record Prototype(ClassRef owner) implements StaticValue {}

    /** A declared function or method; only its {@code name} is known. */
    record FunctionRef(String name) implements StaticValue {}

    Null NULL = new Null();

    static Str str(String s) {
        return new Str(s);
    }

    static Num num(double d) {
        return new Num(d);
    }

    /**
     * {@code String(value)}. Empty for values whose string form is their source text (classes and functions), which is
     * not tracked.
     */
    default Optional<String> toJsString() {
        if (this instanceof Str s) return Optional.of(s.value());
        if (this instanceof Num n) return Optional.of(JsNumbers.format(n.value()));
        if (this instanceof Bool b) return Optional.of(Boolean.toString(b.value()));
        if (this instanceof Null) return Optional.of("null");
        if (this instanceof Obj || this instanceof Prototype) return Optional.of("[object Object]");
        if (this instanceof Arr a) {
            var sb = new StringBuilder();
            for (int i = 0; i < a.elements().size(); i++) {
                if (i > 0) sb.append(',');
                var e = a.elements().get(i);
                if (e instanceof Null) continue;
                var part = e.toJsString();
                if (part.isEmpty()) return Optional.empty();
                sb.append(part.get());
            }
            return Optional.of(sb.toString());
        }
        return Optional.empty();
    }

    default boolean isPrimitive() {
        return this instanceof Str || this instanceof Num || this instanceof Bool || this instanceof Null;
    }

    /** Property access, or empty where the property would be {@code undefined} or is not tracked. */
    default Optional<StaticValue> property(String key) {
        if (this instanceof Str s) {
            if (key.equals("length")) return Optional.of(num(s.value().length()));
            return index(key, s.value().length()).map(i -> str(String.valueOf(s.value().charAt(i))));
        }
        if (this instanceof Arr a) {
            if (key.equals("length")) return Optional.of(num(a.elements().size()));
            return index(key, a.elements().size()).map(i -> a.elements().get(i));
        }
        if (this instanceof Obj o) {
            return Optional.ofNullable(o.properties().get(key));
        }
        if (this instanceof ClassRef c) {
            if (key.equals("name")) return Optional.of(str(c.name()));
            if (key.equals("prototype")) return Optional.of(new Prototype(c));
            if (c.staticMethods().contains(key)) return Optional.of(new FunctionRef(key));
            return Optional.empty();
        }
        if (this instanceof Prototype p) {
            return p.owner().instanceMethods().contains(key) ? Optional.of(new FunctionRef(key)) : Optional.empty();
        }
        if (this instanceof FunctionRef f) {
            return key.equals("name") ? Optional.of(str(f.name())) : Optional.empty();
        }
        return Optional.empty();
    }

    private static Optional<Integer> index(String key, int size) {
        if (key.isEmpty() || key.length() > 9 || !key.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        if (key.length() > 1 && key.charAt(0) == '0') {
            return Optional.empty();
        }
        int i = Integer.parseInt(key);
        return i < size ? Optional.of(i) : Optional.empty();
    }

    /**
     * Node's {@code util.inspect} rendering with the given nesting depth: strings single-quoted, arrays as {@code [ 1,
     * 2 ]}, objects as {@code { a: 1 }}, containers beyond {@code depth} as {@code [Array]} / {@code [Object]}.
     */
    default String inspect(int depth) {
        return Inspector.inspect(this, depth, 0);
    }

    /** Jest's compact {@code pretty-format} with a max depth of one: {@code {"a": 1, "b": [Array]}}. */
    default String prettyMin() {
        return Inspector.pretty(this, 1, 0);
    }

    /** {@code JSON.stringify} as a tree; empty for values that stringify to {@code undefined}. */
    default Optional<JsonNode> toJson() {
        var f = JsonNodeFactory.instance;
        if (this instanceof Str s) return Optional.of(f.textNode(s.value()));
        if (this instanceof Num n) {
            double d = n.value();
            if (Double.isNaN(d) || Double.isInfinite(d)) return Optional.of(f.nullNode());
            if (JsNumbers.isIntegral(d) && Math.abs(d) < 9.007199254740992E15) {
                return Optional.of(f.numberNode((long) d));
            }
            return Optional.of(f.numberNode(d));
        }
        if (this instanceof Bool b) return Optional.of(f.booleanNode(b.value()));
        if (this instanceof Null) return Optional.of(f.nullNode());
        if (this instanceof Arr a) {
            ArrayNode arr = f.arrayNode();
            for (var e : a.elements()) {
                arr.add(e.toJson().orElse(f.nullNode()));
            }
            return Optional.of(arr);
        }
        if (this instanceof Obj o) {
            ObjectNode obj = f.objectNode();
            o.properties().forEach((k, v) -> v.toJson().ifPresent(j -> obj.set(k, j)));
            return Optional.of(obj);
        }
        if (this instanceof Prototype) return Optional.of(f.objectNode());
        return Optional.empty();
    }

    final class Inspector {
        private Inspector() {}

        static String inspect(StaticValue v, int maxDepth, int level) {
            if (v instanceof Str s) return quote(s.value());
            if (v instanceof Num n) {
                return n.value() == 0 && 1 / n.value() < 0 ? "-0" : JsNumbers.format(n.value());
            }
            if (v instanceof Bool || v instanceof Null) return v.toJsString().orElseThrow();
            if (v instanceof ClassRef c) return "[class " + c.name() + "]";
            if (v instanceof FunctionRef fn) return "[Function: " + fn.name() + "]";
            if (v instanceof Prototype) return "{}";
            if (v instanceof Arr a) {
                if (a.elements().isEmpty()) return "[]";
                if (level > maxDepth) return "[Array]";
                return a.elements().stream()
                        .map(e -> inspect(e, maxDepth, level + 1))
                        .collect(Collectors.joining(", ", "[ ", " ]"));
            }
            var o = (Obj) v;
            if (o.properties().isEmpty()) return "{}";
            if (level > maxDepth) return "[Object]";
            return o.properties().entrySet().stream()
                    .map(e -> inspectKey(e.getKey()) + ": " + inspect(e.getValue(), maxDepth, level + 1))
                    .collect(Collectors.joining(", ", "{ ", " }"));
        }

        static String pretty(StaticValue v, int maxDepth, int level) {
            if (v instanceof Str s) return '"' + s.value() + '"';
            if (v instanceof Num n) {
                return n.value() == 0 && 1 / n.value() < 0 ? "-0" : JsNumbers.format(n.value());
            }
            if (v instanceof Bool || v instanceof Null) return v.toJsString().orElseThrow();
            if (v instanceof ClassRef c) return "[class " + c.name() + "]";
            if (v instanceof FunctionRef fn) return "[Function " + fn.name() + "]";
            if (v instanceof Prototype) return "{}";
            if (v instanceof Arr a) {
                if (level >= maxDepth) return "[Array]";
                return a.elements().stream()
                        .map(e -> pretty(e, maxDepth, level + 1))
                        .collect(Collectors.joining(", ", "[", "]"));
            }
            var o = (Obj) v;
            if (level >= maxDepth) return "[Object]";
            return o.properties().entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .map(e -> '"' + e.getKey() + "\": " + pretty(e.getValue(), maxDepth, level + 1))
                    .collect(Collectors.joining(", ", "{", "}"));
        }

        private static String quote(String s) {
            if (s.indexOf('\'') < 0) {
                return "'" + escape(s) + "'";
            }
            if (s.indexOf('"') < 0) {
                return '"' + escape(s) + '"';
            }
            return "'" + escape(s).replace("'", "\\'") + "'";
        }

        private static String escape(String s) {
            return s.replace("\\", "\\\\").replace("\n", "\\n").replace("\t", "\\t").replace("\r", "\\r");
        }

        private static String inspectKey(String key) {
            return key.matches("[A-Za-z_$][\\w$]*") ? key : quote(key);
        }
    }
}
