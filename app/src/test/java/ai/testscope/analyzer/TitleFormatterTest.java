package ai.testscope.analyzer;

import static ai.testscope.analyzer.StaticValue.num;
import static ai.testscope.analyzer.StaticValue.str;
import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TitleFormatter Tests")
class TitleFormatterTest {

    private static StaticValue.Arr arr(StaticValue... values) {
        return new StaticValue.Arr(List.of(values));
    }

    private static StaticValue.Obj obj(Object... keyValues) {
        var map = new LinkedHashMap<String, StaticValue>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], (StaticValue) keyValues[i + 1]);
        }
        return new StaticValue.Obj(map);
    }

    @Test
    @DisplayName("%s prints strings raw and numbers with String()")
    void testStringSpecifier() {
        assertEquals("a and 1.5", TitleFormatter.format("%s and %s", arr(str("a"), num(1.5)), 0));
        assertEquals("value -0", TitleFormatter.format("value %s", num(-0.0), 0));
        assertEquals("flag true", TitleFormatter.format("flag %s", new StaticValue.Bool(true), 0));
        assertEquals("nothing null", TitleFormatter.format("nothing %s", StaticValue.NULL, 0));
    }

    @Test
    @DisplayName("%s inspects containers one level deep")
    void testStringSpecifierOnContainers() {
        var row = arr(arr(num(1), arr(num(2))));
        assertEquals("list [ 1, [Array] ]", TitleFormatter.format("list %s", row, 0));
        assertEquals("obj { a: 'x' }", TitleFormatter.format("obj %s", arr(obj("a", str("x"))), 0));
    }

    @Test
    @DisplayName("Numeric specifiers convert the way Number, parseInt and parseFloat do")
    void testNumericSpecifiers() {
        assertEquals("3 3 3.75", TitleFormatter.format("%d %i %f", arr(str("3"), num(3.75), str("3.75abc")), 0));
        assertEquals("NaN", TitleFormatter.format("%d", str("abc"), 0));
        assertEquals("1", TitleFormatter.format("%d", new StaticValue.Bool(true), 0));
        assertEquals("-7", TitleFormatter.format("%i", num(-7.9), 0));
    }

    @Test
    @DisplayName("%j writes JSON and %o inspects nested values")
    void testJsonAndInspect() {
        var row = obj("a", num(1), "b", arr(str("x")));
        assertEquals("{\"a\":1,\"b\":[\"x\"]}", TitleFormatter.format("%j", arr(row), 0));
        assertEquals("{ a: 1, b: [ 'x' ] }", TitleFormatter.format("%o", arr(row), 0));
        var deep = obj("a", obj("b", obj("c", obj("d", num(1)))));
        assertEquals("{ a: { b: { c: [Object] } } }", TitleFormatter.format("%O", arr(deep), 0));
    }

    @Test
    @DisplayName("%p pretty-formats with sorted keys and %c prints nothing")
    void testPrettyAndCss() {
        var row = obj("b", num(2), "a", arr(num(1)));
        assertEquals("{\"a\": [Array], \"b\": 2}", TitleFormatter.format("%p", arr(row), 0));
        assertEquals("[1, 2]", TitleFormatter.format("%p", arr(arr(num(1), num(2))), 0));
        assertEquals("styled", TitleFormatter.format("%cstyled", str("color: red"), 0));
    }

    @Test
    @DisplayName("Missing values leave specifiers in place and surplus values are dropped")
    void testArgumentCount() {
        assertEquals("a %s", TitleFormatter.format("%s %s", arr(str("a")), 0));
        assertEquals("a", TitleFormatter.format("%s", arr(str("a"), str("b")), 0));
        assertEquals("100% a", TitleFormatter.format("100%% %s", arr(str("a")), 0));
    }

    @Test
    @DisplayName("%# and $# are replaced by the row index")
    void testIndex() {
        assertEquals("case 4: x", TitleFormatter.format("case %#: %s", str("x"), 4));
        assertEquals("row 2 of a", TitleFormatter.format("row $# of $name", obj("name", str("a")), 2));
    }

    @Test
    @DisplayName("Object rows fill $path and ${path} placeholders")
    void testInterpolation() {
        var row = obj("user", obj("name", str("ann"), "tags", arr(str("x"))), "n", num(2));
        assertEquals("ann has 2", TitleFormatter.format("$user.name has $n", row, 0));
        assertEquals("ann has 2", TitleFormatter.format("${user.name} has ${n}", row, 0));
        assertEquals("tags [\"x\"]", TitleFormatter.format("tags $user.tags", row, 0));
        assertEquals("user {\"name\": \"ann\", \"tags\": [Array]}", TitleFormatter.format("user $user", row, 0));
    }

    @Test
    @DisplayName("A dotted path keeps the part that does not resolve")
    void testPartialPath() {
        var row = obj("name", str("ann"));
        assertEquals("hello ann.", TitleFormatter.format("hello $name.", row, 0));
        assertEquals("ann.missing", TitleFormatter.format("$name.missing", row, 0));
        assertEquals("${name.missing} $other", TitleFormatter.format("${name.missing} $other", row, 0));
    }

    @Test
    @DisplayName("Printf substitution runs before interpolation")
    void testPrintfThenInterpolation() {
        var row = obj("a", num(1));
        assertEquals("{ a: 1 } then 1", TitleFormatter.format("%s then $a", row, 0));
        assertEquals("$a stays", TitleFormatter.format("$a stays", arr(num(1)), 0));
    }

    @Test
    @DisplayName("Rows without placeholders leave the template untouched")
    void testNoPlaceholders() {
        assertEquals("plain title", TitleFormatter.format("plain title", arr(num(1)), 0));
        assertEquals("$ price", TitleFormatter.format("$ price", obj("price", num(1)), 0));
    }
}
