package ai.testscope.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TestTree Tests")
class TestTreeTest {

    @Test
    @DisplayName("Registered nodes are listed by kind")
    void testRegister() {
        var tree = new TestTree("a.test.ts");
        assertTrue(tree.isEmpty());

        var suite = tree.root().addChild(TestKind.SUITE);
        tree.register(suite);
        var testCase = suite.addChild(TestKind.CASE);
        tree.register(testCase);
        var assertion = testCase.addChild(TestKind.ASSERTION);
        tree.register(assertion);

        assertFalse(tree.isEmpty());
        assertEquals(List.of(suite), tree.suites());
        assertEquals(List.of(testCase), tree.cases());
        assertEquals(List.of(assertion), tree.assertions());
        assertEquals(List.of(testCase), tree.leaves());
        assertEquals("a.test.ts", tree.root().file());
    }

    @Test
    @DisplayName("Spans are one-based and must not end before they start")
    void testSpan() {
        var span = new Span(3, 1, 5, 4);

        assertTrue(span.containsLine(3));
        assertTrue(span.containsLine(5));
        assertFalse(span.containsLine(6));
        assertEquals("3:1-5:4", span.toString());
        assertThrows(IllegalArgumentException.class, () -> new Span(0, 1, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new Span(4, 1, 3, 1));
    }
}
