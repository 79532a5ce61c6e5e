package ai.testscope.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.testscope.TestScopeConfig;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TestNamePatterns Tests")
class TestNamePatternsTest {

    private static TestTree parse(String source) throws Exception {
        return new TestSourceParser(TestScopeConfig.defaults()).parse("names.test.js", source);
    }

    @Test
    @DisplayName("The full name at a line joins the enclosing suites")
    void testFullTestNameAt() throws Exception {
        var tree = parse(
                """
                describe('math', () => {
                  describe('add', () => {
                    it('sums ${a} and %s', () => {
                      expect(1).toBe(1);
                    });
                  });
                });
                it('top', () => {});
                """);

        assertEquals(Optional.of("math"), TestNamePatterns.fullTestNameAt(tree, 1));
        assertEquals(Optional.of("math add"), TestNamePatterns.fullTestNameAt(tree, 2));
        assertEquals(Optional.of("math add sums (.*?) and (.*?)"), TestNamePatterns.fullTestNameAt(tree, 4));
        assertEquals(Optional.of("top"), TestNamePatterns.fullTestNameAt(tree, 8));
        assertEquals(Optional.empty(), TestNamePatterns.fullTestNameAt(tree, 7));
    }

    @Test
    @DisplayName("Patterns for expanded rows select every row of the declaration")
    void testPatternForExpandedRow() throws Exception {
        var tree = parse(
                """
                describe('calc (v2)', () => {
                  it.each([1, 2])('handles %s.', (n) => {});
                });
                """);

        var second = tree.cases().get(1);
        assertEquals("handles 2.", second.displayName());
        assertEquals("^calc \\(v2\\) handles (.*?)\\.$", TestNamePatterns.testNamePattern(second));
        assertTrue("calc (v2) handles 1.".matches(TestNamePatterns.testNamePattern(second)));
    }

    @Test
    @DisplayName("Patterns for plain declarations escape regex characters")
    void testPatternEscaping() throws Exception {
        var tree = parse("describe('a.b', () => { it('[x] + y?', () => {}); });\n");

        var pattern = TestNamePatterns.testNamePattern(tree.cases().get(0));
        assertEquals("^a\\.b \\[x\\] \\+ y\\?$", pattern);
        assertTrue("a.b [x] + y?".matches(pattern));
        assertEquals("^a\\.b$", TestNamePatterns.testNamePattern(tree.suites().get(0)));
    }

    @Test
    @DisplayName("Interpolations become wildcards and property artefacts are dropped")
    void testNameCleanup() {
        assertEquals("id (.*?) of (.*?)", TestNamePatterns.resolveInterpolation("id ${id} of $name"));
        assertEquals("row (.*?)", TestNamePatterns.resolveInterpolation("row %#"));
        assertEquals("load", TestNamePatterns.stripPropertyArtefacts("UserService.prototype.load.name"));
        assertEquals("Service works", TestNamePatterns.stripPropertyArtefacts("Service.name works"));
        assertEquals("x(.*?)y", TestNamePatterns.escapeRegExp("x(.*?)y"));
        assertEquals("\\$5", TestNamePatterns.escapeRegExp("$5"));
    }
}
