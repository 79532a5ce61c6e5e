package ai.testscope.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.testscope.TestScopeConfig;
import ai.testscope.analyzer.TestSourceParser.SourceParseException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("TestSourceParser Tests")
class TestSourceParserTest {

    private final TestSourceParser parser = new TestSourceParser(TestScopeConfig.defaults());

    @Test
    @DisplayName("The grammar is chosen from the file extension")
    void testLanguageSelection() {
        assertEquals(SourceLanguage.JAVASCRIPT, SourceLanguage.forFile("a.test.js"));
        assertEquals(SourceLanguage.JAVASCRIPT, SourceLanguage.forFile("a.spec.mjs"));
        assertEquals(SourceLanguage.JAVASCRIPT, SourceLanguage.forFile("Component.test.jsx"));
        assertEquals(SourceLanguage.TYPESCRIPT, SourceLanguage.forFile("a.test.ts"));
        assertEquals(SourceLanguage.TYPESCRIPT, SourceLanguage.forFile("a.test.CTS"));
        assertEquals(SourceLanguage.TSX, SourceLanguage.forFile("Component.test.tsx"));
    }

    @Test
    @DisplayName("TSX files with type annotations parse with the TypeScript grammar")
    void testTsxTypes() throws Exception {
        var tree = parser.parse(
                "Button.test.tsx",
                """
                describe('<Button />', () => {
                  it('renders its label', () => {
                    const label: string = 'Save';
                    expect(label).toBe('Save');
                  });
                });
                """);

        assertEquals("<Button />", tree.suites().get(0).displayName());
        assertEquals("renders its label", tree.cases().get(0).displayName());
        assertEquals(1, tree.assertions().size());
    }

    @Test
    @DisplayName("TSX files with JSX and no type syntax fall back to the JavaScript grammar")
    void testTsxJsx() throws Exception {
        var tree = parser.parse(
                "Button.test.tsx",
                """
                import { render } from '@testing-library/react';

                describe('<Button />', () => {
                  it('renders its label', () => {
                    render(<Button label="Save" />);
                    expect(screen.getByText('Save')).toBeInTheDocument();
                  });
                });
                """);

        assertEquals("renders its label", tree.cases().get(0).displayName());
        assertEquals(1, tree.assertions().size());
    }

    @Test
    @DisplayName("TSX mixing JSX with type annotations is reported as a syntax error")
    void testTsxMixed() {
        var ex = assertThrows(
                SourceParseException.class,
                () -> parser.parse(
                        "Button.test.tsx",
                        """
                        it('renders', () => {
                          const label: string = 'Save';
                          render(<Button label={label} />);
                        });
                        """));

        assertEquals("Button.test.tsx", ex.file());
    }

    @Test
    @DisplayName("JSX in a .jsx file parses with the JavaScript grammar")
    void testJsx() throws Exception {
        var tree = parser.parse("List.test.jsx", "it('renders', () => { render(<List items={[]} />); });\n");

        assertEquals(List.of("renders"), tree.cases().stream().map(TestNode::displayName).toList());
    }

    @Test
    @DisplayName("A syntax error is reported with its one-based position")
    void testSyntaxError() {
        var ex = assertThrows(
                SourceParseException.class,
                () -> parser.parse(
                        "broken.test.js",
                        """
                        describe('ok', () => {
                          it('fine', () => {});
                        });
                        )
                        """));

        assertEquals("broken.test.js", ex.file());
        assertEquals(4, ex.line());
        assertEquals(1, ex.column());
        assertEquals("Syntax error in broken.test.js at line 4, column 1", ex.getMessage());
    }

    @Test
    @DisplayName("An unterminated block is a syntax error")
    void testUnterminatedBlock() {
        assertThrows(SourceParseException.class, () -> parser.parse("open.test.ts", "describe('x', () => {\n"));
    }

    @Test
    @DisplayName("Files are read from disk with the path as the tree's file")
    void testParseFile(@TempDir Path dir) throws Exception {
        var file = dir.resolve("disk.test.ts");
        Files.writeString(file, "\uFEFFtest('from disk', () => {});\n");

        var tree = parser.parse(file);
        assertEquals(file.toString(), tree.file());
        assertEquals(file.toString(), tree.cases().get(0).file());
        assertEquals(new Span(1, 1, 1, 28), tree.cases().get(0).span());
    }

    @Test
    @DisplayName("Hashbang lines and comments are ignored")
    void testHashbangAndComments() throws Exception {
        var tree = parser.parse(
                "cli.test.js",
                """
                #!/usr/bin/env node
                // it('commented out', () => {});
                /* describe('also commented', () => {}); */
                it('real', () => {});
                """);

        assertEquals(1, tree.cases().size());
        assertEquals(4, tree.cases().get(0).span().startLine());
    }
}
