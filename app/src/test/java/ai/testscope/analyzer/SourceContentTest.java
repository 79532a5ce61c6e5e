package ai.testscope.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SourceContent Tests")
class SourceContentTest {

    @Test
    @DisplayName("Lines are one-based and columns count UTF-16 units")
    void testLineAndColumn() {
        var sc = SourceContent.of("a\nbé c\n");

        assertEquals(1, sc.lineAt(0));
        assertEquals(2, sc.lineAt(2));
        assertEquals(2, sc.lineAt(6));
        assertEquals(3, sc.lineAt(8));
        assertEquals(3, sc.charColumnAt(6));
        assertEquals(5, sc.byteOffsetToCharPosition(6));
        assertEquals(3, sc.lineCount());
    }

    @Test
    @DisplayName("Characters outside the BMP take two columns")
    void testSurrogatePairs() {
        var sc = SourceContent.of("x = '😀'; y");

        int yByte = sc.text().getBytes(StandardCharsets.UTF_8).length - 1;
        assertEquals(10, sc.charColumnAt(yByte));
        assertEquals("😀", sc.substringFromBytes(5, 9));
    }

    @Test
    @DisplayName("Invalid byte ranges yield empty strings and overlong ranges are truncated")
    void testSubstringBounds() {
        var sc = SourceContent.of("hello");

        assertEquals("", sc.substringFromBytes(-1, 2));
        assertEquals("", sc.substringFromBytes(3, 2));
        assertEquals("", sc.substringFromBytes(9, 12));
        assertEquals("llo", sc.substringFromBytes(2, 40));
        assertEquals("", sc.substringFromBytes(2, 2));
    }

    @Test
    @DisplayName("A leading byte order mark is dropped")
    void testByteOrderMark(@TempDir Path dir) throws Exception {
        var file = dir.resolve("bom.test.js");
        Files.writeString(file, "\uFEFFit('a');\n", StandardCharsets.UTF_8);

        var sc = SourceContent.read(file);
        assertEquals("it('a');\n", sc.text());
        assertEquals(9, sc.byteLength());
        assertEquals("it('a');\n", SourceContent.of("\uFEFFit('a');\n").text());
    }
}
