package ai.testscope.analyzer;

import ai.testscope.util.TextCanonicalizer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

/**
 * Wrapper for a source text and its UTF-8 bytes. Tree-sitter reports positions as UTF-8 byte offsets; this class turns
 * them back into text and into the one-based line / character-column positions used by {@link Span}.
 */
public final class SourceContent {
    private static final Logger log = LogManager.getLogger(SourceContent.class);

    private final String text;
    private final byte[] utf8Bytes;
    private final int byteLength;
    private final boolean ascii;
    // byte offset at which each line starts; index 0 is line 1
    private final int[] lineStarts;

    private SourceContent(String text, byte[] utf8Bytes) {
        this.text = text;
        this.utf8Bytes = utf8Bytes;
        this.byteLength = utf8Bytes.length;
        this.ascii = byteLength == text.length();
        this.lineStarts = computeLineStarts(utf8Bytes);
    }

    public static SourceContent read(Path file) throws IOException {
        return of(Files.readString(file, StandardCharsets.UTF_8));
    }

    /** Wraps source text; a leading byte order mark is dropped so offsets match what the parser sees. */
    public static SourceContent of(String src) {
        var text = TextCanonicalizer.stripUtf8Bom(src);
        return new SourceContent(text, text.getBytes(StandardCharsets.UTF_8));
    }

    private static int[] computeLineStarts(byte[] bytes) {
        int count = 1;
        for (byte b : bytes) {
            if (b == '\n') count++;
        }
        var starts = new int[count];
        int line = 1;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                starts[line++] = i + 1;
            }
        }
        return starts;
    }

    /**
     * Safely extracts a substring using UTF-8 byte offsets [startByte, endByte).
     *
     * <p>Invalid ranges return the empty string and log a warning; an end past the text is truncated.
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            log.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    byteLength,
                    startByte,
                    endByte);
            return "";
        }
        if (startByte > byteLength) {
            log.warn("Start byte offset {} exceeds source byte length {}", startByte, byteLength);
            return "";
        }
        if (endByte > byteLength) {
            log.debug("End byte offset {} exceeds source byte length {}, truncating", endByte, byteLength);
            endByte = byteLength;
        }
        int len = endByte - startByte;
        if (len == 0) return "";
        return new String(utf8Bytes, startByte, len, StandardCharsets.UTF_8);
    }

    public String substringFrom(TSNode node) {
        if (node.isNull()) {
            return "";
        }
        return substringFromBytes(node.getStartByte(), node.getEndByte());
    }

    /** One-based line containing the byte offset. */
    public int lineAt(int byteOffset) {
        int clamped = Math.max(0, Math.min(byteOffset, byteLength));
        int idx = Arrays.binarySearch(lineStarts, clamped);
        return (idx >= 0 ? idx : -idx - 2) + 1;
    }

    /** Zero-based column of the byte offset within its line, counted in UTF-16 code units. */
    public int charColumnAt(int byteOffset) {
        int clamped = Math.max(0, Math.min(byteOffset, byteLength));
        int lineStart = lineStarts[lineAt(clamped) - 1];
        if (ascii) {
            return clamped - lineStart;
        }
        return new String(utf8Bytes, lineStart, clamped - lineStart, StandardCharsets.UTF_8).length();
    }

    /**
     * One-based span of a node: start at the first character, end column inclusive of the last character, so a node
     * covering {@code it()} on column 1 spans columns 1 to 4.
     */
    public Span spanOf(TSNode node) {
        int start = node.getStartByte();
        int end = node.getEndByte();
        return new Span(lineAt(start), charColumnAt(start) + 1, lineAt(end), charColumnAt(end));
    }

    /** Converts a UTF-8 byte offset into a Java String character index, clamping out-of-range values. */
    public int byteOffsetToCharPosition(int byteOffset) {
        if (byteOffset <= 0) return 0;
        if (byteOffset >= byteLength) return text.length();
        if (ascii) return byteOffset;
        return new String(utf8Bytes, 0, byteOffset, StandardCharsets.UTF_8).length();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return byteLength;
    }

    @Override
    public String toString() {
        return "SourceContent[byteLength=" + byteLength + ", lines=" + lineStarts.length + ']';
    }
}
