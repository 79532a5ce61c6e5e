package ai.testscope.results;

import ai.testscope.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Framed JSON messages interleaved with ordinary runner output:
 *
 * <pre>
 * &#64;&#64;TESTSCOPE_START::&lt;session&gt;::&lt;type&gt;::&lt;utf8-length&gt;::&lt;json&gt;&#64;&#64;TESTSCOPE_END::&lt;session&gt;::&lt;type&gt;
 * </pre>
 *
 * The payload length is counted in UTF-8 bytes, so a reader can tell a complete frame from one still being written.
 */
@NullMarked
public final class StructuredOutput {
    private static final Logger logger = LogManager.getLogger(StructuredOutput.class);

    public static final String START = "@@TESTSCOPE_START::";
    public static final String END = "@@TESTSCOPE_END::";
    public static final String RESULTS_TYPE = "results";

    private static final Pattern HEADER = Pattern.compile("^([^:\\s]+)::([^:\\s]+)::(\\d{1,10})::");
    // longest header we wait for before declaring it malformed
    private static final int MAX_PENDING_HEADER = 256;

    private StructuredOutput() {}

    /**
     * One decoded frame.
     *
     * @param start index of the frame's first character in the scanned text
     * @param end index just past the frame's last character
     */
    public record Message(String session, String type, JsonNode payload, int start, int end) {}

    /**
     * Frames found in a buffer, plus the text from the first incomplete frame on (empty when every frame was
     * complete).
     */
    public record Extraction(List<Message> messages, String remaining) {}

    public static String frame(String sessionId, String type, Object payload) {
        if (sessionId.contains("::") || type.contains("::")) {
            throw new IllegalArgumentException("session and type must not contain '::'");
        }
        String json;
        try {
            json = Json.mapper().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable: " + e.getOriginalMessage(), e);
        }
        int length = json.getBytes(StandardCharsets.UTF_8).length;
        return START + sessionId + "::" + type + "::" + length + "::" + json + END + sessionId + "::" + type;
    }

    /** Extracts frames of any session, or only of {@code sessionId} when it is not null. */
    public static Extraction extract(String buffer, @Nullable String sessionId) {
        var messages = new ArrayList<Message>();
        int cursor = 0;
        int consumedUpTo = 0;
        while (true) {
            int startIdx = buffer.indexOf(START, cursor);
            if (startIdx < 0) {
                consumedUpTo = buffer.length();
                break;
            }
            int headerStart = startIdx + START.length();
            var header = HEADER.matcher(buffer).region(headerStart, buffer.length());
            if (!header.lookingAt()) {
                if (buffer.length() - headerStart < MAX_PENDING_HEADER && buffer.indexOf('\n', headerStart) < 0) {
                    consumedUpTo = startIdx;
                    break;
                }
                logger.debug("Skipping malformed frame header at {}", startIdx);
                cursor = startIdx + 1;
                continue;
            }
            var session = header.group(1);
            var type = header.group(2);
            long length = Long.parseLong(header.group(3));
            int payloadStart = header.end();
            int payloadEnd = advanceUtf8(buffer, payloadStart, length);
            if (payloadEnd == -2) {
                logger.debug("Frame length at {} splits a character", startIdx);
                cursor = startIdx + 1;
                continue;
            }
            if (payloadEnd == -1) {
                // payload not fully written yet
                consumedUpTo = startIdx;
                break;
            }
            var endMarker = END + session + "::" + type;
            if (!buffer.startsWith(endMarker, payloadEnd)) {
                var tail = buffer.substring(payloadEnd);
                if (tail.length() < endMarker.length() && endMarker.startsWith(tail)) {
                    consumedUpTo = startIdx;
                    break;
                }
                logger.debug("Frame at {} has no matching end marker", startIdx);
                cursor = startIdx + 1;
                continue;
            }
            int end = payloadEnd + endMarker.length();
            cursor = end;
            if (sessionId != null && !sessionId.equals(session)) {
                continue;
            }
            var payload = Json.tryReadTree(buffer.substring(payloadStart, payloadEnd));
            if (payload.isEmpty()) {
                logger.debug("Frame at {} carries invalid JSON", startIdx);
                continue;
            }
            messages.add(new Message(session, type, payload.get(), startIdx, end));
        }
        return new Extraction(messages, consumedUpTo >= buffer.length() ? "" : buffer.substring(consumedUpTo));
    }

    /**
     * Index just past {@code byteLength} UTF-8 bytes starting at {@code from}; -1 if the buffer ends first, -2 if the
     * length ends inside a character.
     */
    private static int advanceUtf8(String s, int from, long byteLength) {
        long bytes = 0;
        int i = from;
        while (bytes < byteLength) {
            if (i >= s.length()) {
                return -1;
            }
            int cp = s.codePointAt(i);
            bytes += cp < 0x80 ? 1 : cp < 0x800 ? 2 : cp < 0x10000 ? 3 : 4;
            i += Character.charCount(cp);
        }
        return bytes == byteLength ? i : -2;
    }
}
