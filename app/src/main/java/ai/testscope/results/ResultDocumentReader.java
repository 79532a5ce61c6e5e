package ai.testscope.results;

import ai.testscope.TestScopeConfig;
import ai.testscope.util.Json;
import ai.testscope.util.TextCanonicalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Finds the result document in the captured output of a run. Tried in order: a framed {@code results} message, the
 * whole output as JSON, and a report embedded in other log output, as monorepo wrappers print around it.
 */
@NullMarked
public final class ResultDocumentReader {
    private static final Logger logger = LogManager.getLogger(ResultDocumentReader.class);

    private static final List<String> EMBEDDED_STARTS =
            List.of("{\"numFailedTestSuites\"", "{\"testResults\"", "{\"numTotalTestSuites\"");

    private final @Nullable String sessionId;

    public ResultDocumentReader(TestScopeConfig config) {
        this.sessionId = config.sessionId();
    }

    public Optional<ResultDocument> read(String output) {
        var text = TextCanonicalizer.stripUtf8Bom(output);

        var framed = StructuredOutput.extract(text, sessionId).messages().stream()
                .filter(m -> StructuredOutput.RESULTS_TYPE.equals(m.type()))
                .findFirst();
        if (framed.isPresent()) {
            var document = toDocument(framed.get().payload());
            if (document.isPresent()) {
                return document;
            }
            logger.warn("Framed results message is not a result document");
        }

        var whole = Json.tryReadTree(text.strip()).flatMap(this::toDocument);
        if (whole.isPresent()) {
            return whole;
        }

        var embedded = extractEmbeddedJson(text);
        if (embedded.isPresent()) {
            var document = Json.tryReadTree(embedded.get()).flatMap(this::toDocument);
            if (document.isPresent()) {
                return document;
            }
            logger.warn("Embedded result JSON could not be read");
        }
        logger.debug("No result document in {} chars of output", text.length());
        return Optional.empty();
    }

    /**
     * Converts a JSON tree with a {@code testResults} array into a document, filling in the summary counters that
     * Vitest-style reports leave out.
     */
    Optional<ResultDocument> toDocument(JsonNode node) {
        if (!node.isObject() || !node.path("testResults").isArray()) {
            return Optional.empty();
        }
        try {
            var document = Json.mapper().treeToValue(node, ResultDocument.class);
            return Optional.of(document.normalized());
        } catch (JsonProcessingException e) {
            logger.warn("Result document does not have the expected shape: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /** The first report object inside mixed output, delimited by brace counting that skips string contents. */
    static Optional<String> extractEmbeddedJson(String output) {
        for (var marker : EMBEDDED_STARTS) {
            int start = output.indexOf(marker);
            if (start < 0) {
                continue;
            }
            int depth = 0;
            boolean inString = false;
            boolean escaped = false;
            for (int i = start; i < output.length(); i++) {
                char c = output.charAt(i);
                if (escaped) {
                    escaped = false;
                } else if (inString && c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = !inString;
                } else if (!inString && c == '{') {
                    depth++;
                } else if (!inString && c == '}' && --depth == 0) {
                    return Optional.of(output.substring(start, i + 1));
                }
            }
        }
        return Optional.empty();
    }
}
