package ai.testscope.analyzer;

import static ai.testscope.analyzer.typescript.TypeScriptTreeSitterNodeTypes.ERROR;

import ai.testscope.TestScopeConfig;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.NullMarked;
import org.treesitter.TSNode;
import org.treesitter.TSParser;

/**
 * Entry point of discovery: parses a test file with the grammar for its extension and walks it into a
 * {@link TestTree}. A new tree is built on every call.
 */
@NullMarked
public final class TestSourceParser {
    private static final Logger logger = LogManager.getLogger(TestSourceParser.class);

    private final TestScopeConfig config;

    public TestSourceParser(TestScopeConfig config) {
        this.config = config;
    }

    public TestSourceParser() {
        this(TestScopeConfig.fromEnvironment());
    }

    /** Reads and parses a file; the path string identifies the file in the resulting tree. */
    public TestTree parse(Path file) throws IOException, SourceParseException {
        return parse(file.toString(), SourceContent.read(file));
    }

    public TestTree parse(String file, String source) throws SourceParseException {
        return parse(file, SourceContent.of(source));
    }

    public TestTree parse(String file, SourceContent source) throws SourceParseException {
        var language = SourceLanguage.forFile(file);
        SourceParseException firstFailure = null;
        for (var grammar : language.grammars()) {
            var parser = new TSParser();
            parser.setLanguage(grammar);
            var tree = parser.parseString(null, source.text());
            var root = tree.getRootNode();
            if (!root.hasError()) {
                return TestTreeWalker.walk(file, root, source, config);
            }
            if (firstFailure == null) {
                var error = firstError(root);
                int line = source.lineAt(error.getStartByte());
                int column = source.charColumnAt(error.getStartByte()) + 1;
                firstFailure = new SourceParseException(file, line, column);
            }
        }
        logger.warn(
                "Syntax error in {} at {}:{}; no tests discovered", file, firstFailure.line(), firstFailure.column());
        throw firstFailure;
    }

    private static TSNode firstError(TSNode root) {
        var error = AstNodes.findNodeRecursive(root, n -> ERROR.equals(n.getType()) || n.isMissing());
        return error != null ? error : root;
    }

    /** The source could not be parsed; nothing was discovered in it. */
    public static class SourceParseException extends Exception {
        private final String file;
        private final int line;
        private final int column;

        public SourceParseException(String file, int line, int column) {
            super("Syntax error in %s at line %d, column %d".formatted(file, line, column));
            this.file = file;
            this.line = line;
            this.column = column;
        }

        public String file() {
            return file;
        }

        /** One-based line of the first error. */
        public int line() {
            return line;
        }

        public int column() {
            return column;
        }
    }
}
