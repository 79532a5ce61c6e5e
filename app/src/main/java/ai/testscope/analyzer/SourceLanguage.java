package ai.testscope.analyzer;

import java.util.List;
import java.util.Locale;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterTypescript;

/** Grammar used to parse a test file, chosen by file extension. */
public enum SourceLanguage {
    JAVASCRIPT,
    TYPESCRIPT,
    /**
     * No TSX grammar ships with the tree-sitter bindings. The TypeScript grammar is tried first and the JavaScript
     * grammar, which understands JSX, second; a file mixing JSX with type syntax parses with neither.
     */
    TSX;

    private static final TSLanguage JAVASCRIPT_GRAMMAR = new TreeSitterJavascript();
    private static final TSLanguage TYPESCRIPT_GRAMMAR = new TreeSitterTypescript();

    /** Grammars to try in order; the first that parses without errors wins. */
    public List<TSLanguage> grammars() {
        return switch (this) {
            case JAVASCRIPT -> List.of(JAVASCRIPT_GRAMMAR);
            case TYPESCRIPT -> List.of(TYPESCRIPT_GRAMMAR);
            case TSX -> List.of(TYPESCRIPT_GRAMMAR, JAVASCRIPT_GRAMMAR);
        };
    }

    /** {@code .ts}, {@code .mts} and {@code .cts} are TypeScript, {@code .tsx} is TSX, everything else JavaScript. */
    public static SourceLanguage forFile(String file) {
        var name = file.toLowerCase(Locale.ROOT);
        if (name.endsWith(".tsx")) {
            return TSX;
        }
        if (name.endsWith(".ts") || name.endsWith(".mts") || name.endsWith(".cts")) {
            return TYPESCRIPT;
        }
        // .js, .jsx, .mjs, .cjs; the JavaScript grammar includes JSX
        return JAVASCRIPT;
    }
}
