package ai.testscope;

import com.google.common.base.Splitter;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Settings shared by discovery and reconciliation.
 *
 * <p>Every value has a default and may be overridden through the environment:
 *
 * <ul>
 *   <li>{@code TESTSCOPE_SUITE_NAMES}: comma-separated identifiers that declare suites (default {@code describe}).
 *   <li>{@code TESTSCOPE_CASE_NAMES}: comma-separated identifiers that declare cases (default {@code it,fit,test}).
 *   <li>{@code TESTSCOPE_LOCATION_LINE_OFFSET}: added to a node's start line before comparing it with a reported
 *       result location (default {@code 1}).
 *   <li>{@code TESTSCOPE_FAILURE_MARKERS}: {@code |}-separated substrings that mark a failure line in raw output.
 *   <li>{@code TESTSCOPE_SESSION_ID}: only structured output frames of this session are read (default any).
 * </ul>
 *
 * Invalid values are logged and replaced by the default.
 *
 * @param sessionId null accepts frames of any session
 */
@NullMarked
public record TestScopeConfig(
        Set<String> suiteNames,
        Set<String> caseNames,
        int locationLineOffset,
        List<String> failureMarkers,
        @Nullable String sessionId) {
    private static final Logger logger = LogManager.getLogger(TestScopeConfig.class);

    public static final String SUITE_NAMES_ENV = "TESTSCOPE_SUITE_NAMES";
    public static final String CASE_NAMES_ENV = "TESTSCOPE_CASE_NAMES";
    public static final String LINE_OFFSET_ENV = "TESTSCOPE_LOCATION_LINE_OFFSET";
    public static final String FAILURE_MARKERS_ENV = "TESTSCOPE_FAILURE_MARKERS";
    public static final String SESSION_ID_ENV = "TESTSCOPE_SESSION_ID";

    public static final Set<String> DEFAULT_SUITE_NAMES = Set.of("describe");
    public static final Set<String> DEFAULT_CASE_NAMES = Set.of("it", "fit", "test");
    public static final int DEFAULT_LINE_OFFSET = 1;
    public static final List<String> DEFAULT_FAILURE_MARKERS = List.of(
            "FAIL", "✗", "×", "●", "FAILED", "Error:", "AssertionError", "expect(", "Expected:", "Received:");

    private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();
    private static final Splitter PIPE = Splitter.on('|').omitEmptyStrings();

    public TestScopeConfig {
        suiteNames = Set.copyOf(suiteNames);
        caseNames = Set.copyOf(caseNames);
        failureMarkers = List.copyOf(failureMarkers);
    }

    public static TestScopeConfig defaults() {
        return new TestScopeConfig(
                DEFAULT_SUITE_NAMES, DEFAULT_CASE_NAMES, DEFAULT_LINE_OFFSET, DEFAULT_FAILURE_MARKERS, null);
    }

    public static TestScopeConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /** Reads overrides through {@code env}, which returns null for unset variables. */
    public static TestScopeConfig fromEnvironment(Function<String, @Nullable String> env) {
        return new TestScopeConfig(
                identifiers(env, SUITE_NAMES_ENV, DEFAULT_SUITE_NAMES),
                identifiers(env, CASE_NAMES_ENV, DEFAULT_CASE_NAMES),
                lineOffset(env),
                failureMarkers(env),
                sessionId(env));
    }

    public TestScopeConfig withSessionId(@Nullable String id) {
        return new TestScopeConfig(suiteNames, caseNames, locationLineOffset, failureMarkers, id);
    }

    public TestScopeConfig withLocationLineOffset(int offset) {
        return new TestScopeConfig(suiteNames, caseNames, offset, failureMarkers, sessionId);
    }

    private static Set<String> identifiers(
            Function<String, @Nullable String> env, String name, Set<String> defaults) {
        String value = env.apply(name);
        if (value == null) {
            return defaults;
        }
        var names = COMMA.splitToList(value);
        if (names.isEmpty()) {
            logger.warn("{} is blank; using default {}", name, defaults);
            return defaults;
        }
        for (var id : names) {
            if (!isIdentifier(id)) {
                logger.warn("{} contains invalid identifier '{}'; using default {}", name, id, defaults);
                return defaults;
            }
        }
        logger.info("{} override in effect: {}", name, names);
        return Set.copyOf(names);
    }

    private static int lineOffset(Function<String, @Nullable String> env) {
        String value = env.apply(LINE_OFFSET_ENV);
        if (value == null) {
            return DEFAULT_LINE_OFFSET;
        }
        try {
            int offset = Integer.parseInt(value.trim());
            logger.info("{} override in effect: {}", LINE_OFFSET_ENV, offset);
            return offset;
        } catch (NumberFormatException e) {
            logger.warn("{} is not an integer: '{}'; using default {}", LINE_OFFSET_ENV, value, DEFAULT_LINE_OFFSET);
            return DEFAULT_LINE_OFFSET;
        }
    }

    private static List<String> failureMarkers(Function<String, @Nullable String> env) {
        String value = env.apply(FAILURE_MARKERS_ENV);
        if (value == null) {
            return DEFAULT_FAILURE_MARKERS;
        }
        var markers = PIPE.splitToList(value);
        if (markers.isEmpty()) {
            logger.warn("{} is blank; using default markers", FAILURE_MARKERS_ENV);
            return DEFAULT_FAILURE_MARKERS;
        }
        logger.info("{} override in effect: {}", FAILURE_MARKERS_ENV, markers);
        return markers;
    }

    private static @Nullable String sessionId(Function<String, @Nullable String> env) {
        String value = env.apply(SESSION_ID_ENV);
        if (value == null || value.isBlank()) {
            return null;
        }
        if (value.contains("::")) {
            logger.warn("{} must not contain '::': '{}'; accepting any session", SESSION_ID_ENV, value);
            return null;
        }
        return value.trim();
    }

    private static boolean isIdentifier(String s) {
        if (s.isEmpty() || !Character.isJavaIdentifierStart(s.charAt(0))) {
            return false;
        }
        return s.chars().allMatch(Character::isJavaIdentifierPart);
    }
}
