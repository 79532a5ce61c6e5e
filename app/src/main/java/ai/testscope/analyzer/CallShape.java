package ai.testscope.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * What a call statement declares, decided from its callee alone.
 *
 * <p>{@code modifier} is the callee's last property ({@code only}, {@code skip}, {@code each}, ...) when it has one.
 */
public sealed interface CallShape {

    @Nullable
    String modifier();

    record Suite(@Nullable String modifier) implements CallShape {}

    record Case(@Nullable String modifier) implements CallShape {}

    /** {@code describe.each(table)(title, fn)}. */
    record SuiteEach(@Nullable String modifier) implements CallShape {}

    /** {@code it.each(table)(title, fn)}. */
    record CaseEach(@Nullable String modifier) implements CallShape {}

    record Assertion(@Nullable String modifier) implements CallShape {}

    /** Recognized but deliberately not represented, and not walked into. */
    record Ignored(@Nullable String modifier) implements CallShape {}

    record Unrecognized() implements CallShape {
        @Override
        public @Nullable String modifier() {
            return null;
        }
    }

    Unrecognized UNRECOGNIZED = new Unrecognized();
}
