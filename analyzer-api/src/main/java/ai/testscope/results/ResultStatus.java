package ai.testscope.results;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/** Status of one executed test as reported by a runner. */
public enum ResultStatus {
    PASSED,
    FAILED,
    SKIPPED,
    PENDING,
    TODO;

    /**
     * Lenient mapping of runner status strings. Runners report a few extra statuses ({@code disabled},
     * {@code focused}); anything unknown is treated as not executed.
     */
    @JsonCreator
    public static ResultStatus fromJson(@Nullable String value) {
        if (value == null) {
            return SKIPPED;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "passed", "pass" -> PASSED;
            case "failed", "fail" -> FAILED;
            case "pending" -> PENDING;
            case "todo" -> TODO;
            default -> SKIPPED;
        };
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
