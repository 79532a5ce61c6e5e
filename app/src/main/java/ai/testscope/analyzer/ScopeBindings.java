package ai.testscope.analyzer;

import java.util.Optional;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

/**
 * Identifiers with statically known values at one point of a walk.
 *
 * <p>Instances are immutable; every {@code with*} call returns a new scope sharing structure with this one, so a nested
 * block can extend or shadow names without affecting its parent or siblings.
 */
public final class ScopeBindings {
    private static final ScopeBindings EMPTY = new ScopeBindings(HashTreePMap.empty(), false);

    private final PMap<String, StaticValue> values;
    private final boolean insideExpandedRow;

    private ScopeBindings(PMap<String, StaticValue> values, boolean insideExpandedRow) {
        this.values = values;
        this.insideExpandedRow = insideExpandedRow;
    }

    public static ScopeBindings empty() {
        return EMPTY;
    }

    public Optional<StaticValue> lookup(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public ScopeBindings with(String name, StaticValue value) {
        return new ScopeBindings(values.plus(name, value), insideExpandedRow);
    }

    /** Removes {@code name}, used when a declaration shadows it with a value that cannot be known. */
    public ScopeBindings without(String name) {
        return values.containsKey(name) ? new ScopeBindings(values.minus(name), insideExpandedRow) : this;
    }

    public ScopeBindings withoutAll(Iterable<String> names) {
        var result = values;
        for (var name : names) {
            result = result.minus(name);
        }
        return result == values ? this : new ScopeBindings(result, insideExpandedRow);
    }

    /** Whether this scope belongs to a callback invoked for one row of a parameterized suite. */
    public boolean insideExpandedRow() {
        return insideExpandedRow;
    }

    public ScopeBindings markExpandedRow() {
        return insideExpandedRow ? this : new ScopeBindings(values, true);
    }

    @Override
    public String toString() {
        return "ScopeBindings" + values.keySet() + (insideExpandedRow ? "[row]" : "");
    }
}
