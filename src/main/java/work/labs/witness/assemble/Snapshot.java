package work.labs.witness.assemble;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.labs.witness.decode.DecodedValue;
import work.labs.witness.steps.LogicalStep;

/**
 * State of every declared variable right after one logical step, plus what that step changed.
 */
public record Snapshot(LogicalStep step, Map<String, VariableState> values, Set<String> changed) {
    public Snapshot {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        changed = Collections.unmodifiableSet(new LinkedHashSet<>(changed));
    }

    public VariableState state(String variable) {
        VariableState state = values.get(variable);
        if (state == null) {
            throw new IllegalArgumentException("Unknown variable: " + variable);
        }
        return state;
    }

    public Optional<DecodedValue> value(String variable) {
        return state(variable).value();
    }

    public int round() {
        return step.round();
    }

    public boolean complete() {
        return step.complete();
    }
}
