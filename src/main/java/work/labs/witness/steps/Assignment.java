package work.labs.witness.steps;

import java.util.Optional;
import work.labs.witness.decode.DecodedValue;
import work.labs.witness.symbols.VariableRef;
import work.labs.witness.trace.SourceLocation;

/**
 * One decoded state entry inside a logical step.
 *
 * @param variable the name as printed in the trace
 * @param target   the declared variable it resolves to; empty for undeclared names
 */
public record Assignment(
    long sequence,
    String variable,
    Optional<VariableRef> target,
    DecodedValue value,
    SourceLocation location
) {
    public boolean agentLocal() {
        return target.map(ref -> !ref.entry().scope().isShared()).orElse(false);
    }
}
