package work.labs.witness.trace;

import java.util.Objects;
import java.util.Optional;

/**
 * One {@code State} entry of a raw trace: a single assignment performed by one thread.
 */
public record StateEvent(
    long sequence,
    int threadId,
    SourceLocation location,
    String variable,
    RawValue value,
    Optional<RawBits> bits,
    int lineNumber
) {
    public StateEvent {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(bits, "bits");
    }
}
