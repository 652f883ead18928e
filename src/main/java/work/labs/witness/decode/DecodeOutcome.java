package work.labs.witness.decode;

import java.util.List;

/**
 * Result of decoding one raw value: the typed value plus any problems met on the way.
 */
public record DecodeOutcome(DecodedValue value, List<String> errors, List<String> warnings) {
    public DecodeOutcome {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean clean() {
        return errors.isEmpty() && warnings.isEmpty();
    }
}
