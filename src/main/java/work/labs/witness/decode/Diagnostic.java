package work.labs.witness.decode;

import java.util.Objects;

/**
 * Local problem attached to one variable of one state entry. Never aborts reconstruction.
 */
public record Diagnostic(Kind kind, long sequence, String variable, String message) {
    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(message, "message");
    }

    public enum Kind {
        /** The value could not be typed; the variable reads as unknown. */
        DECODE_ERROR,
        /** The variable is not declared in the symbol table. */
        SCHEMA_ERROR,
        /** The value was typed, but its literal and bit renderings disagree. */
        DECODE_WARNING
    }

    public boolean isError() {
        return kind != Kind.DECODE_WARNING;
    }
}
