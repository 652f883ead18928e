package work.labs.witness.trace;

import java.util.Locale;

/**
 * A state header has the shape of the other dialect: the wrong grammar was selected upstream.
 */
public final class DialectMismatchException extends LexException {
    private final Dialect expected;

    public DialectMismatchException(int line, Dialect expected) {
        super("dialect_mismatch", line, "state header is not in the " + expected.name().toLowerCase(Locale.ROOT)
            + " dialect (found " + expected.other().name().toLowerCase(Locale.ROOT) + " field order)", null);
        this.expected = expected;
    }

    public Dialect expected() {
        return expected;
    }
}
