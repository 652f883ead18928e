package work.labs.witness.trace;

import java.io.Reader;
import java.io.StringReader;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry point of the raw trace grammar. The dialect is always chosen by the caller.
 */
public final class TraceParser {
    private TraceParser() {}

    public static StateEventStream parse(String text, Dialect dialect) {
        Objects.requireNonNull(text, "text");
        return parse(() -> new StringReader(text), dialect);
    }

    /**
     * @param source opened once per iteration, so the resulting stream can be read again
     */
    public static StateEventStream parse(Supplier<? extends Reader> source, Dialect dialect) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(dialect, "dialect");
        return new StateEventStream(source, dialect);
    }
}
