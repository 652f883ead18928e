package work.labs.witness.trace;

import java.util.List;

/**
 * Right-hand side of a trace assignment, kept as printed: a literal leaf or a brace group.
 */
public interface RawValue {

    enum Kind {
        BOOLEAN,
        NUMBER,
        STRING,
        /** Bare backend tokens such as {@code NULL} or {@code &obj}. */
        SYMBOL
    }

    /**
     * @param text literal text; for {@link Kind#STRING} the unquoted, unescaped content
     */
    record Literal(Kind kind, String text) implements RawValue {}

    record Group(List<RawValue> elements) implements RawValue {
        public Group {
            elements = List.copyOf(elements);
        }
    }
}
