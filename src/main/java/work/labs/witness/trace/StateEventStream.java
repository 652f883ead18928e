package work.labs.witness.trace;

import java.io.Reader;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, restartable sequence of {@link StateEvent}s. Every iteration re-reads the source.
 */
public final class StateEventStream implements Iterable<StateEvent> {
    private final Supplier<? extends Reader> source;
    private final Dialect dialect;

    StateEventStream(Supplier<? extends Reader> source, Dialect dialect) {
        this.source = source;
        this.dialect = dialect;
    }

    @Override
    public StateEventIterator iterator() {
        return new StateEventIterator(source.get(), dialect);
    }

    public Stream<StateEvent> stream() {
        var it = iterator();
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL), false)
            .onClose(it::close);
    }

    public Dialect dialect() {
        return dialect;
    }
}
