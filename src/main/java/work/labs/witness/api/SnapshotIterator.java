package work.labs.witness.api;

import java.util.Iterator;
import java.util.Optional;
import work.labs.witness.assemble.Snapshot;
import work.labs.witness.trace.StateEventIterator;
import work.labs.witness.trace.TraceTrailer;

/**
 * Snapshots of one pass over the trace. Closing it releases the trace source, so a consumer
 * that stops early does not hold the file open.
 */
public final class SnapshotIterator implements Iterator<Snapshot>, AutoCloseable {
    private final Iterator<Snapshot> snapshots;
    private final StateEventIterator source;

    SnapshotIterator(Iterator<Snapshot> snapshots, StateEventIterator source) {
        this.snapshots = snapshots;
        this.source = source;
    }

    @Override
    public boolean hasNext() {
        return snapshots.hasNext();
    }

    @Override
    public Snapshot next() {
        return snapshots.next();
    }

    /**
     * Present once the pass reached the end of the trace or stopped at a spurious-run flag.
     */
    public Optional<TraceTrailer> trailer() {
        return source.trailer();
    }

    @Override
    public void close() {
        source.close();
    }
}
