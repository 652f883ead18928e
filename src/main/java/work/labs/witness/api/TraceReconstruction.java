package work.labs.witness.api;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import work.labs.witness.assemble.Snapshot;
import work.labs.witness.assemble.TraceAssembler;
import work.labs.witness.assemble.Witness;
import work.labs.witness.decode.Diagnostic;
import work.labs.witness.steps.StepReconstructor;
import work.labs.witness.trace.StateEventIterator;
import work.labs.witness.trace.StateEventStream;
import work.labs.witness.trace.TraceParser;

/**
 * Lazy view of a reconstruction: snapshots are computed as they are read, and reading the
 * first few never parses the rest of the trace. Each iteration starts over from the source.
 */
public final class TraceReconstruction implements Iterable<Snapshot> {
    private final ReconstructionConfiguration configuration;
    private final StateEventStream events;

    TraceReconstruction(ReconstructionConfiguration configuration) {
        this(configuration, TraceParser.parse(configuration.source().opener(), configuration.dialect()));
    }

    TraceReconstruction(ReconstructionConfiguration configuration, StateEventStream events) {
        this.configuration = configuration;
        this.events = events;
    }

    /**
     * Close the iterator when abandoning it before the end of the trace.
     */
    @Override
    public SnapshotIterator iterator() {
        StateEventIterator parsed = events.iterator();
        return new SnapshotIterator(pipeline(parsed), parsed);
    }

    /**
     * Closing the stream releases the trace source; use it in try-with-resources when reading
     * only part of the trace.
     */
    public Stream<Snapshot> stream() {
        SnapshotIterator it = iterator();
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL), false)
            .onClose(it::close);
    }

    /**
     * Reads the whole trace. Fatal trace errors propagate; local ones end up in the witness.
     */
    public Witness toWitness() {
        var snapshots = new ArrayList<Snapshot>();
        var diagnostics = new ArrayList<Diagnostic>();
        try (SnapshotIterator it = iterator()) {
            while (it.hasNext()) {
                Snapshot snapshot = it.next();
                snapshots.add(snapshot);
                diagnostics.addAll(snapshot.step().diagnostics());
            }
            return new Witness(snapshots, diagnostics, it.trailer());
        }
    }

    public ReconstructionConfiguration configuration() {
        return configuration;
    }

    private Iterator<Snapshot> pipeline(StateEventIterator parsed) {
        var steps = new StepReconstructor(configuration.symbols()).reconstruct(parsed);
        return new TraceAssembler(configuration.symbols()).assemble(steps);
    }
}
