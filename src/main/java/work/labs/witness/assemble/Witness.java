package work.labs.witness.assemble;

import java.util.List;
import java.util.Optional;
import work.labs.witness.decode.Diagnostic;
import work.labs.witness.trace.TraceTrailer;

/**
 * A fully materialized counterexample: ordered snapshots and the local diagnostics raised
 * while building them.
 */
public record Witness(List<Snapshot> snapshots, List<Diagnostic> diagnostics, Optional<TraceTrailer> trailer) {
    public Witness {
        snapshots = List.copyOf(snapshots);
        diagnostics = List.copyOf(diagnostics);
    }

    public Optional<Snapshot> last() {
        return snapshots.isEmpty() ? Optional.empty() : Optional.of(snapshots.get(snapshots.size() - 1));
    }

    /**
     * False when the trace stopped mid-round (or was cut off) and the last step may be partial.
     */
    public boolean complete() {
        return last().map(Snapshot::complete).orElse(trailer.map(TraceTrailer::complete).orElse(false));
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /**
     * The violated property, unless the footer only names the simulation sentinel.
     */
    public Optional<String> violatedProperty() {
        return trailer.filter(t -> !t.simulation()).flatMap(TraceTrailer::violatedProperty);
    }

    /**
     * The simulator abandoned the run; the snapshots stop at the flag.
     */
    public boolean spurious() {
        return trailer.map(TraceTrailer::spurious).orElse(false);
    }
}
