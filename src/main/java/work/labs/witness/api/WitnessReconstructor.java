package work.labs.witness.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.labs.witness.assemble.Witness;
import work.labs.witness.symbols.SymbolTable;
import work.labs.witness.trace.Dialect;

/**
 * Public entry point: turns a raw backend counterexample into a per-round witness.
 */
public final class WitnessReconstructor {
    private static final Logger LOG = LoggerFactory.getLogger(WitnessReconstructor.class);

    public TraceReconstruction reconstruct(ReconstructionConfiguration configuration) {
        LOG.debug("Reconstructing {} ({} dialect, {})",
            configuration.source().display(), configuration.dialect(), configuration.symbols());
        return new TraceReconstruction(configuration);
    }

    public Witness reconstructWitness(ReconstructionConfiguration configuration) {
        Witness witness = reconstruct(configuration).toWitness();
        if (!witness.diagnostics().isEmpty()) {
            LOG.info("Witness for {} has {} diagnostics", configuration.source().display(), witness.diagnostics().size());
        }
        return witness;
    }

    public Witness reconstructWitness(String traceText, Dialect dialect, SymbolTable symbols) {
        return reconstructWitness(ReconstructionConfiguration.builder()
            .traceText(traceText)
            .dialect(dialect)
            .symbols(symbols)
            .build());
    }
}
