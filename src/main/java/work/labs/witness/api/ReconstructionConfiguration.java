package work.labs.witness.api;

import java.nio.file.Path;
import java.util.Objects;
import work.labs.witness.symbols.SymbolTable;
import work.labs.witness.symbols.SymbolTableLoader;
import work.labs.witness.trace.Dialect;

/**
 * Immutable inputs of one reconstruction run.
 */
public record ReconstructionConfiguration(TraceSource source, Dialect dialect, SymbolTable symbols) {
    public ReconstructionConfiguration {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(dialect, "dialect");
        Objects.requireNonNull(symbols, "symbols");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TraceSource source;
        private Dialect dialect;
        private SymbolTable symbols;

        public Builder source(TraceSource source) {
            this.source = source;
            return this;
        }

        public Builder traceText(String text) {
            this.source = TraceSource.forText(text);
            return this;
        }

        public Builder traceFile(Path path) {
            this.source = TraceSource.forFile(path);
            return this;
        }

        public Builder dialect(Dialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder symbols(SymbolTable symbols) {
            this.symbols = symbols;
            return this;
        }

        public Builder symbolTableFile(Path path) {
            this.symbols = SymbolTableLoader.load(path);
            return this;
        }

        public ReconstructionConfiguration build() {
            return new ReconstructionConfiguration(source, dialect, symbols);
        }
    }
}
