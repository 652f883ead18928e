package work.labs.witness.symbols;

import java.util.Objects;

/**
 * One compiled variable as declared by the DSL compiler.
 */
public record SymbolEntry(String name, Scope scope, DeclaredType type) {
    public SymbolEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(type, "type");
    }
}
