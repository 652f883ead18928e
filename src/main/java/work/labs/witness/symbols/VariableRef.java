package work.labs.witness.symbols;

import java.util.List;

/**
 * A printed trace name resolved against the symbol table. {@code path} is empty for a
 * whole-variable write and holds the element indices for writes such as {@code E[3]}.
 */
public record VariableRef(SymbolEntry entry, List<Integer> path, DeclaredType type) {
    public VariableRef {
        path = List.copyOf(path);
    }

    public boolean isElement() {
        return !path.isEmpty();
    }
}
