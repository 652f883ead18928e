package work.labs.witness.assemble;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.labs.witness.decode.DecodedValue;
import work.labs.witness.steps.Assignment;
import work.labs.witness.steps.LogicalStep;
import work.labs.witness.symbols.DeclaredType;
import work.labs.witness.symbols.SymbolEntry;
import work.labs.witness.symbols.SymbolTable;
import work.labs.witness.symbols.VariableRef;

/**
 * Threads a running snapshot through the logical steps, one snapshot per step.
 */
public final class TraceAssembler {
    static final String UNINITIALIZED_ELEMENT = "uninitialized element";

    private final SymbolTable symbols;

    public TraceAssembler(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
    }

    public Iterator<Snapshot> assemble(Iterator<LogicalStep> steps) {
        Objects.requireNonNull(steps, "steps");
        Map<String, VariableState> running = new LinkedHashMap<>();
        for (SymbolEntry entry : symbols.entries()) {
            running.put(entry.name(), VariableState.uninitialized());
        }
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return steps.hasNext();
            }

            @Override
            public Snapshot next() {
                return apply(running, steps.next());
            }
        };
    }

    private Snapshot apply(Map<String, VariableState> running, LogicalStep step) {
        var before = new LinkedHashMap<>(running);
        for (Assignment assignment : step.assignments()) {
            if (assignment.target().isEmpty()) {
                continue;
            }
            VariableRef ref = assignment.target().get();
            String name = ref.entry().name();
            DecodedValue updated = ref.isElement()
                ? updateAt(running.get(name).value().orElse(null), ref.entry().type(), ref.path(), assignment.value())
                : assignment.value();
            running.put(name, VariableState.assigned(updated));
        }
        var changed = new LinkedHashSet<String>();
        for (var entry : running.entrySet()) {
            if (!entry.getValue().equals(before.get(entry.getKey()))) {
                changed.add(entry.getKey());
            }
        }
        return new Snapshot(step, running, changed);
    }

    private static DecodedValue updateAt(DecodedValue container, DeclaredType type, List<Integer> path, DecodedValue value) {
        if (path.isEmpty()) {
            return value;
        }
        int index = path.get(0);
        DeclaredType elementType = elementType(type, index);
        DecodedValue.ArrayValue array = container instanceof DecodedValue.ArrayValue existing
            && existing.elements().size() == arity(type)
            ? existing
            : (DecodedValue.ArrayValue) skeleton(type);
        DecodedValue element = updateAt(array.elements().get(index), elementType, path.subList(1, path.size()), value);
        return array.with(index, element);
    }

    /**
     * Placeholder for an aggregate whose elements are written before the whole is ever assigned.
     */
    private static DecodedValue skeleton(DeclaredType type) {
        if (type instanceof DeclaredType.ArrayType array) {
            return new DecodedValue.ArrayValue(Collections.nCopies(array.length(), skeleton(array.element())));
        }
        if (type instanceof DeclaredType.TupleType tuple) {
            var elements = new ArrayList<DecodedValue>();
            for (DeclaredType component : tuple.components()) {
                elements.add(skeleton(component));
            }
            return new DecodedValue.ArrayValue(elements);
        }
        return DecodedValue.unknown(UNINITIALIZED_ELEMENT);
    }

    private static DeclaredType elementType(DeclaredType type, int index) {
        if (type instanceof DeclaredType.ArrayType array) {
            return array.element();
        }
        return ((DeclaredType.TupleType) type).components().get(index);
    }

    private static int arity(DeclaredType type) {
        if (type instanceof DeclaredType.ArrayType array) {
            return array.length();
        }
        return ((DeclaredType.TupleType) type).components().size();
    }
}
