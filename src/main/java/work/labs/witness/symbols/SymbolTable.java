package work.labs.witness.symbols;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only view of the compiler's variable declarations plus the scheduling conventions of the
 * generated sequential program (thread to agent map, round marker, optional scheduler and
 * spurious-run variables).
 */
public final class SymbolTable {
    private static final Pattern ELEMENT_ACCESS = Pattern.compile("^([^\\[\\]\\s]+)((?:\\[\\s*\\d+\\s*[uUlL]*\\s*\\])+)$");
    private static final Pattern INDEX = Pattern.compile("\\[\\s*(\\d+)\\s*[uUlL]*\\s*\\]");

    private final Map<String, SymbolEntry> entries;
    private final Map<Integer, Integer> threadAgents;
    private final String roundMarker;
    private final String schedulerVariable;
    private final String spuriousMarker;

    private SymbolTable(
        Map<String, SymbolEntry> entries,
        Map<Integer, Integer> threadAgents,
        String roundMarker,
        String schedulerVariable,
        String spuriousMarker
    ) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        this.threadAgents = Collections.unmodifiableMap(new LinkedHashMap<>(threadAgents));
        this.roundMarker = roundMarker;
        this.schedulerVariable = schedulerVariable;
        this.spuriousMarker = spuriousMarker;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Entries in declaration order.
     */
    public Collection<SymbolEntry> entries() {
        return entries.values();
    }

    public Optional<SymbolEntry> lookup(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    /**
     * Resolves a name as printed in a trace, either a declared variable or an element access
     * ({@code grid[2][1]}) into a declared array or tuple.
     */
    public Optional<VariableRef> resolve(String printedName) {
        if (printedName == null) {
            return Optional.empty();
        }
        SymbolEntry direct = entries.get(printedName);
        if (direct != null) {
            return Optional.of(new VariableRef(direct, List.of(), direct.type()));
        }
        Matcher access = ELEMENT_ACCESS.matcher(printedName.trim());
        if (!access.matches()) {
            return Optional.empty();
        }
        SymbolEntry base = entries.get(access.group(1));
        if (base == null) {
            return Optional.empty();
        }
        var path = new ArrayList<Integer>();
        DeclaredType type = base.type();
        Matcher index = INDEX.matcher(access.group(2));
        while (index.find()) {
            int i;
            try {
                i = Integer.parseInt(index.group(1));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
            if (type instanceof DeclaredType.ArrayType array && i < array.length()) {
                type = array.element();
            } else if (type instanceof DeclaredType.TupleType tuple && i < tuple.components().size()) {
                type = tuple.components().get(i);
            } else {
                return Optional.empty();
            }
            path.add(i);
        }
        return Optional.of(new VariableRef(base, path, type));
    }

    public Optional<Integer> agentForThread(int threadId) {
        return Optional.ofNullable(threadAgents.get(threadId));
    }

    public Map<Integer, Integer> threadAgents() {
        return threadAgents;
    }

    public Optional<String> roundMarker() {
        return Optional.ofNullable(roundMarker);
    }

    public Optional<String> schedulerVariable() {
        return Optional.ofNullable(schedulerVariable);
    }

    /**
     * Variable the simulator sets when it abandons a run; the witness ends there.
     */
    public Optional<String> spuriousMarker() {
        return Optional.ofNullable(spuriousMarker);
    }

    @Override
    public String toString() {
        return "SymbolTable" + entries.keySet();
    }

    public static final class Builder {
        private final Map<String, SymbolEntry> entries = new LinkedHashMap<>();
        private final Map<Integer, Integer> threadAgents = new LinkedHashMap<>();
        private String roundMarker;
        private String schedulerVariable;
        private String spuriousMarker;

        public Builder variable(String name, Scope scope, DeclaredType type) {
            return variable(new SymbolEntry(name, scope, type));
        }

        public Builder variable(String name, Scope scope, String typeDescriptor) {
            return variable(new SymbolEntry(name, scope, TypeDescriptor.parse(typeDescriptor)));
        }

        public Builder variable(SymbolEntry entry) {
            if (entries.putIfAbsent(entry.name(), entry) != null) {
                throw new SymbolTableException("Duplicate variable: " + entry.name());
            }
            return this;
        }

        public Builder thread(int threadId, int agentId) {
            if (threadId < 0 || agentId < 0) {
                throw new SymbolTableException("Thread and agent ids must not be negative: " + threadId + " -> " + agentId);
            }
            threadAgents.put(threadId, agentId);
            return this;
        }

        public Builder roundMarker(String roundMarker) {
            this.roundMarker = blankToNull(roundMarker);
            return this;
        }

        public Builder schedulerVariable(String schedulerVariable) {
            this.schedulerVariable = blankToNull(schedulerVariable);
            return this;
        }

        public Builder spuriousMarker(String spuriousMarker) {
            this.spuriousMarker = blankToNull(spuriousMarker);
            return this;
        }

        public SymbolTable build() {
            return new SymbolTable(entries, threadAgents, roundMarker, schedulerVariable, spuriousMarker);
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value.trim();
        }
    }
}
