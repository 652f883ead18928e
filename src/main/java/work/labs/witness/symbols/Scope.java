package work.labs.witness.symbols;

import java.util.Locale;

/**
 * Where a variable lives in the compiled multi-agent program.
 */
public enum Scope {
    GLOBAL,
    AGENT_LOCAL,
    ENVIRONMENT;

    public static Scope from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Scope is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (normalized) {
            case "AGENT":
            case "LOCAL":
                return AGENT_LOCAL;
            case "ENV":
                return ENVIRONMENT;
            default:
                break;
        }
        try {
            return Scope.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported scope: " + value);
        }
    }

    /**
     * Agent-local writes decide who performed a step; shared writes never do.
     */
    public boolean isShared() {
        return this != AGENT_LOCAL;
    }
}
