package work.labs.witness.steps;

/**
 * Who performed a logical step: one agent, or the shared environment.
 *
 * @param shared  the step only touched shared (global or environment) state
 * @param agentId acting agent; {@code -1} for environment steps
 */
public record Originator(boolean shared, int agentId) {
    private static final Originator ENVIRONMENT = new Originator(true, -1);

    public static Originator environment() {
        return ENVIRONMENT;
    }

    public static Originator agent(int agentId) {
        if (agentId < 0) {
            throw new IllegalArgumentException("Agent id must not be negative: " + agentId);
        }
        return new Originator(false, agentId);
    }

    public boolean isAgent() {
        return !shared;
    }

    @Override
    public String toString() {
        return shared ? "environment" : "agent " + agentId;
    }
}
