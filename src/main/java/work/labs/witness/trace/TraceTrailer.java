package work.labs.witness.trace;

import java.util.List;
import java.util.Optional;

/**
 * What the parser learned once the event stream was exhausted.
 *
 * @param terminated  the backend's {@code Violated property:} footer was reached
 * @param truncated   input ended inside a state entry
 * @param spurious    reading stopped at the simulator's spurious-run flag
 * @param violatedProperty the footer's property description, if any
 * @param assumptions discarded {@code Assumption:} blocks, verbatim
 */
public record TraceTrailer(
    boolean terminated,
    boolean truncated,
    boolean spurious,
    Optional<String> violatedProperty,
    List<String> assumptions
) {
    /** Property name the code generator asserts in simulation runs. */
    public static final String SIMULATION_PROPERTY = "__sliver_simulation__";

    public TraceTrailer {
        assumptions = List.copyOf(assumptions);
    }

    public boolean complete() {
        return !truncated && (terminated || spurious);
    }

    /**
     * The footer names the simulation sentinel rather than a property of the system.
     */
    public boolean simulation() {
        return violatedProperty.map(property -> property.contains(SIMULATION_PROPERTY)).orElse(false);
    }
}
