package work.labs.witness.steps;

import java.util.List;
import work.labs.witness.decode.Diagnostic;

/**
 * One atomic action of the emulated multi-agent system.
 *
 * @param index    position of the step in the witness, from 0
 * @param round    global round; 0 until the scheduler first opens a round
 * @param threadId backend thread that produced every assignment of the step
 * @param complete {@code false} when the trace ended before the step was known to be over
 */
public record LogicalStep(
    int index,
    int round,
    Originator originator,
    int threadId,
    List<Assignment> assignments,
    List<Diagnostic> diagnostics,
    boolean complete
) {
    public LogicalStep {
        assignments = List.copyOf(assignments);
        diagnostics = List.copyOf(diagnostics);
    }
}
