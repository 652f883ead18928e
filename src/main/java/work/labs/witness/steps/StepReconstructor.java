package work.labs.witness.steps;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.labs.witness.decode.DecodeOutcome;
import work.labs.witness.decode.DecodedValue;
import work.labs.witness.decode.Diagnostic;
import work.labs.witness.decode.ValueDecoder;
import work.labs.witness.symbols.SymbolTable;
import work.labs.witness.symbols.VariableRef;
import work.labs.witness.trace.StateEvent;
import work.labs.witness.trace.StateEventIterator;
import work.labs.witness.trace.TraceTrailer;

/**
 * Groups the flat event stream into logical steps.
 *
 * <p>A step ends when the thread id changes, when the scheduler enters its round-marker function,
 * or when the scheduler variable selects a different agent. Every event becomes exactly one
 * assignment of exactly one step.
 *
 * <p>When the spurious-run variable is set, the step holding that write is the last one and the
 * rest of the trace is not read.
 */
public final class StepReconstructor {
    private static final Logger LOG = LoggerFactory.getLogger(StepReconstructor.class);

    private final SymbolTable symbols;
    private final ValueDecoder decoder;

    public StepReconstructor(SymbolTable symbols) {
        this(symbols, new ValueDecoder());
    }

    public StepReconstructor(SymbolTable symbols, ValueDecoder decoder) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    /**
     * Lazily reconstructs steps. When {@code events} is a {@link StateEventIterator}, its trailer
     * decides whether the final step is complete; any other source leaves it incomplete.
     */
    public Iterator<LogicalStep> reconstruct(Iterator<StateEvent> events) {
        return new Steps(Objects.requireNonNull(events, "events"));
    }

    private Decoded decode(StateEvent event) {
        var diagnostics = new ArrayList<Diagnostic>();
        Optional<VariableRef> target = symbols.resolve(event.variable());
        DecodedValue value;
        if (target.isEmpty()) {
            String message = "variable '" + event.variable() + "' is not declared";
            diagnostics.add(new Diagnostic(Diagnostic.Kind.SCHEMA_ERROR, event.sequence(), event.variable(), message));
            value = DecodedValue.unknown(message);
        } else {
            DecodeOutcome outcome = decoder.decode(target.get().type(), event.value(), event.bits());
            for (String error : outcome.errors()) {
                diagnostics.add(new Diagnostic(Diagnostic.Kind.DECODE_ERROR, event.sequence(), event.variable(), error));
            }
            for (String warning : outcome.warnings()) {
                diagnostics.add(new Diagnostic(Diagnostic.Kind.DECODE_WARNING, event.sequence(), event.variable(), warning));
            }
            value = outcome.value();
        }
        if (!diagnostics.isEmpty()) {
            LOG.debug("State {} ({}): {}", event.sequence(), event.variable(), diagnostics);
        }
        var assignment = new Assignment(event.sequence(), event.variable(), target, value, event.location());
        return new Decoded(event, assignment, diagnostics, selection(event, value), spurious(event, value));
    }

    private boolean spurious(StateEvent event, DecodedValue value) {
        if (symbols.spuriousMarker().filter(name -> name.equals(event.variable())).isEmpty()) {
            return false;
        }
        if (value instanceof DecodedValue.BooleanValue bool) {
            return bool.value();
        }
        return value instanceof DecodedValue.IntegerValue integer && integer.value().signum() != 0;
    }

    private Optional<Integer> selection(StateEvent event, DecodedValue value) {
        return symbols.schedulerVariable()
            .filter(name -> name.equals(event.variable()))
            .filter(name -> value instanceof DecodedValue.IntegerValue)
            .map(name -> ((DecodedValue.IntegerValue) value).value())
            .filter(agent -> agent.signum() >= 0 && agent.bitLength() < Integer.SIZE)
            .map(agent -> agent.intValue());
    }

    private record Decoded(
        StateEvent event,
        Assignment assignment,
        List<Diagnostic> diagnostics,
        Optional<Integer> selectedAgent,
        boolean spurious
    ) {}

    private final class Steps implements Iterator<LogicalStep> {
        private final Iterator<StateEvent> events;
        private Decoded pending;
        private String previousFunction;
        private Integer selectedAgent;
        private boolean stopped = false;
        private int round = 0;
        private int index = 0;

        private Steps(Iterator<StateEvent> events) {
            this.events = events;
        }

        @Override
        public boolean hasNext() {
            return pending != null || (!stopped && events.hasNext());
        }

        @Override
        public LogicalStep next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Decoded first = pending != null ? pending : decode(events.next());
            pending = null;

            var assignments = new ArrayList<Assignment>();
            var diagnostics = new ArrayList<Diagnostic>();
            int threadId = first.event().threadId();
            boolean agentLocal = false;
            Decoded current = first;
            while (true) {
                if (opensRound(current.event())) {
                    round++;
                }
                previousFunction = current.event().location().function();
                current.selectedAgent().ifPresent(agent -> selectedAgent = agent);
                assignments.add(current.assignment());
                diagnostics.addAll(current.diagnostics());
                agentLocal |= current.assignment().agentLocal();

                if (current.spurious()) {
                    stop(current.event().sequence());
                    break;
                }
                if (!events.hasNext()) {
                    break;
                }
                Decoded following = decode(events.next());
                if (startsStep(following, threadId)) {
                    pending = following;
                    break;
                }
                current = following;
            }

            boolean complete = pending != null || stopped || traceComplete();
            Originator originator = agentLocal ? Originator.agent(agentFor(threadId)) : Originator.environment();
            return new LogicalStep(index++, round, originator, threadId, assignments, diagnostics, complete);
        }

        private void stop(long sequence) {
            stopped = true;
            LOG.debug("Spurious run flagged at state {}; ignoring the rest of the trace", sequence);
            if (events instanceof StateEventIterator parsed) {
                parsed.stopSpurious();
            }
        }

        private boolean startsStep(Decoded candidate, int threadId) {
            if (candidate.event().threadId() != threadId || opensRound(candidate.event())) {
                return true;
            }
            return candidate.selectedAgent().isPresent() && !candidate.selectedAgent().get().equals(selectedAgent);
        }

        /**
         * The marker function opens a round when control enters it, not on each write inside it.
         */
        private boolean opensRound(StateEvent event) {
            return symbols.roundMarker()
                .map(marker -> marker.equals(event.location().function()) && !marker.equals(previousFunction))
                .orElse(false);
        }

        private int agentFor(int threadId) {
            if (selectedAgent != null) {
                return selectedAgent;
            }
            return symbols.agentForThread(threadId).orElse(threadId);
        }

        private boolean traceComplete() {
            if (events instanceof StateEventIterator parsed) {
                return parsed.trailer().map(TraceTrailer::complete).orElse(false);
            }
            return false;
        }
    }
}
