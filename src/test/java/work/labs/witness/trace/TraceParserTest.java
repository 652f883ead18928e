package work.labs.witness.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.labs.witness.support.WitnessTestSupport.entry;
import static work.labs.witness.support.WitnessTestSupport.trace;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class TraceParserTest {
    private static final String SEPARATOR = "----------------------------------------------------\n";

    @Test
    void parsesCurrentDialectFixture() {
        var it = TraceParser.parse(trace("current.trace"), Dialect.CURRENT).iterator();
        List<StateEvent> events = drain(it);

        assertEquals(List.of(12L, 13L, 20L, 21L, 22L, 23L, 30L, 40L, 41L),
            events.stream().map(StateEvent::sequence).collect(Collectors.toList()));

        StateEvent first = events.get(0);
        assertEquals(0, first.threadId());
        assertEquals(new SourceLocation("labs.c", "init", 20), first.location());
        assertEquals("E", first.variable());
        assertEquals(15, first.lineNumber());
        assertEquals(new RawValue.Group(List.of(number("0"), number("0"), number("0"))), first.value());
        var zero = new RawBits.Run("00000000");
        assertEquals(Optional.of(new RawBits.Group(List.of(zero, zero, zero))), first.bits());

        assertEquals("E[1l]", events.get(5).variable());
        assertEquals(1, events.get(5).threadId());
        assertTrue(events.get(6).bits().isEmpty());
        assertEquals(number("200"), events.get(6).value());

        TraceTrailer trailer = it.trailer().orElseThrow();
        assertTrue(trailer.terminated());
        assertFalse(trailer.truncated());
        assertTrue(trailer.complete());
        assertEquals(Optional.of("file labs.c function main line 80 thread 0\nassertion x < 5\nx < 5"),
            trailer.violatedProperty());
        assertEquals(List.of("Assumption:\nfile labs.c line 22 function init\nE[0] < 4"), trailer.assumptions());
    }

    @Test
    void parsesLegacyDialectFixture() {
        var it = TraceParser.parse(trace("legacy.trace"), Dialect.LEGACY).iterator();
        List<StateEvent> events = drain(it);

        assertEquals(4, events.size());
        assertEquals(new SourceLocation("labs.c", "__labs_round", 40), events.get(1).location());
        assertEquals(number("5u"), events.get(2).value());
        assertTrue(it.trailer().orElseThrow().complete());
    }

    @Test
    void rejectsHeadersOfTheOtherDialect() {
        var legacyAsCurrent = assertThrows(DialectMismatchException.class,
            () -> drain(TraceParser.parse(trace("legacy.trace"), Dialect.CURRENT).iterator()));
        assertEquals(5, legacyAsCurrent.line());
        assertEquals(Dialect.CURRENT, legacyAsCurrent.expected());
        assertEquals("dialect_mismatch", legacyAsCurrent.code());

        var currentAsLegacy = assertThrows(DialectMismatchException.class,
            () -> drain(TraceParser.parse(trace("current.trace"), Dialect.LEGACY).iterator()));
        assertEquals(15, currentAsLegacy.line());
        assertEquals(Dialect.LEGACY, currentAsLegacy.expected());
    }

    @Test
    void malformedHeaderIsFatal() {
        String text = entry(1, 0, "main", "x=1")
            + "State 2 file labs.c function main line 3\n" + SEPARATOR + "  x=2\n\n"
            + entry(3, 0, "main", "x=3");
        var ex = assertThrows(LexException.class, () -> drain(TraceParser.parse(text, Dialect.CURRENT).iterator()));
        assertFalse(ex instanceof DialectMismatchException);
        assertEquals("lex_error", ex.code());
        assertEquals(5, ex.line());
    }

    @Test
    void missingSeparatorIsFatal() {
        String text = "State 1 file labs.c function main line 1 thread 0\n  x=1 ()\n\n" + entry(2, 0, "main", "x=2");
        var ex = assertThrows(LexException.class, () -> drain(TraceParser.parse(text, Dialect.CURRENT).iterator()));
        assertEquals(2, ex.line());
    }

    @Test
    void nonIncreasingSequenceIsFatal() {
        String text = entry(5, 0, "main", "x=1") + entry(5, 0, "main", "x=2");
        var ex = assertThrows(LexException.class, () -> drain(TraceParser.parse(text, Dialect.CURRENT).iterator()));
        assertEquals(5, ex.line());
    }

    @Test
    void strayLineBetweenEntriesIsFatal() {
        String text = entry(1, 0, "main", "x=1") + "garbage\n" + entry(2, 0, "main", "x=2");
        assertThrows(LexException.class, () -> drain(TraceParser.parse(text, Dialect.CURRENT).iterator()));
    }

    @Test
    void noiseIsDiscardedInsideAnEntry() {
        String text = "State 1 file labs.c function main line 1 thread 0\n"
            + "Assumption:\n  file labs.c line 2 function main\n  x > 0\n"
            + SEPARATOR
            + "(SIMULATION): tick\n"
            + "  x=1 (00000001)\n";
        var it = TraceParser.parse(text, Dialect.CURRENT).iterator();
        List<StateEvent> events = drain(it);

        assertEquals(1, events.size());
        assertEquals("x", events.get(0).variable());
        TraceTrailer trailer = it.trailer().orElseThrow();
        assertEquals(1, trailer.assumptions().size());
        assertFalse(trailer.terminated());
        assertFalse(trailer.truncated());
    }

    @Test
    void inputEndingAfterAHeaderIsTruncation() {
        String text = entry(1, 0, "main", "x=1") + "State 2 file labs.c function main line 1 thread 0\n";
        var it = TraceParser.parse(text, Dialect.CURRENT).iterator();

        assertEquals(1, drain(it).size());
        TraceTrailer trailer = it.trailer().orElseThrow();
        assertTrue(trailer.truncated());
        assertFalse(trailer.complete());
    }

    @Test
    void inputEndingInsideAnAssignmentIsTruncation() {
        String text = entry(1, 0, "main", "x=1") + "State 2 file labs.c function main line 1 thread 0\n"
            + SEPARATOR + "  pos={ 1, ";
        var it = TraceParser.parse(text, Dialect.CURRENT).iterator();

        assertEquals(1, drain(it).size());
        assertTrue(it.trailer().orElseThrow().truncated());
    }

    @Test
    void numberCutOffAtEndOfInputIsTruncation() {
        String header = "State 2 file labs.c function main line 1 thread 0\n" + SEPARATOR;
        for (String tail : List.of("  x=20", "  x=20\n", "  x=200 (1100", "  x=200 (11001000)")) {
            var it = TraceParser.parse(entry(1, 0, "main", "x=1") + header + tail, Dialect.CURRENT).iterator();

            List<StateEvent> events = drain(it);
            assertEquals(List.of(1L), events.stream().map(StateEvent::sequence).collect(Collectors.toList()), tail);
            assertTrue(it.trailer().orElseThrow().truncated(), tail);
        }
    }

    @Test
    void lastAssignmentWithClosedBitsIsKept() {
        String text = entry(1, 0, "main", "x=1")
            + "State 2 file labs.c function main line 1 thread 0\r\n" + SEPARATOR + "  x=200 ()\r\n";
        var it = TraceParser.parse(text, Dialect.CURRENT).iterator();

        List<StateEvent> events = drain(it);
        assertEquals(2, events.size());
        assertEquals(number("200"), events.get(1).value());
        assertFalse(it.trailer().orElseThrow().truncated());
    }

    @Test
    void spuriousStopEndsTheStream() {
        String text = entry(1, 0, "main", "x=1") + entry(2, 0, "main", "x=2") + "garbage\n";
        var it = TraceParser.parse(text, Dialect.CURRENT).iterator();

        assertEquals(1, it.next().sequence());
        it.stopSpurious();

        assertFalse(it.hasNext());
        TraceTrailer trailer = it.trailer().orElseThrow();
        assertTrue(trailer.spurious());
        assertTrue(trailer.complete());
        assertFalse(trailer.terminated());
    }

    @Test
    void recognizesTheSimulationSentinel() {
        var simulation = new TraceTrailer(true, false, false,
            Optional.of("file sim.c function main line 9 thread 0\nassertion __sliver_simulation__\n0"), List.of());
        assertTrue(simulation.simulation());

        var it = TraceParser.parse(trace("current.trace"), Dialect.CURRENT).iterator();
        drain(it);
        assertFalse(it.trailer().orElseThrow().simulation());
    }

    @Test
    void failureIsRaisedLazilyAndRepeated() {
        String text = entry(1, 0, "main", "x=1") + "garbage\n";
        var it = TraceParser.parse(text, Dialect.CURRENT).iterator();

        assertEquals(1, it.next().sequence());
        var first = assertThrows(LexException.class, it::hasNext);
        var second = assertThrows(LexException.class, it::hasNext);
        assertSame(first, second);
        assertTrue(it.trailer().isEmpty());
    }

    @Test
    void eachIterationRereadsTheSource() {
        var opened = new AtomicInteger();
        String text = trace("current.trace");
        StateEventStream stream = TraceParser.parse(() -> {
            opened.incrementAndGet();
            return new StringReader(text);
        }, Dialect.CURRENT);

        assertEquals(0, opened.get());
        List<StateEvent> first = drain(stream.iterator());
        List<StateEvent> second = stream.stream().collect(Collectors.toList());
        assertEquals(2, opened.get());
        assertEquals(first, second);
    }

    @Test
    void emptyTraceHasNoEvents() {
        var it = TraceParser.parse("CBMC version 5.95.1\nVERIFICATION SUCCESSFUL\n", Dialect.CURRENT).iterator();
        assertFalse(it.hasNext());
        TraceTrailer trailer = it.trailer().orElseThrow();
        assertFalse(trailer.terminated());
        assertTrue(trailer.violatedProperty().isEmpty());
    }

    @Test
    void choosesDialectFromBackendVersion() {
        assertEquals(Dialect.LEGACY, Dialect.forBackendVersion("5.4"));
        assertEquals(Dialect.LEGACY, Dialect.forBackendVersion("4.9"));
        assertEquals(Dialect.CURRENT, Dialect.forBackendVersion("5.11"));
        assertEquals(Dialect.CURRENT, Dialect.forBackendVersion("6.0.1"));
        assertEquals(Dialect.LEGACY, Dialect.from(" legacy "));
        assertThrows(IllegalArgumentException.class, () -> Dialect.from("newest"));
        assertThrows(IllegalArgumentException.class, () -> Dialect.forBackendVersion("five"));
    }

    private static List<StateEvent> drain(StateEventIterator it) {
        List<StateEvent> events = new ArrayList<>();
        while (it.hasNext()) {
            StateEvent event = it.next();
            assertNotNull(event);
            events.add(event);
        }
        assertInstanceOf(TraceTrailer.class, it.trailer().orElseThrow());
        return events;
    }

    private static RawValue number(String text) {
        return new RawValue.Literal(RawValue.Kind.NUMBER, text);
    }
}
