package work.labs.witness.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AssignmentLexerTest {
    @Test
    void readsScalarWithBits() {
        var a = AssignmentLexer.read("x = -3 (11111101)", 7);
        assertEquals("x", a.name());
        assertEquals(number("-3"), a.value());
        assertEquals(Optional.of(new RawBits.Run("11111101")), a.bits());
    }

    @Test
    void dropsGroupingSpacesInsideBits() {
        var a = AssignmentLexer.read("y=258 (00000001 00000010)", 1);
        assertEquals(Optional.of(new RawBits.Run("0000000100000010")), a.bits());
    }

    @Test
    void bitsMayBeEmptyOrMissing() {
        assertTrue(AssignmentLexer.read("x=200 ()", 1).bits().isEmpty());
        assertTrue(AssignmentLexer.read("x=200", 1).bits().isEmpty());
    }

    @Test
    void readsNestedGroups() {
        var a = AssignmentLexer.read(
            "m={ { 1, 2 }, { 3, 4 } } ({ { 00000001, 00000010 }, { 00000011, 00000100 } })", 1);
        assertEquals(new RawValue.Group(List.of(
            new RawValue.Group(List.of(number("1"), number("2"))),
            new RawValue.Group(List.of(number("3"), number("4")))
        )), a.value());
        assertEquals(Optional.of(new RawBits.Group(List.of(
            new RawBits.Group(List.of(new RawBits.Run("00000001"), new RawBits.Run("00000010"))),
            new RawBits.Group(List.of(new RawBits.Run("00000011"), new RawBits.Run("00000100")))
        ))), a.bits());
    }

    @Test
    void classifiesLiterals() {
        assertEquals(new RawValue.Literal(RawValue.Kind.BOOLEAN, "TRUE"), AssignmentLexer.read("b=TRUE (00000001)", 1).value());
        assertEquals(new RawValue.Literal(RawValue.Kind.BOOLEAN, "FALSE"), AssignmentLexer.read("b=false", 1).value());
        assertEquals(new RawValue.Literal(RawValue.Kind.STRING, "say \"hi\"\n"),
            AssignmentLexer.read("s=\"say \\\"hi\\\"\\n\" ()", 1).value());
        assertEquals(new RawValue.Literal(RawValue.Kind.SYMBOL, "NULL"), AssignmentLexer.read("p=NULL ()", 1).value());
        assertEquals(number("18446744073709551615ul"), AssignmentLexer.read("u=18446744073709551615ul", 1).value());
        assertEquals(number("1.5e3"), AssignmentLexer.read("f=1.5e3", 1).value());
    }

    @Test
    void skipsStructDesignators() {
        var a = AssignmentLexer.read("t={ .a=1, .b=2 }", 1);
        assertEquals(new RawValue.Group(List.of(number("1"), number("2"))), a.value());
    }

    @Test
    void rejectsMalformedLines() {
        var missingEquals = assertThrows(LexException.class, () -> AssignmentLexer.read("x 5 (0101)", 9));
        assertEquals(9, missingEquals.line());
        assertThrows(LexException.class, () -> AssignmentLexer.read("x={ 1, 2", 1));
        assertThrows(LexException.class, () -> AssignmentLexer.read("x=5 (0102)", 1));
        assertThrows(LexException.class, () -> AssignmentLexer.read("x=5 (0101) trailing", 1));
        assertThrows(LexException.class, () -> AssignmentLexer.read("x=\"open", 1));
        assertThrows(LexException.class, () -> AssignmentLexer.read("=5", 1));
    }

    private static RawValue number(String text) {
        return new RawValue.Literal(RawValue.Kind.NUMBER, text);
    }
}
