package work.labs.witness.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class IntegerLiteralsTest {
    @Test
    void parsesDecimal() {
        assertEquals(BigInteger.valueOf(42), IntegerLiterals.parse("42").orElseThrow());
        assertEquals(BigInteger.valueOf(-7), IntegerLiterals.parse(" -7 ").orElseThrow());
    }

    @Test
    void ignoresTypeSuffixes() {
        assertEquals(BigInteger.valueOf(200), IntegerLiterals.parse("200u").orElseThrow());
        assertEquals(BigInteger.valueOf(3), IntegerLiterals.parse("3l").orElseThrow());
        assertEquals(new BigInteger("18446744073709551615"), IntegerLiterals.parse("18446744073709551615ul").orElseThrow());
    }

    @Test
    void parsesHex() {
        assertEquals(BigInteger.valueOf(31), IntegerLiterals.parse("0x1F").orElseThrow());
    }

    @Test
    void rejectsNonIntegers() {
        assertTrue(IntegerLiterals.parse("1.5").isEmpty());
        assertTrue(IntegerLiterals.parse("NULL").isEmpty());
        assertTrue(IntegerLiterals.parse("").isEmpty());
        assertTrue(IntegerLiterals.parse("u").isEmpty());
    }
}
