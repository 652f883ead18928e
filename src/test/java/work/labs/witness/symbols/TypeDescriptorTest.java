package work.labs.witness.symbols;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class TypeDescriptorTest {
    @Test
    void parsesScalars() {
        assertEquals(new DeclaredType.ScalarType(8, false), TypeDescriptor.parse("u8"));
        assertEquals(new DeclaredType.ScalarType(16, true), TypeDescriptor.parse("i16"));
        assertEquals(new DeclaredType.ScalarType(32, true), TypeDescriptor.parse("int32"));
        assertEquals(new DeclaredType.ScalarType(1, false), TypeDescriptor.parse("bool"));
    }

    @Test
    void outerDimensionComesFirst() {
        var type = TypeDescriptor.parse("u8[4][2]");
        var outer = (DeclaredType.ArrayType) type;
        assertEquals(4, outer.length());
        assertEquals(new DeclaredType.ArrayType(new DeclaredType.ScalarType(8, false), 2), outer.element());
        assertEquals("u8[4][2]", type.describe());
    }

    @Test
    void parsesTuples() {
        var type = TypeDescriptor.parse("(u8, i16[2])");
        assertEquals(new DeclaredType.TupleType(List.of(
            new DeclaredType.ScalarType(8, false),
            new DeclaredType.ArrayType(new DeclaredType.ScalarType(16, true), 2)
        )), type);
        assertEquals("(u8, i16[2])", type.describe());
    }

    @Test
    void rejectsGarbage() {
        assertThrows(SymbolTableException.class, () -> TypeDescriptor.parse("float"));
        assertThrows(SymbolTableException.class, () -> TypeDescriptor.parse("u0"));
        assertThrows(SymbolTableException.class, () -> TypeDescriptor.parse("u8["));
        assertThrows(SymbolTableException.class, () -> TypeDescriptor.parse("u8 x"));
    }
}
