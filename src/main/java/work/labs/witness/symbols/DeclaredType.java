package work.labs.witness.symbols;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Declared shape of a compiled variable: a fixed-width scalar, a fixed-arity array or a tuple.
 */
public interface DeclaredType {

    /**
     * Descriptor text accepted back by {@link TypeDescriptor#parse(String)}.
     */
    String describe();

    record ScalarType(int width, boolean signed) implements DeclaredType {
        public ScalarType {
            if (width < 1) {
                throw new IllegalArgumentException("Scalar width must be positive: " + width);
            }
        }

        @Override
        public String describe() {
            return (signed ? "i" : "u") + width;
        }
    }

    record ArrayType(DeclaredType element, int length) implements DeclaredType {
        public ArrayType {
            if (element == null) {
                throw new IllegalArgumentException("Array element type is required");
            }
            if (length < 0) {
                throw new IllegalArgumentException("Array length must not be negative: " + length);
            }
        }

        @Override
        public String describe() {
            // u8[4][2] reads as four arrays of two
            var dims = new StringBuilder("[" + length + "]");
            DeclaredType base = element;
            while (base instanceof ArrayType inner) {
                dims.append('[').append(inner.length()).append(']');
                base = inner.element();
            }
            return base.describe() + dims;
        }
    }

    record TupleType(List<DeclaredType> components) implements DeclaredType {
        public TupleType {
            components = List.copyOf(components);
        }

        @Override
        public String describe() {
            return components.stream().map(DeclaredType::describe).collect(Collectors.joining(", ", "(", ")"));
        }
    }
}
