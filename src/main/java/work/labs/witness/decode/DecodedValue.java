package work.labs.witness.decode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A trace value typed against its declaration.
 */
public interface DecodedValue {

    /**
     * Compact human-readable rendering ({@code 5}, {@code true}, {@code [1, 2]}, {@code ?}).
     */
    String display();

    static DecodedValue unknown(String reason) {
        return new UnknownValue(reason);
    }

    static DecodedValue integer(int width, boolean signed, long value) {
        return new IntegerValue(width, signed, BigInteger.valueOf(value));
    }

    record IntegerValue(int width, boolean signed, BigInteger value) implements DecodedValue {
        public IntegerValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String display() {
            return value.toString();
        }
    }

    record BooleanValue(boolean value) implements DecodedValue {
        @Override
        public String display() {
            return Boolean.toString(value);
        }
    }

    /**
     * Arrays and tuples alike; element order is declaration order.
     */
    record ArrayValue(List<DecodedValue> elements) implements DecodedValue {
        public ArrayValue {
            elements = List.copyOf(elements);
        }

        public ArrayValue with(int index, DecodedValue element) {
            var copy = new ArrayList<>(elements);
            copy.set(index, element);
            return new ArrayValue(copy);
        }

        @Override
        public String display() {
            return elements.stream().map(DecodedValue::display).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    /**
     * Strings and symbolic backend tokens, passed through untouched.
     */
    record OpaqueValue(String text) implements DecodedValue {
        @Override
        public String display() {
            return text;
        }
    }

    record UnknownValue(String reason) implements DecodedValue {
        @Override
        public String display() {
            return "?";
        }
    }
}
