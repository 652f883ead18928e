package work.labs.witness.assemble;

import java.util.Objects;
import java.util.Optional;
import work.labs.witness.decode.DecodedValue;

/**
 * Value of a variable in a snapshot. A variable that was never written is
 * {@link Uninitialized}, which is not the same as holding zero.
 */
public interface VariableState {

    static VariableState uninitialized() {
        return Uninitialized.INSTANCE;
    }

    static VariableState assigned(DecodedValue value) {
        return new Assigned(value);
    }

    Optional<DecodedValue> value();

    default boolean isInitialized() {
        return value().isPresent();
    }

    enum Uninitialized implements VariableState {
        INSTANCE;

        @Override
        public Optional<DecodedValue> value() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "uninitialized";
        }
    }

    record Assigned(DecodedValue current) implements VariableState {
        public Assigned {
            Objects.requireNonNull(current, "current");
        }

        @Override
        public Optional<DecodedValue> value() {
            return Optional.of(current);
        }
    }
}
